package rgv.model.type;

public class TypeUtil {
	private TypeUtil() {}

	/**
	 * Two types are compatible when they are equal, when one is a reference type and the other
	 * the null type, or when either is unknown (an error has already been reported for it).
	 */
	public static boolean isCompatible(Type t1, Type t2) {
		return t1.equals(t2) ||
				(t1 instanceof RefType && t2 instanceof NullType) ||
				(t2 instanceof RefType && t1 instanceof NullType) ||
				t1 instanceof UnknownType ||
				t2 instanceof UnknownType;
	}
}
