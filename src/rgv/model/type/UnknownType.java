package rgv.model.type;

/**
 * The type of an expression that could not be typed. It is compatible with every type,
 * so an error is reported once, where it originates.
 */
public class UnknownType extends Type {
	@Override
	public int hashCode() {
		return 6;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof UnknownType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
