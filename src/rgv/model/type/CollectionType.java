package rgv.model.type;

/**
 * A homogeneous collection, either a set or a sequence.
 */
public abstract class CollectionType extends Type {
	private final Type elementType;

	public CollectionType(Type elementType) {
		this.elementType = elementType;
	}

	public Type getElementType() {
		return elementType;
	}

	@Override
	public int hashCode() {
		return elementType.hashCode() * 31;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return elementType.equals(((CollectionType) obj).elementType);
	}
}
