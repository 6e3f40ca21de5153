package rgv.model.type;

public class SetType extends CollectionType {
	public SetType(Type elementType) {
		super(elementType);
	}

	@Override
	public int hashCode() {
		return super.hashCode() * 11 + 5;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
