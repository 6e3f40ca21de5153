package rgv.model.type;

public class SeqType extends CollectionType {
	public SeqType(Type elementType) {
		super(elementType);
	}

	@Override
	public int hashCode() {
		return super.hashCode() * 13 + 5;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
