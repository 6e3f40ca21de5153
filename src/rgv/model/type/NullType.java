package rgv.model.type;

public class NullType extends Type {
	@Override
	public int hashCode() {
		return 4;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof NullType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
