package rgv.model.ivl;

public class IVLPermType extends IVLType {
	public IVLPermType() {
	}

	@Override
	public <T, E extends Throwable> T accept(IVLTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return getClass().hashCode();
	}
}
