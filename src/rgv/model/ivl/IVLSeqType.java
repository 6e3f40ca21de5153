package rgv.model.ivl;

import java.util.Objects;

public class IVLSeqType extends IVLType {
	private final IVLType elementType;

	public IVLSeqType(IVLType elementType) {
		this.elementType = elementType;
	}

	public IVLType getElementType() {
		return elementType;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLSeqType that = (IVLSeqType) o;
		return Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elementType);
	}
}
