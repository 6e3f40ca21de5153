package rgv.model.ivl;

import java.util.List;
import java.util.Objects;

public class IVLExplicitSet extends IVLExpression {
	private final List<IVLExpression> elements;
	private final IVLType elementType;

	public IVLExplicitSet(List<IVLExpression> elements, IVLType elementType) {
		this.elements = elements;
		this.elementType = elementType;
	}

	public List<IVLExpression> getElements() {
		return elements;
	}

	public IVLType getElementType() {
		return elementType;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLExplicitSet that = (IVLExplicitSet) o;
		return Objects.equals(elements, that.elements) &&
				Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements, elementType);
	}
}
