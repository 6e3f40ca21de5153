package rgv.model.ivl;

import java.util.Objects;

public class IVLSetContains extends IVLExpression {
	private final IVLExpression element;
	private final IVLExpression set;

	public IVLSetContains(IVLExpression element, IVLExpression set) {
		this.element = element;
		this.set = set;
	}

	public IVLExpression getElement() {
		return element;
	}

	public IVLExpression getSet() {
		return set;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLSetContains that = (IVLSetContains) o;
		return Objects.equals(element, that.element) &&
				Objects.equals(set, that.set);
	}

	@Override
	public int hashCode() {
		return Objects.hash(element, set);
	}
}
