package rgv.model.ivl;

import java.util.Objects;

public class IVLCondExp extends IVLExpression {
	private final IVLExpression condition;
	private final IVLExpression then;
	private final IVLExpression els;

	public IVLCondExp(IVLExpression condition, IVLExpression then, IVLExpression els) {
		this.condition = condition;
		this.then = then;
		this.els = els;
	}

	public IVLExpression getCondition() {
		return condition;
	}

	public IVLExpression getThen() {
		return then;
	}

	public IVLExpression getElse() {
		return els;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLCondExp that = (IVLCondExp) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(then, that.then) &&
				Objects.equals(els, that.els);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, then, els);
	}
}
