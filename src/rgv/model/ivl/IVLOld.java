package rgv.model.ivl;

import java.util.Objects;

public class IVLOld extends IVLExpression {
	private final IVLExpression exp;

	public IVLOld(IVLExpression exp) {
		this.exp = exp;
	}

	public IVLExpression getExp() {
		return exp;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLOld that = (IVLOld) o;
		return Objects.equals(exp, that.exp);
	}

	@Override
	public int hashCode() {
		return Objects.hash(exp);
	}
}
