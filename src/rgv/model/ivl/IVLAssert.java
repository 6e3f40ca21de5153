package rgv.model.ivl;

import java.util.Objects;

public class IVLAssert extends IVLStatement {
	private final IVLExpression exp;

	public IVLAssert(IVLExpression exp) {
		this.exp = exp;
	}

	public IVLExpression getExp() {
		return exp;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLAssert that = (IVLAssert) o;
		return Objects.equals(exp, that.exp);
	}

	@Override
	public int hashCode() {
		return Objects.hash(exp);
	}
}
