package rgv.model.ivl;

import java.util.Objects;

public class IVLLocalAssign extends IVLStatement {
	private final IVLLocalVar lhs;
	private final IVLExpression rhs;

	public IVLLocalAssign(IVLLocalVar lhs, IVLExpression rhs) {
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public IVLLocalVar getLhs() {
		return lhs;
	}

	public IVLExpression getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLLocalAssign that = (IVLLocalAssign) o;
		return Objects.equals(lhs, that.lhs) &&
				Objects.equals(rhs, that.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, rhs);
	}
}
