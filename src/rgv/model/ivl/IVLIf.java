package rgv.model.ivl;

import java.util.Objects;

public class IVLIf extends IVLStatement {
	private final IVLExpression condition;
	private final IVLSeqn then;
	private final IVLSeqn els;

	public IVLIf(IVLExpression condition, IVLSeqn then, IVLSeqn els) {
		this.condition = condition;
		this.then = then;
		this.els = els;
	}

	public IVLExpression getCondition() {
		return condition;
	}

	public IVLSeqn getThen() {
		return then;
	}

	public IVLSeqn getElse() {
		return els;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLIf that = (IVLIf) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(then, that.then) &&
				Objects.equals(els, that.els);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, then, els);
	}
}
