package rgv.model.ivl;

import java.util.List;
import java.util.Objects;

public class IVLWhile extends IVLStatement {
	private final IVLExpression condition;
	private final List<IVLExpression> invariants;
	private final IVLSeqn body;

	public IVLWhile(IVLExpression condition, List<IVLExpression> invariants, IVLSeqn body) {
		this.condition = condition;
		this.invariants = invariants;
		this.body = body;
	}

	public IVLExpression getCondition() {
		return condition;
	}

	public List<IVLExpression> getInvariants() {
		return invariants;
	}

	public IVLSeqn getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLWhile that = (IVLWhile) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(invariants, that.invariants) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, invariants, body);
	}
}
