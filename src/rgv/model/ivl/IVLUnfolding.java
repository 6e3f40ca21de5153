package rgv.model.ivl;

import java.util.Objects;

public class IVLUnfolding extends IVLExpression {
	private final IVLPredicateAccessPredicate acc;
	private final IVLExpression body;

	public IVLUnfolding(IVLPredicateAccessPredicate acc, IVLExpression body) {
		this.acc = acc;
		this.body = body;
	}

	public IVLPredicateAccessPredicate getAcc() {
		return acc;
	}

	public IVLExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLUnfolding that = (IVLUnfolding) o;
		return Objects.equals(acc, that.acc) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(acc, body);
	}
}
