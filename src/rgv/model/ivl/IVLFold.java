package rgv.model.ivl;

import java.util.Objects;

public class IVLFold extends IVLStatement {
	private final IVLPredicateAccessPredicate acc;

	public IVLFold(IVLPredicateAccessPredicate acc) {
		this.acc = acc;
	}

	public IVLPredicateAccessPredicate getAcc() {
		return acc;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLFold that = (IVLFold) o;
		return Objects.equals(acc, that.acc);
	}

	@Override
	public int hashCode() {
		return Objects.hash(acc);
	}
}
