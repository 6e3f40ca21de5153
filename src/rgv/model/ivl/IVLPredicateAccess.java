package rgv.model.ivl;

import java.util.List;
import java.util.Objects;

public class IVLPredicateAccess extends IVLExpression {
	private final String predicateName;
	private final List<IVLExpression> arguments;

	public IVLPredicateAccess(String predicateName, List<IVLExpression> arguments) {
		this.predicateName = predicateName;
		this.arguments = arguments;
	}

	public String getPredicateName() {
		return predicateName;
	}

	public List<IVLExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLPredicateAccess that = (IVLPredicateAccess) o;
		return Objects.equals(predicateName, that.predicateName) &&
				Objects.equals(arguments, that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(predicateName, arguments);
	}
}
