package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * An instance of a predicate or region. Region instances take the region id, the region's
 * formal arguments and optionally one trailing out-argument denoting the region state.
 */
public class RgPredicateExp extends RgExpression {
	private final RgIdnUse predicate;
	private final List<RgExpression> arguments;

	public RgPredicateExp(SourceLocation location, RgIdnUse predicate, List<RgExpression> arguments) {
		super(location);
		this.predicate = predicate;
		this.arguments = arguments;
	}

	public RgIdnUse getPredicate() {
		return predicate;
	}

	public List<RgExpression> getArguments() {
		return arguments;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(predicate, arguments);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
