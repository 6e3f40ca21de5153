package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgUnfolding extends RgExpression {
	private final RgPredicateExp predicate;
	private final RgExpression body;

	public RgUnfolding(SourceLocation location, RgPredicateExp predicate, RgExpression body) {
		super(location);
		this.predicate = predicate;
		this.body = body;
	}

	public RgPredicateExp getPredicate() {
		return predicate;
	}

	public RgExpression getBody() {
		return body;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(predicate, body);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
