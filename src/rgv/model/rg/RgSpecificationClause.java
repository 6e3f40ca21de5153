package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public abstract class RgSpecificationClause extends RgNode {
	private final RgExpression assertion;

	public RgSpecificationClause(SourceLocation location, RgExpression assertion) {
		super(location);
		this.assertion = assertion;
	}

	public RgExpression getAssertion() {
		return assertion;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(assertion);
	}
}
