package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public abstract class RgAssertionStatement extends RgGhostStatement {
	private final RgExpression assertion;

	public RgAssertionStatement(SourceLocation location, RgExpression assertion) {
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
