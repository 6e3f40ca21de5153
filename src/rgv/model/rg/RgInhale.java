package rgv.model.rg;

import rgv.util.SourceLocation;

public class RgInhale extends RgAssertionStatement {
	public RgInhale(SourceLocation location, RgExpression assertion) {
		super(location, assertion);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
