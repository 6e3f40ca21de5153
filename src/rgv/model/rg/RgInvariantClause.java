package rgv.model.rg;

import rgv.util.SourceLocation;

public class RgInvariantClause extends RgSpecificationClause {
	public RgInvariantClause(SourceLocation location, RgExpression assertion) {
		super(location, assertion);
	}
}
