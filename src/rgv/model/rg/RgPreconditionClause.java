package rgv.model.rg;

import rgv.util.SourceLocation;

public class RgPreconditionClause extends RgSpecificationClause {
	public RgPreconditionClause(SourceLocation location, RgExpression assertion) {
		super(location, assertion);
	}
}
