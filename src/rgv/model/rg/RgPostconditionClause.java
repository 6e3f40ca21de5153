package rgv.model.rg;

import rgv.util.SourceLocation;

public class RgPostconditionClause extends RgSpecificationClause {
	public RgPostconditionClause(SourceLocation location, RgExpression assertion) {
		super(location, assertion);
	}
}
