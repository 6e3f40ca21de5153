package rgv.model.rg;

import rgv.util.SourceLocation;

public class RgFold extends RgPredicateStatement {
	public RgFold(SourceLocation location, RgPredicateExp predicate) {
		super(location, predicate);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
