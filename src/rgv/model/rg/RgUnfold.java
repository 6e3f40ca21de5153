package rgv.model.rg;

import rgv.util.SourceLocation;

public class RgUnfold extends RgPredicateStatement {
	public RgUnfold(SourceLocation location, RgPredicateExp predicate) {
		super(location, predicate);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
