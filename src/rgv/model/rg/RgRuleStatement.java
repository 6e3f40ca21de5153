package rgv.model.rg;

import rgv.util.SourceLocation;

/**
 * One of the four atomicity proof rules. Each names a region instance by a region predicate
 * (which must not carry an out-argument) and wraps a body.
 */
public abstract class RgRuleStatement extends RgStatement {
	private final RgPredicateExp regionPredicate;
	private final RgStatement body;

	public RgRuleStatement(SourceLocation location, RgPredicateExp regionPredicate, RgStatement body) {
		super(location);
		this.regionPredicate = regionPredicate;
		this.body = body;
	}

	public RgPredicateExp getRegionPredicate() {
		return regionPredicate;
	}

	public RgStatement getBody() {
		return body;
	}

	public abstract String getStatementName();

	@Override
	public String toString() {
		return getStatementName() + " " + getLocation().prettyString();
	}
}
