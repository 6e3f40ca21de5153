package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * A fold or unfold of a predicate or region instance.
 */
public abstract class RgPredicateStatement extends RgGhostStatement {
	private final RgPredicateExp predicate;

	public RgPredicateStatement(SourceLocation location, RgPredicateExp predicate) {
		super(location);
		this.predicate = predicate;
	}

	public RgPredicateExp getPredicate() {
		return predicate;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(predicate);
	}
}
