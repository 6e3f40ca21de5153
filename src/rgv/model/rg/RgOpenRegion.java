package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code open_region on R(r, args) { body }}
 */
public class RgOpenRegion extends RgRuleStatement {
	public RgOpenRegion(SourceLocation location, RgPredicateExp regionPredicate, RgStatement body) {
		super(location, regionPredicate, body);
	}

	@Override
	public String getStatementName() {
		return "open_region";
	}

	@Override
	public List<RgNode> getChildren() {
		return children(getRegionPredicate(), getBody());
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
