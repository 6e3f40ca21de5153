package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code update_region on R(r, args) { body }}
 */
public class RgUpdateRegion extends RgRuleStatement {
	public RgUpdateRegion(SourceLocation location, RgPredicateExp regionPredicate, RgStatement body) {
		super(location, regionPredicate, body);
	}

	@Override
	public String getStatementName() {
		return "update_region";
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
