package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgIdnUse;

/**
 * No region instance in the enclosing declaration names the given region id, so guards and
 * interference on it cannot be attributed to a region.
 */
public class UnresolvedRegionIssue extends Issue {
	private final RgIdnUse regionId;

	public UnresolvedRegionIssue(RgIdnUse regionId) {
		this.regionId = regionId;
	}

	public RgIdnUse getRegionId() {
		return regionId;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
