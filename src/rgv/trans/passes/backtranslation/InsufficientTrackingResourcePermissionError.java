package rgv.trans.passes.backtranslation;

import rgv.model.rg.RgIdnUse;
import rgv.model.rg.RgPredicateExp;

/**
 * The step-from/step-to pair recording a region transition is not held.
 */
public class InsufficientTrackingResourcePermissionError extends ErrorClarification {
	private final RgPredicateExp regionPredicate;
	private final RgIdnUse regionId;

	public InsufficientTrackingResourcePermissionError(RgPredicateExp regionPredicate, RgIdnUse regionId) {
		super(regionPredicate);
		this.regionPredicate = regionPredicate;
		this.regionId = regionId;
	}

	public RgPredicateExp getRegionPredicate() {
		return regionPredicate;
	}

	public RgIdnUse getRegionId() {
		return regionId;
	}

	@Override
	public String getMessage() {
		return "There might be insufficient permission to the tracking resource of region " + regionId.getName() +
				" (" + regionPredicate + ")";
	}
}
