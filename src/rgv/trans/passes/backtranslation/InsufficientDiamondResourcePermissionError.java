package rgv.trans.passes.backtranslation;

import rgv.model.rg.RgIdnUse;
import rgv.model.rg.RgPredicateExp;

public class InsufficientDiamondResourcePermissionError extends ErrorClarification {
	private final RgPredicateExp regionPredicate;
	private final RgIdnUse regionId;

	public InsufficientDiamondResourcePermissionError(RgPredicateExp regionPredicate, RgIdnUse regionId) {
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
		return "There might be insufficient permission to the diamond resource of region " + regionId.getName();
	}
}
