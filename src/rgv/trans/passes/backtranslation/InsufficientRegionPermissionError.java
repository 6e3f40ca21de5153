package rgv.trans.passes.backtranslation;

import rgv.model.rg.RgPredicateExp;

public class InsufficientRegionPermissionError extends ErrorClarification {
	private final RgPredicateExp regionPredicate;

	public InsufficientRegionPermissionError(RgPredicateExp regionPredicate) {
		super(regionPredicate);
		this.regionPredicate = regionPredicate;
	}

	public RgPredicateExp getRegionPredicate() {
		return regionPredicate;
	}

	@Override
	public String getMessage() {
		return "There might be insufficient permission to region " + regionPredicate;
	}
}
