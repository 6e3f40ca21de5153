package rgv.trans.passes.backtranslation;

import rgv.model.rg.RgNode;

public class IllegalRegionStateChangeError extends ErrorClarification {

	public IllegalRegionStateChangeError(RgNode node) {
		super(node);
	}

	@Override
	public String getMessage() {
		return "The region state might be changed in a way that is not permitted";
	}
}
