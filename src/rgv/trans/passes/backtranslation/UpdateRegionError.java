package rgv.trans.passes.backtranslation;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgUpdateRegion;

public class UpdateRegionError extends VerificationIssue {
	public UpdateRegionError(RgUpdateRegion updateRegion) {
		super(updateRegion);
	}

	public UpdateRegionError(RgUpdateRegion updateRegion, ErrorClarification clarification) {
		super(updateRegion, clarification);
	}

	public UpdateRegionError(RgUpdateRegion updateRegion, String reason) {
		super(updateRegion, reason);
	}

	public RgUpdateRegion getUpdateRegion() {
		return (RgUpdateRegion) getNode();
	}

	@Override
	public String getDescription() {
		return "update_region might fail";
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
