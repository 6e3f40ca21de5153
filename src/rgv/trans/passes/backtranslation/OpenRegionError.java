package rgv.trans.passes.backtranslation;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgOpenRegion;

public class OpenRegionError extends VerificationIssue {
	public OpenRegionError(RgOpenRegion openRegion) {
		super(openRegion);
	}

	public OpenRegionError(RgOpenRegion openRegion, ErrorClarification clarification) {
		super(openRegion, clarification);
	}

	public OpenRegionError(RgOpenRegion openRegion, String reason) {
		super(openRegion, reason);
	}

	public RgOpenRegion getOpenRegion() {
		return (RgOpenRegion) getNode();
	}

	@Override
	public String getDescription() {
		return "open_region might fail";
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
