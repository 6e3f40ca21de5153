package rgv.trans.passes.backtranslation;

import rgv.model.rg.RgGuardExp;

public class InsufficientGuardPermissionError extends ErrorClarification {
	private final RgGuardExp guard;

	public InsufficientGuardPermissionError(RgGuardExp guard) {
		super(guard);
		this.guard = guard;
	}

	public RgGuardExp getGuard() {
		return guard;
	}

	@Override
	public String getMessage() {
		return "There might be insufficient permission to guard " + guard;
	}
}
