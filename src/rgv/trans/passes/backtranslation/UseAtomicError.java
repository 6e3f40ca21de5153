package rgv.trans.passes.backtranslation;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgUseAtomic;

public class UseAtomicError extends VerificationIssue {
	public UseAtomicError(RgUseAtomic useAtomic) {
		super(useAtomic);
	}

	public UseAtomicError(RgUseAtomic useAtomic, ErrorClarification clarification) {
		super(useAtomic, clarification);
	}

	public UseAtomicError(RgUseAtomic useAtomic, String reason) {
		super(useAtomic, reason);
	}

	public RgUseAtomic getUseAtomic() {
		return (RgUseAtomic) getNode();
	}

	@Override
	public String getDescription() {
		return "use_atomic might fail";
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
