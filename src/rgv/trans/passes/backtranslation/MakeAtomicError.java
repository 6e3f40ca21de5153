package rgv.trans.passes.backtranslation;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgMakeAtomic;

public class MakeAtomicError extends VerificationIssue {
	public MakeAtomicError(RgMakeAtomic makeAtomic) {
		super(makeAtomic);
	}

	public MakeAtomicError(RgMakeAtomic makeAtomic, ErrorClarification clarification) {
		super(makeAtomic, clarification);
	}

	public MakeAtomicError(RgMakeAtomic makeAtomic, String reason) {
		super(makeAtomic, reason);
	}

	public RgMakeAtomic getMakeAtomic() {
		return (RgMakeAtomic) getNode();
	}

	@Override
	public String getDescription() {
		return "make_atomic might fail";
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
