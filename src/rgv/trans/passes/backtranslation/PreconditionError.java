package rgv.trans.passes.backtranslation;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgNode;

public class PreconditionError extends VerificationIssue {
	public PreconditionError(RgNode node) {
		super(node);
	}

	public PreconditionError(RgNode node, ErrorClarification clarification) {
		super(node, clarification);
	}

	public PreconditionError(RgNode node, String reason) {
		super(node, reason);
	}

	@Override
	public String getDescription() {
		return "The precondition of a call might not hold";
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
