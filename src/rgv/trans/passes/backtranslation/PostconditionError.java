package rgv.trans.passes.backtranslation;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgNode;

public class PostconditionError extends VerificationIssue {
	public PostconditionError(RgNode node) {
		super(node);
	}

	public PostconditionError(RgNode node, ErrorClarification clarification) {
		super(node, clarification);
	}

	public PostconditionError(RgNode node, String reason) {
		super(node, reason);
	}

	@Override
	public String getDescription() {
		return "Postcondition might not hold";
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
