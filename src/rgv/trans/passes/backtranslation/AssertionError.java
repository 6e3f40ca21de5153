package rgv.trans.passes.backtranslation;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgNode;

/**
 * An explicit {@code assert} that the verifier could not prove. Not to be confused with
 * {@link java.lang.AssertionError}.
 */
public class AssertionError extends VerificationIssue {
	public AssertionError(RgNode node) {
		super(node);
	}

	public AssertionError(RgNode node, ErrorClarification clarification) {
		super(node, clarification);
	}

	public AssertionError(RgNode node, String reason) {
		super(node, reason);
	}

	@Override
	public String getDescription() {
		return "Assertion might fail";
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
