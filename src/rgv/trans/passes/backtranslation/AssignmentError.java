package rgv.trans.passes.backtranslation;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgStatement;

public class AssignmentError extends VerificationIssue {
	public AssignmentError(RgStatement statement) {
		super(statement);
	}

	public AssignmentError(RgStatement statement, ErrorClarification clarification) {
		super(statement, clarification);
	}

	public AssignmentError(RgStatement statement, String reason) {
		super(statement, reason);
	}

	@Override
	public String getDescription() {
		return "Assignment might fail";
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
