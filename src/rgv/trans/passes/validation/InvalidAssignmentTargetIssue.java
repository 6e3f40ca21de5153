package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgIdnUse;

public class InvalidAssignmentTargetIssue extends Issue {
	private final RgIdnUse target;

	public InvalidAssignmentTargetIssue(RgIdnUse target) {
		this.target = target;
	}

	public RgIdnUse getTarget() {
		return target;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
