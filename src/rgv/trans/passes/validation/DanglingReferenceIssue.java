package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgIdnUse;

public class DanglingReferenceIssue extends Issue {
	private final RgIdnUse use;

	public DanglingReferenceIssue(RgIdnUse use) {
		this.use = use;
	}

	public RgIdnUse getUse() {
		return use;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
