package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgIdnUse;

/**
 * A name is used in a position its entity cannot occupy, e.g. calling a region or using a
 * procedure as a value.
 */
public class InvalidReferenceIssue extends Issue {
	public enum Reason {
		NOT_CALLABLE,
		PROCEDURE_AS_VALUE,
		NOT_INSTANTIABLE_HERE,
	}

	private final RgIdnUse use;
	private final Reason reason;

	public InvalidReferenceIssue(RgIdnUse use, Reason reason) {
		this.use = use;
		this.reason = reason;
	}

	public RgIdnUse getUse() {
		return use;
	}

	public Reason getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
