package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgIdnUse;
import rgv.model.rg.RgStruct;

public class NoMatchingFieldIssue extends Issue {
	private final RgIdnUse field;
	private final RgStruct struct;

	public NoMatchingFieldIssue(RgIdnUse field, RgStruct struct) {
		this.field = field;
		this.struct = struct;
	}

	public RgIdnUse getField() {
		return field;
	}

	public RgStruct getStruct() {
		return struct;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
