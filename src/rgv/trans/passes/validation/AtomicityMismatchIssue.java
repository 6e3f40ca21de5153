package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgStatement;
import rgv.trans.passes.atomicity.AtomicityKind;

public class AtomicityMismatchIssue extends Issue {
	private final RgStatement statement;
	private final AtomicityKind expected;
	private final AtomicityKind actual;

	public AtomicityMismatchIssue(RgStatement statement, AtomicityKind expected, AtomicityKind actual) {
		this.statement = statement;
		this.expected = expected;
		this.actual = actual;
	}

	public RgStatement getStatement() {
		return statement;
	}

	public AtomicityKind getExpected() {
		return expected;
	}

	public AtomicityKind getActual() {
		return actual;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
