package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgNode;

/**
 * A call or predicate instance supplies the wrong number of arguments. For region instances
 * both {@code expected} and {@code expected + 1} are acceptable.
 */
public class ArgumentCountMismatchIssue extends Issue {
	private final RgNode node;
	private final String callee;
	private final int expected;
	private final int actual;
	private final boolean outArgumentAllowed;

	public ArgumentCountMismatchIssue(RgNode node, String callee, int expected, int actual, boolean outArgumentAllowed) {
		this.node = node;
		this.callee = callee;
		this.expected = expected;
		this.actual = actual;
		this.outArgumentAllowed = outArgumentAllowed;
	}

	public RgNode getNode() {
		return node;
	}

	public String getCallee() {
		return callee;
	}

	public int getExpected() {
		return expected;
	}

	public int getActual() {
		return actual;
	}

	public boolean isOutArgumentAllowed() {
		return outArgumentAllowed;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
