package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgNode;
import rgv.model.type.Type;

public class TypeMismatchIssue extends Issue {
	private final RgNode node;
	private final Type expected;
	private final Type actual;

	public TypeMismatchIssue(RgNode node, Type expected, Type actual) {
		this.node = node;
		this.expected = expected;
		this.actual = actual;
	}

	public RgNode getNode() {
		return node;
	}

	public Type getExpected() {
		return expected;
	}

	public Type getActual() {
		return actual;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
