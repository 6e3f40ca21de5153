package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgExpression;

public class UntypableExpressionIssue extends Issue {
	private final RgExpression expression;

	public UntypableExpressionIssue(RgExpression expression) {
		this.expression = expression;
	}

	public RgExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
