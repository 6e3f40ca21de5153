package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class RgWhile extends RgCompoundStatement {
	private final RgExpression condition;
	private final List<RgInvariantClause> invariants;
	private final RgStatement body;

	public RgWhile(SourceLocation location, RgExpression condition, List<RgInvariantClause> invariants,
	               RgStatement body) {
		super(location);
		this.condition = condition;
		this.invariants = invariants;
		this.body = body;
	}

	public RgExpression getCondition() {
		return condition;
	}

	public List<RgInvariantClause> getInvariants() {
		return invariants;
	}

	public RgStatement getBody() {
		return body;
	}

	@Override
	public List<RgStatement> getComponents() {
		return Collections.singletonList(body);
	}

	@Override
	public List<RgNode> getChildren() {
		return children(condition, invariants, body);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
