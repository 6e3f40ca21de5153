package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

public class RgIf extends RgCompoundStatement {
	private final RgExpression condition;
	private final RgStatement thn;
	private final RgStatement els;

	public RgIf(SourceLocation location, RgExpression condition, RgStatement thn, RgStatement els) {
		super(location);
		this.condition = condition;
		this.thn = thn;
		this.els = els;
	}

	public RgExpression getCondition() {
		return condition;
	}

	public RgStatement getThen() {
		return thn;
	}

	public RgStatement getElse() {
		return els;
	}

	@Override
	public List<RgStatement> getComponents() {
		return Arrays.asList(thn, els);
	}

	@Override
	public List<RgNode> getChildren() {
		return children(condition, thn, els);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
