package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgConditional extends RgExpression {
	private final RgExpression condition;
	private final RgExpression thn;
	private final RgExpression els;

	public RgConditional(SourceLocation location, RgExpression condition, RgExpression thn, RgExpression els) {
		super(location);
		this.condition = condition;
		this.thn = thn;
		this.els = els;
	}

	public RgExpression getCondition() {
		return condition;
	}

	public RgExpression getThen() {
		return thn;
	}

	public RgExpression getElse() {
		return els;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(condition, thn, els);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
