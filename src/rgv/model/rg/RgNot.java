package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgNot extends RgExpression {
	private final RgExpression operand;

	public RgNot(SourceLocation location, RgExpression operand) {
		super(location);
		this.operand = operand;
	}

	public RgExpression getOperand() {
		return operand;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(operand);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
