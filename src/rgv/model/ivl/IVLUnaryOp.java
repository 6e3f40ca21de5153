package rgv.model.ivl;

import java.util.Objects;

public class IVLUnaryOp extends IVLExpression {
	public enum Operator {
		NOT("!"),
		MINUS("-");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Operator operator;
	private final IVLExpression operand;

	public IVLUnaryOp(Operator operator, IVLExpression operand) {
		this.operator = operator;
		this.operand = operand;
	}

	public Operator getOperator() {
		return operator;
	}

	public IVLExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLUnaryOp that = (IVLUnaryOp) o;
		return Objects.equals(operator, that.operator) &&
				Objects.equals(operand, that.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operand);
	}
}
