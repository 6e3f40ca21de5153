package rgv.model.ivl;

import java.util.Objects;

public class IVLBinaryOp extends IVLExpression {
	public enum Operator {
		ADD("+"),
		SUB("-"),
		MUL("*"),
		DIV("\\"),
		MOD("%"),
		AND("&&"),
		OR("||"),
		IMPLIES("==>"),
		EQ("=="),
		NE("!="),
		LT("<"),
		LE("<="),
		GT(">"),
		GE(">=");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Operator operator;
	private final IVLExpression left;
	private final IVLExpression right;

	public IVLBinaryOp(Operator operator, IVLExpression left, IVLExpression right) {
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public Operator getOperator() {
		return operator;
	}

	public IVLExpression getLeft() {
		return left;
	}

	public IVLExpression getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLBinaryOp that = (IVLBinaryOp) o;
		return Objects.equals(operator, that.operator) &&
				Objects.equals(left, that.left) &&
				Objects.equals(right, that.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, left, right);
	}
}
