package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgBinOp extends RgExpression {

	public enum Category {
		ARITHMETIC,
		BOOLEAN,
		COMPARISON,
		EQUALITY,
	}

	public enum Operator {
		ADD("+", Category.ARITHMETIC),
		SUB("-", Category.ARITHMETIC),
		MOD("%", Category.ARITHMETIC),
		DIV("/", Category.ARITHMETIC),
		AND("&&", Category.BOOLEAN),
		OR("||", Category.BOOLEAN),
		EQUALS("==", Category.EQUALITY),
		LESS("<", Category.COMPARISON),
		AT_MOST("<=", Category.COMPARISON),
		GREATER(">", Category.COMPARISON),
		AT_LEAST(">=", Category.COMPARISON);

		private final String symbol;
		private final Category category;

		Operator(String symbol, Category category) {
			this.symbol = symbol;
			this.category = category;
		}

		public String getSymbol() {
			return symbol;
		}

		public Category getCategory() {
			return category;
		}
	}

	private final Operator operator;
	private final RgExpression left;
	private final RgExpression right;

	public RgBinOp(SourceLocation location, Operator operator, RgExpression left, RgExpression right) {
		super(location);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public Operator getOperator() {
		return operator;
	}

	public RgExpression getLeft() {
		return left;
	}

	public RgExpression getRight() {
		return right;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(left, right);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
