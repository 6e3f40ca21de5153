package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code element in set}
 */
public class RgSetContains extends RgExpression {
	private final RgExpression element;
	private final RgExpression set;

	public RgSetContains(SourceLocation location, RgExpression element, RgExpression set) {
		super(location);
		this.element = element;
		this.set = set;
	}

	public RgExpression getElement() {
		return element;
	}

	public RgExpression getSet() {
		return set;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(element, set);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
