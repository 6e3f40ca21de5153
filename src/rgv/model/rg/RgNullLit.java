package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class RgNullLit extends RgExpression {
	public RgNullLit(SourceLocation location) {
		super(location);
	}

	@Override
	public List<RgNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
