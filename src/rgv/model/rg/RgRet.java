package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * The return value of the enclosing procedure.
 */
public class RgRet extends RgExpression {
	public RgRet(SourceLocation location) {
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
