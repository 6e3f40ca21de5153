package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class RgBoolLit extends RgExpression {
	private final boolean value;

	public RgBoolLit(SourceLocation location, boolean value) {
		super(location);
		this.value = value;
	}

	public boolean getValue() {
		return value;
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
