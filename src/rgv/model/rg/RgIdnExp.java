package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgIdnExp extends RgExpression {
	private final RgIdnUse id;

	public RgIdnExp(SourceLocation location, RgIdnUse id) {
		super(location);
		this.id = id;
	}

	public RgIdnUse getId() {
		return id;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(id);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
