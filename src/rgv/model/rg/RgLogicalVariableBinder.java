package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code ?v}: binds a logical variable to whatever value occupies this position.
 */
public class RgLogicalVariableBinder extends RgExpression {
	private final RgIdnDef id;

	public RgLogicalVariableBinder(SourceLocation location, RgIdnDef id) {
		super(location);
		this.id = id;
	}

	public RgIdnDef getId() {
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
