package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code <D>(r)}: the right to perform one atomic update of region instance r.
 */
public class RgDiamond extends RgExpression {
	private final RgIdnUse regionId;

	public RgDiamond(SourceLocation location, RgIdnUse regionId) {
		super(location);
		this.regionId = regionId;
	}

	public RgIdnUse getRegionId() {
		return regionId;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(regionId);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
