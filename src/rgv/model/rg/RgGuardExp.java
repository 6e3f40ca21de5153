package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code G@r}: the guard G of the region instance identified by r.
 */
public class RgGuardExp extends RgExpression {
	private final RgIdnUse guard;
	private final RgIdnUse regionId;

	public RgGuardExp(SourceLocation location, RgIdnUse guard, RgIdnUse regionId) {
		super(location);
		this.guard = guard;
		this.regionId = regionId;
	}

	public RgIdnUse getGuard() {
		return guard;
	}

	public RgIdnUse getRegionId() {
		return regionId;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(guard, regionId);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
