package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code interference ?v in set on regionId}: the states the region may be in when the
 * procedure's atomic updates start.
 */
public class RgInterferenceClause extends RgNode {
	private final RgLogicalVariableBinder binder;
	private final RgExpression set;
	private final RgIdnUse regionId;

	public RgInterferenceClause(SourceLocation location, RgLogicalVariableBinder binder, RgExpression set,
	                            RgIdnUse regionId) {
		super(location);
		this.binder = binder;
		this.set = set;
		this.regionId = regionId;
	}

	public RgLogicalVariableBinder getBinder() {
		return binder;
	}

	public RgExpression getSet() {
		return set;
	}

	public RgIdnUse getRegionId() {
		return regionId;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(binder, set, regionId);
	}
}
