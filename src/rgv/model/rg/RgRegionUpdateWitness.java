package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code r |=> (from, to)}: the tracking resource recording that region instance r was
 * updated from state {@code from} to state {@code to}.
 */
public class RgRegionUpdateWitness extends RgExpression {
	private final RgIdnUse regionId;
	private final RgExpression from;
	private final RgExpression to;

	public RgRegionUpdateWitness(SourceLocation location, RgIdnUse regionId, RgExpression from,
	                             RgExpression to) {
		super(location);
		this.regionId = regionId;
		this.from = from;
		this.to = to;
	}

	public RgIdnUse getRegionId() {
		return regionId;
	}

	public RgExpression getFrom() {
		return from;
	}

	public RgExpression getTo() {
		return to;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(regionId, from, to);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
