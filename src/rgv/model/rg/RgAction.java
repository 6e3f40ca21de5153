package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code guard: ?from ~> to}: holding the guard permits moving the region from any state
 * {@code from} to any state in the set {@code to}.
 */
public class RgAction extends RgNode {
	private final RgIdnUse guard;
	private final RgLogicalVariableBinder from;
	private final RgExpression to;

	public RgAction(SourceLocation location, RgIdnUse guard, RgLogicalVariableBinder from, RgExpression to) {
		super(location);
		this.guard = guard;
		this.from = from;
		this.to = to;
	}

	public RgIdnUse getGuard() {
		return guard;
	}

	public RgLogicalVariableBinder getFrom() {
		return from;
	}

	public RgExpression getTo() {
		return to;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(guard, from, to);
	}
}
