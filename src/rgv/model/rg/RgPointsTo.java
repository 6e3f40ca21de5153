package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code receiver.field |-> value}: permission to the location, and its current value.
 * The value may be a binder, naming the value for later use.
 */
public class RgPointsTo extends RgExpression {
	private final RgLocation location;
	private final RgExpression value;

	public RgPointsTo(SourceLocation sourceLocation, RgLocation location, RgExpression value) {
		super(sourceLocation);
		this.location = location;
		this.value = value;
	}

	public RgLocation getHeapLocation() {
		return location;
	}

	public RgExpression getValue() {
		return value;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(location, value);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
