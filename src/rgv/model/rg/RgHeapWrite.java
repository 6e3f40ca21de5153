package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code [receiver.field] := rhs}
 */
public class RgHeapWrite extends RgStatement {
	private final RgLocation location;
	private final RgExpression rhs;

	public RgHeapWrite(SourceLocation sourceLocation, RgLocation location, RgExpression rhs) {
		super(sourceLocation);
		this.location = location;
		this.rhs = rhs;
	}

	public RgLocation getHeapLocation() {
		return location;
	}

	public RgExpression getRhs() {
		return rhs;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(location, rhs);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
