package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code lhs := [receiver.field]}
 */
public class RgHeapRead extends RgStatement {
	private final RgIdnUse lhs;
	private final RgLocation location;

	public RgHeapRead(SourceLocation sourceLocation, RgIdnUse lhs, RgLocation location) {
		super(sourceLocation);
		this.lhs = lhs;
		this.location = location;
	}

	public RgIdnUse getLhs() {
		return lhs;
	}

	public RgLocation getHeapLocation() {
		return location;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(lhs, location);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
