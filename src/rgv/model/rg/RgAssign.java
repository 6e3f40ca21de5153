package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgAssign extends RgStatement {
	private final RgIdnUse lhs;
	private final RgExpression rhs;

	public RgAssign(SourceLocation location, RgIdnUse lhs, RgExpression rhs) {
		super(location);
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public RgIdnUse getLhs() {
		return lhs;
	}

	public RgExpression getRhs() {
		return rhs;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(lhs, rhs);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
