package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgSeqTail extends RgExpression {
	private final RgExpression seq;

	public RgSeqTail(SourceLocation location, RgExpression seq) {
		super(location);
		this.seq = seq;
	}

	public RgExpression getSeq() {
		return seq;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(seq);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
