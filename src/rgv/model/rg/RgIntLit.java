package rgv.model.rg;

import rgv.util.SourceLocation;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

public class RgIntLit extends RgExpression {
	private final BigInteger value;

	public RgIntLit(SourceLocation location, BigInteger value) {
		super(location);
		this.value = value;
	}

	public BigInteger getValue() {
		return value;
	}

	@Override
	public List<RgNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
