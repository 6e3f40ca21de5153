package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * The built-in sets {@code Int} and {@code Nat}.
 */
public class RgNumberSet extends RgExpression {

	public enum Kind {
		INT,
		NAT,
	}

	private final Kind kind;

	public RgNumberSet(SourceLocation location, Kind kind) {
		super(location);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
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
