package rgv.model.ivl;

import java.util.Objects;

/**
 * The result of the enclosing function, in its postconditions.
 */
public class IVLResult extends IVLExpression {
	private final IVLType type;

	public IVLResult(IVLType type) {
		this.type = type;
	}

	public IVLType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLResult that = (IVLResult) o;
		return Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type);
	}
}
