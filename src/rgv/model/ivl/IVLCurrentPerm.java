package rgv.model.ivl;

import java.util.Objects;

/**
 * The permission currently held to a field or predicate location.
 */
public class IVLCurrentPerm extends IVLExpression {
	private final IVLExpression resource;

	public IVLCurrentPerm(IVLExpression resource) {
		this.resource = resource;
	}

	public IVLExpression getResource() {
		return resource;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLCurrentPerm that = (IVLCurrentPerm) o;
		return Objects.equals(resource, that.resource);
	}

	@Override
	public int hashCode() {
		return Objects.hash(resource);
	}
}
