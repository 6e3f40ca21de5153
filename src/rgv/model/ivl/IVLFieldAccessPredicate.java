package rgv.model.ivl;

import java.util.Objects;

public class IVLFieldAccessPredicate extends IVLExpression {
	private final IVLFieldAccess location;
	private final IVLExpression permission;

	public IVLFieldAccessPredicate(IVLFieldAccess location, IVLExpression permission) {
		this.location = location;
		this.permission = permission;
	}

	public IVLFieldAccess getLocation() {
		return location;
	}

	public IVLExpression getPermission() {
		return permission;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLFieldAccessPredicate that = (IVLFieldAccessPredicate) o;
		return Objects.equals(location, that.location) &&
				Objects.equals(permission, that.permission);
	}

	@Override
	public int hashCode() {
		return Objects.hash(location, permission);
	}
}
