package rgv.model.ivl;

import java.util.Objects;

public class IVLPredicateAccessPredicate extends IVLExpression {
	private final IVLPredicateAccess location;
	private final IVLExpression permission;

	public IVLPredicateAccessPredicate(IVLPredicateAccess location, IVLExpression permission) {
		this.location = location;
		this.permission = permission;
	}

	public IVLPredicateAccess getLocation() {
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
		IVLPredicateAccessPredicate that = (IVLPredicateAccessPredicate) o;
		return Objects.equals(location, that.location) &&
				Objects.equals(permission, that.permission);
	}

	@Override
	public int hashCode() {
		return Objects.hash(location, permission);
	}
}
