package rgv.model.ivl;

import java.util.Objects;

public class IVLFieldAccess extends IVLExpression {
	private final IVLExpression receiver;
	private final IVLField field;

	public IVLFieldAccess(IVLExpression receiver, IVLField field) {
		this.receiver = receiver;
		this.field = field;
	}

	public IVLExpression getReceiver() {
		return receiver;
	}

	public IVLField getField() {
		return field;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLFieldAccess that = (IVLFieldAccess) o;
		return Objects.equals(receiver, that.receiver) &&
				Objects.equals(field, that.field);
	}

	@Override
	public int hashCode() {
		return Objects.hash(receiver, field);
	}
}
