package rgv.model.ivl;

import java.util.Objects;

public class IVLLabelledOld extends IVLExpression {
	private final IVLExpression exp;
	private final String label;

	public IVLLabelledOld(IVLExpression exp, String label) {
		this.exp = exp;
		this.label = label;
	}

	public IVLExpression getExp() {
		return exp;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLLabelledOld that = (IVLLabelledOld) o;
		return Objects.equals(exp, that.exp) &&
				Objects.equals(label, that.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(exp, label);
	}
}
