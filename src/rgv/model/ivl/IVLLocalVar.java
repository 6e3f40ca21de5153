package rgv.model.ivl;

import java.util.Objects;

public class IVLLocalVar extends IVLExpression {
	private final String name;
	private final IVLType type;

	public IVLLocalVar(String name, IVLType type) {
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
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
		IVLLocalVar that = (IVLLocalVar) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}
}
