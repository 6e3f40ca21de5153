package rgv.model.ivl;

import java.util.List;
import java.util.Objects;

public class IVLForall extends IVLExpression {
	private final List<IVLLocalVarDecl> variables;
	private final IVLExpression body;

	public IVLForall(List<IVLLocalVarDecl> variables, IVLExpression body) {
		this.variables = variables;
		this.body = body;
	}

	public List<IVLLocalVarDecl> getVariables() {
		return variables;
	}

	public IVLExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLForall that = (IVLForall) o;
		return Objects.equals(variables, that.variables) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variables, body);
	}
}
