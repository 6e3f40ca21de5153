package rgv.model.ivl;

import java.util.List;
import java.util.Objects;

public class IVLFuncApp extends IVLExpression {
	private final String functionName;
	private final List<IVLExpression> arguments;
	private final IVLType type;

	public IVLFuncApp(String functionName, List<IVLExpression> arguments, IVLType type) {
		this.functionName = functionName;
		this.arguments = arguments;
		this.type = type;
	}

	public String getFunctionName() {
		return functionName;
	}

	public List<IVLExpression> getArguments() {
		return arguments;
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
		IVLFuncApp that = (IVLFuncApp) o;
		return Objects.equals(functionName, that.functionName) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(functionName, arguments, type);
	}
}
