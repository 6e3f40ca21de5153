package rgv.model.ivl;

import java.util.List;
import java.util.Objects;

public class IVLMethodCall extends IVLStatement {
	private final String methodName;
	private final List<IVLExpression> arguments;
	private final List<IVLLocalVar> targets;

	public IVLMethodCall(String methodName, List<IVLExpression> arguments, List<IVLLocalVar> targets) {
		this.methodName = methodName;
		this.arguments = arguments;
		this.targets = targets;
	}

	public String getMethodName() {
		return methodName;
	}

	public List<IVLExpression> getArguments() {
		return arguments;
	}

	public List<IVLLocalVar> getTargets() {
		return targets;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLMethodCall that = (IVLMethodCall) o;
		return Objects.equals(methodName, that.methodName) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(targets, that.targets);
	}

	@Override
	public int hashCode() {
		return Objects.hash(methodName, arguments, targets);
	}
}
