package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;
import java.util.Optional;

/**
 * {@code [result :=] procedure(arguments)}
 */
public class RgProcedureCall extends RgStatement {
	private final RgIdnUse procedure;
	private final List<RgExpression> arguments;
	private final RgIdnUse result;

	public RgProcedureCall(SourceLocation location, RgIdnUse procedure, List<RgExpression> arguments,
	                       RgIdnUse result) {
		super(location);
		this.procedure = procedure;
		this.arguments = arguments;
		this.result = result;
	}

	public RgIdnUse getProcedure() {
		return procedure;
	}

	public List<RgExpression> getArguments() {
		return arguments;
	}

	public Optional<RgIdnUse> getResult() {
		return Optional.ofNullable(result);
	}

	@Override
	public List<RgNode> getChildren() {
		return children(procedure, arguments, result);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
