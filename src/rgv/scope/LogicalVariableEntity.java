package rgv.scope;

import rgv.model.rg.RgLogicalVariableBinder;

public class LogicalVariableEntity extends Entity {
	private final RgLogicalVariableBinder declaration;

	public LogicalVariableEntity(RgLogicalVariableBinder declaration) {
		this.declaration = declaration;
	}

	public RgLogicalVariableBinder getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "logical variable " + declaration.getId().getName();
	}
}
