package rgv.scope;

import rgv.model.rg.RgProcedure;

public class ProcedureEntity extends Entity {
	private final RgProcedure declaration;

	public ProcedureEntity(RgProcedure declaration) {
		this.declaration = declaration;
	}

	public RgProcedure getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "procedure " + declaration.getId().getName();
	}
}
