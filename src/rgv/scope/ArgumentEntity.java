package rgv.scope;

import rgv.model.rg.RgFormalArgumentDecl;

public class ArgumentEntity extends Entity {
	private final RgFormalArgumentDecl declaration;

	public ArgumentEntity(RgFormalArgumentDecl declaration) {
		this.declaration = declaration;
	}

	public RgFormalArgumentDecl getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "argument " + declaration.getId().getName();
	}
}
