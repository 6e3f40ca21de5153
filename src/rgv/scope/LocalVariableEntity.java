package rgv.scope;

import rgv.model.rg.RgLocalVariableDecl;

public class LocalVariableEntity extends Entity {
	private final RgLocalVariableDecl declaration;

	public LocalVariableEntity(RgLocalVariableDecl declaration) {
		this.declaration = declaration;
	}

	public RgLocalVariableDecl getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "local variable " + declaration.getId().getName();
	}
}
