package rgv.scope;

import rgv.model.rg.RgStruct;

public class StructEntity extends Entity {
	private final RgStruct declaration;

	public StructEntity(RgStruct declaration) {
		this.declaration = declaration;
	}

	public RgStruct getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "struct " + declaration.getId().getName();
	}
}
