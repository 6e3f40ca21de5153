package rgv.scope;

import rgv.model.rg.RgRegion;

public class RegionEntity extends Entity {
	private final RgRegion declaration;

	public RegionEntity(RgRegion declaration) {
		this.declaration = declaration;
	}

	public RgRegion getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "region " + declaration.getId().getName();
	}
}
