package rgv.scope;

import rgv.model.rg.RgGuardDecl;
import rgv.model.rg.RgRegion;

public class GuardEntity extends Entity {
	private final RgGuardDecl declaration;
	private final RgRegion region;

	public GuardEntity(RgGuardDecl declaration, RgRegion region) {
		this.declaration = declaration;
		this.region = region;
	}

	public RgGuardDecl getDeclaration() {
		return declaration;
	}

	public RgRegion getRegion() {
		return region;
	}

	/**
	 * @return the program-wide key this guard is bound under, e.g. {@code incr@Cell}
	 */
	public String getQualifiedName() {
		return qualifiedName(declaration.getId().getName(), region.getId().getName());
	}

	public static String qualifiedName(String guardName, String regionName) {
		return guardName + "@" + regionName;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "guard " + getQualifiedName();
	}
}
