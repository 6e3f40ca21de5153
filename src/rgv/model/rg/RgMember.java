package rgv.model.rg;

import rgv.util.SourceLocation;

/**
 * A top-level declaration. Every member opens its own scope.
 */
public abstract class RgMember extends RgDeclaration {
	public RgMember(SourceLocation location, RgIdnDef id) {
		super(location, id);
	}

	public abstract <T, E extends Throwable> T accept(RgMemberVisitor<T, E> v) throws E;
}
