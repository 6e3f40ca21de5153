package rgv.model.rg;

import rgv.util.SourceLocation;

/**
 * Anything that introduces a name.
 */
public abstract class RgDeclaration extends RgNode {
	private final RgIdnDef id;

	public RgDeclaration(SourceLocation location, RgIdnDef id) {
		super(location);
		this.id = id;
	}

	public RgIdnDef getId() {
		return id;
	}
}
