package rgv.model.rg;

import rgv.util.SourceLocation;

public class RgIdnDef extends RgIdnNode {
	public RgIdnDef(SourceLocation location, String name) {
		super(location, name);
	}
}
