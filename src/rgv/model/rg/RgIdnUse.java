package rgv.model.rg;

import rgv.util.SourceLocation;

public class RgIdnUse extends RgIdnNode {
	public RgIdnUse(SourceLocation location, String name) {
		super(location, name);
	}
}
