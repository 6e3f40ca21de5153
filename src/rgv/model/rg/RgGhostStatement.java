package rgv.model.rg;

import rgv.util.SourceLocation;

/**
 * A verification-only statement, with no effect on the executed program.
 */
public abstract class RgGhostStatement extends RgStatement {
	public RgGhostStatement(SourceLocation location) {
		super(location);
	}
}
