package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * A statement built from other statements. It is ghost exactly when all of its components are.
 */
public abstract class RgCompoundStatement extends RgStatement {
	public RgCompoundStatement(SourceLocation location) {
		super(location);
	}

	public abstract List<RgStatement> getComponents();
}
