package rgv.model.rg;

import rgv.util.SourceLocation;

public abstract class RgStatement extends RgNode {
	public RgStatement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E;
}
