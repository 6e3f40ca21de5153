package rgv.util;

/**
 *
 * A common base for program tree nodes, which must all be traceable to a
 * position for diagnostics.
 *
 */
public abstract class SourceLocatable implements Origin {

	public abstract SourceLocation getLocation();

	@Override
	public <T, E extends Throwable> T accept(OriginVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
