package rgv.model.ivl;

/**
 * Expressions double as assertions: accessibility predicates denote permission to a location.
 */
public abstract class IVLExpression extends IVLNode {

	public abstract <T, E extends Throwable> T accept(IVLExpressionVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(IVLNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
