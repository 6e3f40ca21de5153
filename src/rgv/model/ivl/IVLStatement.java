package rgv.model.ivl;

public abstract class IVLStatement extends IVLNode {

	public abstract <T, E extends Throwable> T accept(IVLStatementVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(IVLNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
