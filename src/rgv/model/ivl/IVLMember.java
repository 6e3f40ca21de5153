package rgv.model.ivl;

public abstract class IVLMember extends IVLNode {

	public abstract String getName();

	public abstract <T, E extends Throwable> T accept(IVLMemberVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(IVLNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
