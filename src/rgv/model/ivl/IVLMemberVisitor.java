package rgv.model.ivl;

public abstract class IVLMemberVisitor<T, E extends Throwable> {
	public abstract T visit(IVLField field) throws E;
	public abstract T visit(IVLPredicate predicate) throws E;
	public abstract T visit(IVLFunction function) throws E;
	public abstract T visit(IVLMethod method) throws E;
}
