package rgv.model.ivl;

public abstract class IVLNodeVisitor<T, E extends Throwable> {
	public abstract T visit(IVLProgram program) throws E;
	public abstract T visit(IVLMember member) throws E;
	public abstract T visit(IVLLocalVarDecl localVarDecl) throws E;
	public abstract T visit(IVLStatement statement) throws E;
	public abstract T visit(IVLExpression expression) throws E;
}
