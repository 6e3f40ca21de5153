package rgv.model.ivl;

public abstract class IVLStatementVisitor<T, E extends Throwable> {
	public abstract T visit(IVLSeqn seqn) throws E;
	public abstract T visit(IVLInhale inhale) throws E;
	public abstract T visit(IVLExhale exhale) throws E;
	public abstract T visit(IVLAssert ivlAssert) throws E;
	public abstract T visit(IVLFold fold) throws E;
	public abstract T visit(IVLUnfold unfold) throws E;
	public abstract T visit(IVLLabel label) throws E;
	public abstract T visit(IVLIf ivlIf) throws E;
	public abstract T visit(IVLWhile ivlWhile) throws E;
	public abstract T visit(IVLLocalAssign localAssign) throws E;
	public abstract T visit(IVLFieldAssign fieldAssign) throws E;
	public abstract T visit(IVLMethodCall methodCall) throws E;
	public abstract T visit(IVLComment comment) throws E;
}
