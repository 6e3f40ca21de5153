package rgv.model.ivl;

public abstract class IVLExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(IVLIntLit intLit) throws E;
	public abstract T visit(IVLBoolLit boolLit) throws E;
	public abstract T visit(IVLNullLit nullLit) throws E;
	public abstract T visit(IVLLocalVar localVar) throws E;
	public abstract T visit(IVLResult result) throws E;
	public abstract T visit(IVLFieldAccess fieldAccess) throws E;
	public abstract T visit(IVLFieldAccessPredicate fieldAccessPredicate) throws E;
	public abstract T visit(IVLPredicateAccess predicateAccess) throws E;
	public abstract T visit(IVLPredicateAccessPredicate predicateAccessPredicate) throws E;
	public abstract T visit(IVLFullPerm fullPerm) throws E;
	public abstract T visit(IVLNoPerm noPerm) throws E;
	public abstract T visit(IVLCurrentPerm currentPerm) throws E;
	public abstract T visit(IVLFuncApp funcApp) throws E;
	public abstract T visit(IVLUnaryOp unaryOp) throws E;
	public abstract T visit(IVLBinaryOp binaryOp) throws E;
	public abstract T visit(IVLCondExp condExp) throws E;
	public abstract T visit(IVLOld old) throws E;
	public abstract T visit(IVLLabelledOld labelledOld) throws E;
	public abstract T visit(IVLExplicitSet explicitSet) throws E;
	public abstract T visit(IVLExplicitSeq explicitSeq) throws E;
	public abstract T visit(IVLSetContains setContains) throws E;
	public abstract T visit(IVLSeqLength seqLength) throws E;
	public abstract T visit(IVLSeqIndex seqIndex) throws E;
	public abstract T visit(IVLSeqDrop seqDrop) throws E;
	public abstract T visit(IVLUnfolding unfolding) throws E;
	public abstract T visit(IVLForall forall) throws E;
}
