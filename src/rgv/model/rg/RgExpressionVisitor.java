package rgv.model.rg;

public abstract class RgExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(RgIntLit intLit) throws E;
	public abstract T visit(RgBoolLit boolLit) throws E;
	public abstract T visit(RgNullLit nullLit) throws E;
	public abstract T visit(RgRet ret) throws E;
	public abstract T visit(RgIdnExp idnExp) throws E;
	public abstract T visit(RgBinOp binOp) throws E;
	public abstract T visit(RgNot not) throws E;
	public abstract T visit(RgConditional conditional) throws E;
	public abstract T visit(RgNumberSet numberSet) throws E;
	public abstract T visit(RgExplicitSet explicitSet) throws E;
	public abstract T visit(RgExplicitSeq explicitSeq) throws E;
	public abstract T visit(RgSetComprehension setComprehension) throws E;
	public abstract T visit(RgSetContains setContains) throws E;
	public abstract T visit(RgSeqSize seqSize) throws E;
	public abstract T visit(RgSeqHead seqHead) throws E;
	public abstract T visit(RgSeqTail seqTail) throws E;
	public abstract T visit(RgUnfolding unfolding) throws E;
	public abstract T visit(RgPointsTo pointsTo) throws E;
	public abstract T visit(RgPredicateExp predicateExp) throws E;
	public abstract T visit(RgGuardExp guardExp) throws E;
	public abstract T visit(RgDiamond diamond) throws E;
	public abstract T visit(RgRegionUpdateWitness regionUpdateWitness) throws E;
	public abstract T visit(RgLogicalVariableBinder logicalVariableBinder) throws E;
}
