package rgv.model.rg;

public abstract class RgStatementVisitor<T, E extends Throwable> {
	public abstract T visit(RgBlock block) throws E;
	public abstract T visit(RgSkip skip) throws E;
	public abstract T visit(RgIf rgIf) throws E;
	public abstract T visit(RgWhile rgWhile) throws E;
	public abstract T visit(RgAssign assign) throws E;
	public abstract T visit(RgHeapRead heapRead) throws E;
	public abstract T visit(RgHeapWrite heapWrite) throws E;
	public abstract T visit(RgProcedureCall procedureCall) throws E;
	public abstract T visit(RgFold fold) throws E;
	public abstract T visit(RgUnfold unfold) throws E;
	public abstract T visit(RgInhale inhale) throws E;
	public abstract T visit(RgExhale exhale) throws E;
	public abstract T visit(RgAssume assume) throws E;
	public abstract T visit(RgAssert rgAssert) throws E;
	public abstract T visit(RgMakeAtomic makeAtomic) throws E;
	public abstract T visit(RgUpdateRegion updateRegion) throws E;
	public abstract T visit(RgUseAtomic useAtomic) throws E;
	public abstract T visit(RgOpenRegion openRegion) throws E;
}
