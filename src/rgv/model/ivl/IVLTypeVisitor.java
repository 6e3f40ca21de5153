package rgv.model.ivl;

public abstract class IVLTypeVisitor<T, E extends Throwable> {
	public abstract T visit(IVLIntType intType) throws E;
	public abstract T visit(IVLBoolType boolType) throws E;
	public abstract T visit(IVLRefType refType) throws E;
	public abstract T visit(IVLPermType permType) throws E;
	public abstract T visit(IVLSetType setType) throws E;
	public abstract T visit(IVLSeqType seqType) throws E;
}
