package rgv.model.type;

public abstract class TypeVisitor<T, E extends Throwable> {
	public abstract T visit(IntType intType) throws E;
	public abstract T visit(BoolType boolType) throws E;
	public abstract T visit(VoidType voidType) throws E;
	public abstract T visit(NullType nullType) throws E;
	public abstract T visit(RefType refType) throws E;
	public abstract T visit(RegionIdType regionIdType) throws E;
	public abstract T visit(SetType setType) throws E;
	public abstract T visit(SeqType seqType) throws E;
	public abstract T visit(UnknownType unknownType) throws E;
}
