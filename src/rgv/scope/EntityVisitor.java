package rgv.scope;

public abstract class EntityVisitor<T, E extends Throwable> {
	public abstract T visit(StructEntity structEntity) throws E;
	public abstract T visit(ProcedureEntity procedureEntity) throws E;
	public abstract T visit(PredicateEntity predicateEntity) throws E;
	public abstract T visit(RegionEntity regionEntity) throws E;
	public abstract T visit(GuardEntity guardEntity) throws E;
	public abstract T visit(ArgumentEntity argumentEntity) throws E;
	public abstract T visit(LocalVariableEntity localVariableEntity) throws E;
	public abstract T visit(LogicalVariableEntity logicalVariableEntity) throws E;
	public abstract T visit(UnknownEntity unknownEntity) throws E;
	public abstract T visit(MultipleEntity multipleEntity) throws E;
}
