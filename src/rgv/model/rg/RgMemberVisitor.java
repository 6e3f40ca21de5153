package rgv.model.rg;

public abstract class RgMemberVisitor<T, E extends Throwable> {
	public abstract T visit(RgStruct struct) throws E;
	public abstract T visit(RgProcedure procedure) throws E;
	public abstract T visit(RgPredicate predicate) throws E;
	public abstract T visit(RgRegion region) throws E;
}
