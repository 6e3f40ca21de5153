package rgv.scope;

public class MultipleEntity extends Entity {
	@Override
	public boolean isErroneous() {
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "multiply-declared entity";
	}
}
