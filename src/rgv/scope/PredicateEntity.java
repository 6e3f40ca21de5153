package rgv.scope;

import rgv.model.rg.RgPredicate;

public class PredicateEntity extends Entity {
	private final RgPredicate declaration;

	public PredicateEntity(RgPredicate declaration) {
		this.declaration = declaration;
	}

	public RgPredicate getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "predicate " + declaration.getId().getName();
	}
}
