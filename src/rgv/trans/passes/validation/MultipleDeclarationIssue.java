package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgIdnDef;

public class MultipleDeclarationIssue extends Issue {
	private final RgIdnDef declaration;

	public MultipleDeclarationIssue(RgIdnDef declaration) {
		this.declaration = declaration;
	}

	public RgIdnDef getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
