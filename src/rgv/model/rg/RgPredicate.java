package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgPredicate extends RgMember {
	private final List<RgFormalArgumentDecl> formalArgs;
	private final RgExpression body;

	public RgPredicate(SourceLocation location, RgIdnDef id, List<RgFormalArgumentDecl> formalArgs,
	                   RgExpression body) {
		super(location, id);
		this.formalArgs = formalArgs;
		this.body = body;
	}

	public List<RgFormalArgumentDecl> getFormalArgs() {
		return formalArgs;
	}

	public RgExpression getBody() {
		return body;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(getId(), formalArgs, body);
	}

	@Override
	public <T, E extends Throwable> T accept(RgMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
