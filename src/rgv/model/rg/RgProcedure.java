package rgv.model.rg;

import rgv.model.type.Type;
import rgv.util.SourceLocation;

import java.util.List;

public class RgProcedure extends RgMember {

	public enum Atomicity {
		NOT_ATOMIC,
		PRIMITIVE_ATOMIC,
		ABSTRACT_ATOMIC,
	}

	private final List<RgFormalArgumentDecl> formalArgs;
	private final Type returnType;
	private final List<RgInterferenceClause> inters;
	private final List<RgPreconditionClause> pres;
	private final List<RgPostconditionClause> posts;
	private final List<RgLocalVariableDecl> locals;
	private final RgStatement body;
	private final Atomicity atomicity;

	public RgProcedure(SourceLocation location, RgIdnDef id, List<RgFormalArgumentDecl> formalArgs,
	                   Type returnType, List<RgInterferenceClause> inters, List<RgPreconditionClause> pres,
	                   List<RgPostconditionClause> posts, List<RgLocalVariableDecl> locals, RgStatement body,
	                   Atomicity atomicity) {
		super(location, id);
		this.formalArgs = formalArgs;
		this.returnType = returnType;
		this.inters = inters;
		this.pres = pres;
		this.posts = posts;
		this.locals = locals;
		this.body = body;
		this.atomicity = atomicity;
	}

	public List<RgFormalArgumentDecl> getFormalArgs() {
		return formalArgs;
	}

	public Type getReturnType() {
		return returnType;
	}

	public List<RgInterferenceClause> getInters() {
		return inters;
	}

	public List<RgPreconditionClause> getPres() {
		return pres;
	}

	public List<RgPostconditionClause> getPosts() {
		return posts;
	}

	public List<RgLocalVariableDecl> getLocals() {
		return locals;
	}

	public RgStatement getBody() {
		return body;
	}

	public Atomicity getAtomicity() {
		return atomicity;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(getId(), formalArgs, inters, pres, posts, locals, body);
	}

	@Override
	public <T, E extends Throwable> T accept(RgMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
