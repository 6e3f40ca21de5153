package rgv.model.rg;

import rgv.model.type.Type;
import rgv.model.type.VoidType;
import rgv.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the many parts of a procedure declaration.
 */
public class RgProcedureBuilder {
	private final String name;
	private final List<RgFormalArgumentDecl> formalArgs;
	private final List<RgInterferenceClause> inters;
	private final List<RgPreconditionClause> pres;
	private final List<RgPostconditionClause> posts;
	private final List<RgLocalVariableDecl> locals;
	private Type returnType;
	private RgProcedure.Atomicity atomicity;

	public RgProcedureBuilder(String name) {
		this.name = name;
		this.formalArgs = new ArrayList<>();
		this.inters = new ArrayList<>();
		this.pres = new ArrayList<>();
		this.posts = new ArrayList<>();
		this.locals = new ArrayList<>();
		this.returnType = new VoidType();
		this.atomicity = RgProcedure.Atomicity.NOT_ATOMIC;
	}

	public RgProcedureBuilder addArgument(String argName, Type type) {
		formalArgs.add(RgBuilder.arg(argName, type));
		return this;
	}

	public RgProcedureBuilder setReturnType(Type type) {
		returnType = type;
		return this;
	}

	public RgProcedureBuilder setAtomicity(RgProcedure.Atomicity atomicity) {
		this.atomicity = atomicity;
		return this;
	}

	public RgProcedureBuilder addInterference(String binder, RgExpression set, String regionId) {
		inters.add(RgBuilder.interference(binder, set, regionId));
		return this;
	}

	public RgProcedureBuilder addPrecondition(RgExpression assertion) {
		pres.add(RgBuilder.requires(assertion));
		return this;
	}

	public RgProcedureBuilder addPostcondition(RgExpression assertion) {
		posts.add(RgBuilder.ensures(assertion));
		return this;
	}

	public RgProcedureBuilder addLocal(String localName, Type type) {
		locals.add(RgBuilder.local(localName, type));
		return this;
	}

	public RgProcedure build(RgStatement... body) {
		return new RgProcedure(SourceLocation.unknown(), RgBuilder.def(name), formalArgs, returnType, inters, pres,
				posts, locals, RgBuilder.block(body), atomicity);
	}
}
