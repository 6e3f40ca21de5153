package rgv.model.ivl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class IVLMethod extends IVLMember {
	private final String name;
	private final List<IVLLocalVarDecl> formalArgs;
	private final List<IVLLocalVarDecl> formalReturns;
	private final List<IVLExpression> pres;
	private final List<IVLExpression> posts;
	private final List<IVLLocalVarDecl> locals;
	private final Optional<IVLSeqn> body;

	public IVLMethod(String name, List<IVLLocalVarDecl> formalArgs, List<IVLLocalVarDecl> formalReturns, List<IVLExpression> pres, List<IVLExpression> posts, List<IVLLocalVarDecl> locals, Optional<IVLSeqn> body) {
		this.name = name;
		this.formalArgs = formalArgs;
		this.formalReturns = formalReturns;
		this.pres = pres;
		this.posts = posts;
		this.locals = locals;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<IVLLocalVarDecl> getFormalArgs() {
		return formalArgs;
	}

	public List<IVLLocalVarDecl> getFormalReturns() {
		return formalReturns;
	}

	public List<IVLExpression> getPres() {
		return pres;
	}

	public List<IVLExpression> getPosts() {
		return posts;
	}

	public List<IVLLocalVarDecl> getLocals() {
		return locals;
	}

	public Optional<IVLSeqn> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLMethod that = (IVLMethod) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(formalArgs, that.formalArgs) &&
				Objects.equals(formalReturns, that.formalReturns) &&
				Objects.equals(pres, that.pres) &&
				Objects.equals(posts, that.posts) &&
				Objects.equals(locals, that.locals) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, formalArgs, formalReturns, pres, posts, locals, body);
	}
}
