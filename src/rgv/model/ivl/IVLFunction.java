package rgv.model.ivl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A heap-dependent function; abstract when it has no body.
 */
public class IVLFunction extends IVLMember {
	private final String name;
	private final List<IVLLocalVarDecl> formalArgs;
	private final IVLType type;
	private final List<IVLExpression> pres;
	private final List<IVLExpression> posts;
	private final Optional<IVLExpression> body;

	public IVLFunction(String name, List<IVLLocalVarDecl> formalArgs, IVLType type, List<IVLExpression> pres, List<IVLExpression> posts, Optional<IVLExpression> body) {
		this.name = name;
		this.formalArgs = formalArgs;
		this.type = type;
		this.pres = pres;
		this.posts = posts;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<IVLLocalVarDecl> getFormalArgs() {
		return formalArgs;
	}

	public IVLType getType() {
		return type;
	}

	public List<IVLExpression> getPres() {
		return pres;
	}

	public List<IVLExpression> getPosts() {
		return posts;
	}

	public Optional<IVLExpression> getBody() {
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
		IVLFunction that = (IVLFunction) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(formalArgs, that.formalArgs) &&
				Objects.equals(type, that.type) &&
				Objects.equals(pres, that.pres) &&
				Objects.equals(posts, that.posts) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, formalArgs, type, pres, posts, body);
	}
}
