package rgv.model.ivl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A predicate; abstract when it has no body.
 */
public class IVLPredicate extends IVLMember {
	private final String name;
	private final List<IVLLocalVarDecl> formalArgs;
	private final Optional<IVLExpression> body;

	public IVLPredicate(String name, List<IVLLocalVarDecl> formalArgs, Optional<IVLExpression> body) {
		this.name = name;
		this.formalArgs = formalArgs;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<IVLLocalVarDecl> getFormalArgs() {
		return formalArgs;
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
		IVLPredicate that = (IVLPredicate) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(formalArgs, that.formalArgs) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, formalArgs, body);
	}
}
