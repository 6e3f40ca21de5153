package rgv.model.type;

import java.util.Objects;

/**
 * A reference to an instance of the named struct.
 */
public class RefType extends Type {
	private final String structName;

	public RefType(String structName) {
		this.structName = structName;
	}

	public String getStructName() {
		return structName;
	}

	@Override
	public int hashCode() {
		return Objects.hash(7, structName);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof RefType)) {
			return false;
		}
		return structName.equals(((RefType) obj).structName);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
