package rgv.model.ivl;

import java.util.List;
import java.util.Objects;

public class IVLSeqn extends IVLStatement {
	private final List<IVLStatement> statements;

	public IVLSeqn(List<IVLStatement> statements) {
		this.statements = statements;
	}

	public List<IVLStatement> getStatements() {
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLSeqn that = (IVLSeqn) o;
		return Objects.equals(statements, that.statements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(statements);
	}
}
