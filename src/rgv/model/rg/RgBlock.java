package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * Sequential composition of any number of statements.
 */
public class RgBlock extends RgCompoundStatement {
	private final List<RgStatement> statements;

	public RgBlock(SourceLocation location, List<RgStatement> statements) {
		super(location);
		this.statements = statements;
	}

	public List<RgStatement> getStatements() {
		return statements;
	}

	@Override
	public List<RgStatement> getComponents() {
		return statements;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(statements);
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
