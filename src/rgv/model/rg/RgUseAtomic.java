package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * {@code use_atomic using G@r on R(r, args) { body }}
 */
public class RgUseAtomic extends RgRuleStatement {
	private final RgGuardExp guard;

	public RgUseAtomic(SourceLocation location, RgGuardExp guard, RgPredicateExp regionPredicate, RgStatement body) {
		super(location, regionPredicate, body);
		this.guard = guard;
	}

	public RgGuardExp getGuard() {
		return guard;
	}

	@Override
	public String getStatementName() {
		return "use_atomic";
	}

	@Override
	public List<RgNode> getChildren() {
		return children(guard, getRegionPredicate(), getBody());
	}

	@Override
	public <T, E extends Throwable> T accept(RgStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
