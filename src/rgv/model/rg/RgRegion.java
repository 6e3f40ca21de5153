package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;
import java.util.Optional;

/**
 * A region abstracts a piece of shared state. Its instances are identified by the region id
 * argument; further formal arguments parameterise the interpretation.
 */
public class RgRegion extends RgMember {
	private final RgFormalArgumentDecl regionId;
	private final List<RgFormalArgumentDecl> formalArgs;
	private final List<RgGuardDecl> guards;
	private final RgExpression interpretation;
	private final RgExpression state;
	private final List<RgAction> actions;

	public RgRegion(SourceLocation location, RgIdnDef id, RgFormalArgumentDecl regionId,
	                List<RgFormalArgumentDecl> formalArgs, List<RgGuardDecl> guards, RgExpression interpretation,
	                RgExpression state, List<RgAction> actions) {
		super(location, id);
		this.regionId = regionId;
		this.formalArgs = formalArgs;
		this.guards = guards;
		this.interpretation = interpretation;
		this.state = state;
		this.actions = actions;
	}

	public RgFormalArgumentDecl getRegionId() {
		return regionId;
	}

	/**
	 * @return the formal arguments after the region id
	 */
	public List<RgFormalArgumentDecl> getFormalArgs() {
		return formalArgs;
	}

	public List<RgGuardDecl> getGuards() {
		return guards;
	}

	public Optional<RgGuardDecl> getGuard(String name) {
		return guards.stream().filter(g -> g.getId().getName().equals(name)).findFirst();
	}

	public RgExpression getInterpretation() {
		return interpretation;
	}

	public RgExpression getState() {
		return state;
	}

	public List<RgAction> getActions() {
		return actions;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(getId(), regionId, formalArgs, guards, interpretation, state, actions);
	}

	@Override
	public <T, E extends Throwable> T accept(RgMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
