package rgv.trans.passes.scope;

import rgv.InternalCompilerError;
import rgv.model.rg.*;
import rgv.scope.*;
import rgv.trans.attribution.Attribute;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name resolution over a scoped tree: which entity each identifier denotes, which region a
 * region id variable is used with, and where logical variables are bound.
 */
public class NameAnalysis {
	public static final String RETURN_VARIABLE = "ret";

	private final RgTree tree;
	private final Map<String, Entity> rootScope;
	private final Map<UID, Map<String, Entity>> scopes;
	private final Map<UID, RgLocalVariableDecl> returnDecls;

	private final Attribute<RgIdnNode, Entity> entity;
	private final Attribute<RgIdnUse, Optional<RegionUse>> regionIdUsedWith;
	private final Attribute<RgLogicalVariableBinder, Optional<RgNode>> boundBy;

	NameAnalysis(RgTree tree, Map<String, Entity> rootScope, Map<UID, Map<String, Entity>> scopes,
	             Map<UID, RgLocalVariableDecl> returnDecls) {
		this.tree = tree;
		this.rootScope = rootScope;
		this.scopes = scopes;
		this.returnDecls = returnDecls;
		this.entity = new Attribute<>("entity", this::computeEntity);
		this.regionIdUsedWith = new Attribute<>("regionIdUsedWith", this::computeRegionIdUsedWith);
		this.boundBy = new Attribute<>("boundBy", this::computeBoundBy);
	}

	public RgTree getTree() {
		return tree;
	}

	/**
	 * @return the environment in effect at node: the completed layer of its nearest scope
	 */
	public Map<String, Entity> env(RgNode node) {
		Map<String, Entity> env = scopes.get(node.getUID());
		if (env == null) {
			throw new InternalCompilerError("node " + node + " is not part of the scoped tree");
		}
		return env;
	}

	public Entity entity(RgIdnNode id) {
		return entity.apply(id);
	}

	private Entity computeEntity(RgIdnNode id) {
		Optional<RgNode> parent = tree.parent(id);
		if (id instanceof RgIdnUse && parent.isPresent()) {
			RgNode p = parent.get();
			if (p instanceof RgGuardExp && ((RgGuardExp) p).getGuard() == id) {
				return regionIdUsedWith(((RgGuardExp) p).getRegionId())
						.map(use -> lookupGuard(id, use.getRegion()))
						.orElseGet(UnknownEntity::new);
			}
			if (p instanceof RgAction && ((RgAction) p).getGuard() == id) {
				return enclosingMember(id)
						.filter(RgRegion.class::isInstance)
						.map(region -> lookupGuard(id, (RgRegion) region))
						.orElseGet(UnknownEntity::new);
			}
			if (p instanceof RgLocation && ((RgLocation) p).getField() == id) {
				return new UnknownEntity();
			}
		}
		return lookup(env(id), id.getName());
	}

	private Entity lookupGuard(RgIdnNode guard, RgRegion region) {
		return lookup(env(guard), GuardEntity.qualifiedName(guard.getName(), region.getId().getName()));
	}

	private static Entity lookup(Map<String, Entity> env, String name) {
		Entity e = env.get(name);
		return e != null ? e : new UnknownEntity();
	}

	/**
	 * Looks a struct up by name, for resolving reference types.
	 */
	public Optional<RgStruct> struct(String name) {
		Entity e = rootScope.get(name);
		if (e instanceof StructEntity) {
			return Optional.of(((StructEntity) e).getDeclaration());
		}
		return Optional.empty();
	}

	/**
	 * The synthetic declaration of {@code ret} in a procedure's scope.
	 */
	public RgLocalVariableDecl returnDeclaration(RgProcedure procedure) {
		return returnDecls.get(procedure.getUID());
	}

	public Optional<RgMember> enclosingMember(RgNode node) {
		if (node instanceof RgMember) {
			return Optional.of((RgMember) node);
		}
		return tree.enclosing(node, RgMember.class);
	}

	/**
	 * Finds the region a region id variable is used with by scanning the enclosing member in
	 * document order, for a region instance whose first argument is the id, or for a region
	 * declaration whose region id has that name. The first match wins, even when the same id
	 * is used with several instances.
	 */
	public Optional<RegionUse> regionIdUsedWith(RgIdnUse regionId) {
		return regionIdUsedWith.apply(regionId);
	}

	private Optional<RegionUse> computeRegionIdUsedWith(RgIdnUse regionId) {
		Optional<RgMember> member = enclosingMember(regionId);
		if (!member.isPresent()) {
			return Optional.empty();
		}
		for (RgNode node : tree.subtree(member.get())) {
			if (node instanceof RgPredicateExp) {
				RgPredicateExp exp = (RgPredicateExp) node;
				List<RgExpression> args = exp.getArguments();
				if (!args.isEmpty() && args.get(0) instanceof RgIdnExp &&
						((RgIdnExp) args.get(0)).getId().getName().equals(regionId.getName())) {
					Entity e = entity(exp.getPredicate());
					if (e instanceof RegionEntity) {
						return Optional.of(new RegionUse(((RegionEntity) e).getDeclaration(), exp));
					}
				}
			} else if (node instanceof RgRegion) {
				RgRegion region = (RgRegion) node;
				if (region.getRegionId().getId().getName().equals(regionId.getName())) {
					return Optional.of(new RegionUse(region, null));
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * @return the construct that binds the logical variable: an interference clause, action,
	 * set comprehension, points-to assertion or region instance (as its out-argument)
	 */
	public Optional<RgNode> boundBy(RgLogicalVariableBinder binder) {
		return boundBy.apply(binder);
	}

	private Optional<RgNode> computeBoundBy(RgLogicalVariableBinder binder) {
		return tree.parent(binder).filter(p ->
				p instanceof RgInterferenceClause ||
				p instanceof RgAction ||
				p instanceof RgSetComprehension ||
				p instanceof RgPointsTo ||
				p instanceof RgPredicateExp);
	}

	/**
	 * @return the kind of construct the node sits in, judged by its nearest enclosing clause
	 * or member
	 */
	public LogicalVariableContext usageContext(RgNode node) {
		Optional<RgNode> current = Optional.of(node);
		while (current.isPresent()) {
			RgNode n = current.get();
			if (n instanceof RgInterferenceClause) {
				return LogicalVariableContext.INTERFERENCE;
			} else if (n instanceof RgPreconditionClause) {
				return LogicalVariableContext.PRECONDITION;
			} else if (n instanceof RgPostconditionClause) {
				return LogicalVariableContext.POSTCONDITION;
			} else if (n instanceof RgInvariantClause) {
				return LogicalVariableContext.INVARIANT;
			} else if (n instanceof RgProcedure) {
				return LogicalVariableContext.PROCEDURE;
			} else if (n instanceof RgRegion) {
				return LogicalVariableContext.REGION;
			} else if (n instanceof RgPredicate) {
				return LogicalVariableContext.PREDICATE;
			}
			current = tree.parent(n);
		}
		throw new InternalCompilerError("node " + node + " is outside of any member");
	}
}
