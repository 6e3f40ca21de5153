package rgv.trans.passes.scope;

import rgv.model.rg.*;
import rgv.scope.*;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds the scope chain of a program tree.
 *
 * The root layer holds every top-level member and every guard under its qualified key
 * {@code guard@Region}. Members, set comprehensions and actions each open a fresh layer.
 * Definitions are bound in document order, a repeated name within one layer being turned
 * into a {@link MultipleEntity}. Every node remembers the layer it sits in; since layers are
 * only read once the whole tree has been walked, lookups see the completed layer.
 */
public class ScopingPass {
	private static final Logger logger = Logger.getLogger("RGV.Scoping");

	private ScopingPass() {}

	public static NameAnalysis perform(RgTree tree) {
		RgProgram program = tree.getRoot();
		ScopeBuilder root = new ScopeBuilder();

		for (RgMember member : program.getMembers()) {
			root.defineIfNew(member.getId().getName(), member.accept(new RgMemberVisitor<Entity, RuntimeException>() {
				@Override
				public Entity visit(RgStruct struct) {
					return new StructEntity(struct);
				}

				@Override
				public Entity visit(RgProcedure procedure) {
					return new ProcedureEntity(procedure);
				}

				@Override
				public Entity visit(RgPredicate predicate) {
					return new PredicateEntity(predicate);
				}

				@Override
				public Entity visit(RgRegion region) {
					return new RegionEntity(region);
				}
			}));
		}
		for (RgRegion region : program.getRegions()) {
			for (RgGuardDecl guard : region.getGuards()) {
				root.defineIfNew(
						GuardEntity.qualifiedName(guard.getId().getName(), region.getId().getName()),
						new GuardEntity(guard, region));
			}
		}

		Map<UID, Map<String, Entity>> scopes = new HashMap<>();
		Map<UID, RgLocalVariableDecl> returnDecls = new HashMap<>();
		scopes.put(program.getUID(), root.getBindings());
		for (RgMember member : program.getMembers()) {
			ScopeBuilder memberScope = root.makeNestedScope();
			scopes.put(member.getUID(), memberScope.getBindings());
			// the member's own name lives in the root layer
			scopes.put(member.getId().getUID(), root.getBindings());
			if (member instanceof RgProcedure) {
				RgProcedure procedure = (RgProcedure) member;
				RgLocalVariableDecl retDecl = new RgLocalVariableDecl(procedure.getLocation(),
						new RgIdnDef(procedure.getLocation(), NameAnalysis.RETURN_VARIABLE),
						procedure.getReturnType());
				returnDecls.put(procedure.getUID(), retDecl);
				memberScope.defineIfNew(NameAnalysis.RETURN_VARIABLE, new LocalVariableEntity(retDecl));
			}
			for (RgNode child : member.getChildren()) {
				if (child != member.getId()) {
					scope(child, member, member, memberScope, scopes);
				}
			}
		}
		logger.fine("scoped " + tree.getNodes().size() + " nodes");
		return new NameAnalysis(tree, root.getBindings(), scopes, returnDecls);
	}

	private static void scope(RgNode node, RgNode parent, RgMember member, ScopeBuilder current,
	                          Map<UID, Map<String, Entity>> scopes) {
		RgLogicalVariableBinder bound = null;
		if (node instanceof RgSetComprehension) {
			bound = ((RgSetComprehension) node).getBinder();
		} else if (node instanceof RgAction) {
			bound = ((RgAction) node).getFrom();
		}
		if (bound != null) {
			current = current.makeNestedScope();
			current.defineIfNew(bound.getId().getName(), new LogicalVariableEntity(bound));
		}
		scopes.put(node.getUID(), current.getBindings());

		if (node instanceof RgIdnDef) {
			current.defineIfNew(((RgIdnDef) node).getName(), definedEntity(parent, member));
			return;
		}
		for (RgNode child : node.getChildren()) {
			if (child == bound) {
				// already bound when the scope was opened
				scopes.put(bound.getUID(), current.getBindings());
				scopes.put(bound.getId().getUID(), current.getBindings());
			} else {
				scope(child, node, member, current, scopes);
			}
		}
	}

	private static Entity definedEntity(RgNode parent, RgMember member) {
		if (parent instanceof RgGuardDecl) {
			return new GuardEntity((RgGuardDecl) parent, (RgRegion) member);
		} else if (parent instanceof RgFormalArgumentDecl) {
			return new ArgumentEntity((RgFormalArgumentDecl) parent);
		} else if (parent instanceof RgLocalVariableDecl) {
			return new LocalVariableEntity((RgLocalVariableDecl) parent);
		} else if (parent instanceof RgLogicalVariableBinder) {
			return new LogicalVariableEntity((RgLogicalVariableBinder) parent);
		}
		// struct fields are resolved through the receiver's type, never by name lookup
		return new UnknownEntity();
	}
}
