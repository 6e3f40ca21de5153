package rgv.trans.passes.validation;

import rgv.errors.IssueContext;
import rgv.model.rg.*;
import rgv.model.type.BoolType;
import rgv.model.type.RefType;
import rgv.model.type.SetType;
import rgv.model.type.Type;
import rgv.model.type.TypeUtil;
import rgv.model.type.UnknownType;
import rgv.scope.*;
import rgv.trans.passes.atomicity.AtomicityAnalysis;
import rgv.trans.passes.atomicity.AtomicityKind;
import rgv.trans.passes.scope.NameAnalysis;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reports declaration, type and atomicity errors over a resolved tree.
 *
 * Nodes are checked in document order and each node is checked by the first rule that applies
 * to it, so an untypable expression is reported as such and not also as a type mismatch.
 */
public class SemanticCheckingPass {
	private static final Logger logger = Logger.getLogger("RGV.Checking");

	private final IssueContext ctx;
	private final NameAnalysis names;
	private final TypeAnalysis types;
	private final AtomicityAnalysis atomicity;
	private final RgTree tree;

	private SemanticCheckingPass(IssueContext ctx, NameAnalysis names, TypeAnalysis types,
	                             AtomicityAnalysis atomicity) {
		this.ctx = ctx;
		this.names = names;
		this.types = types;
		this.atomicity = atomicity;
		this.tree = names.getTree();
	}

	public static void perform(IssueContext ctx, NameAnalysis names, TypeAnalysis types,
	                           AtomicityAnalysis atomicity) {
		SemanticCheckingPass pass = new SemanticCheckingPass(ctx, names, types, atomicity);
		for (RgNode node : names.getTree().getNodes()) {
			pass.check(node);
		}
		logger.fine("checked " + names.getTree().getNodes().size() + " nodes");
	}

	private void check(RgNode node) {
		if (node instanceof RgIdnDef) {
			if (names.entity((RgIdnDef) node) instanceof MultipleEntity) {
				ctx.error(new MultipleDeclarationIssue((RgIdnDef) node));
			}
		} else if (node instanceof RgIdnUse) {
			checkUse((RgIdnUse) node);
		} else if (node instanceof RgExpression && types.typ((RgExpression) node) instanceof UnknownType) {
			ctx.error(new UntypableExpressionIssue((RgExpression) node));
		} else if (node instanceof RgProcedure) {
			RgProcedure procedure = (RgProcedure) node;
			for (RgPreconditionClause pre : procedure.getPres()) {
				expectBool(pre.getAssertion());
			}
			for (RgPostconditionClause post : procedure.getPosts()) {
				expectBool(post.getAssertion());
			}
		} else if (node instanceof RgAction) {
			RgAction action = (RgAction) node;
			Type expected = new SetType(types.typ(action.getFrom()));
			Type actual = types.typ(action.getTo());
			if (!TypeUtil.isCompatible(actual, expected)) {
				ctx.error(new TypeMismatchIssue(action.getTo(), expected, actual));
			}
		} else if (node instanceof RgInterferenceClause) {
			checkRegionResolves(((RgInterferenceClause) node).getRegionId());
		} else if (node instanceof RgAssign) {
			RgIdnUse lhs = ((RgAssign) node).getLhs();
			if (!(names.entity(lhs) instanceof LocalVariableEntity)) {
				ctx.error(new InvalidAssignmentTargetIssue(lhs));
			}
		} else if (node instanceof RgHeapRead) {
			checkHeapRead((RgHeapRead) node);
		} else if (node instanceof RgHeapWrite) {
			RgHeapWrite heapWrite = (RgHeapWrite) node;
			Type locationType = types.typeOfLocation(heapWrite.getHeapLocation());
			Type rhsType = types.typ(heapWrite.getRhs());
			if (!TypeUtil.isCompatible(locationType, rhsType)) {
				ctx.error(new TypeMismatchIssue(heapWrite.getHeapLocation(), locationType, rhsType));
			}
		} else if (node instanceof RgProcedureCall) {
			checkCall((RgProcedureCall) node);
		} else if (node instanceof RgRuleStatement) {
			checkRuleStatement((RgRuleStatement) node);
		} else if (node instanceof RgExpression) {
			checkExpression((RgExpression) node);
		}
	}

	private void expectBool(RgExpression assertion) {
		Type actual = types.typ(assertion);
		if (!TypeUtil.isCompatible(actual, new BoolType())) {
			ctx.error(new TypeMismatchIssue(assertion, new BoolType(), actual));
		}
	}

	private void checkUse(RgIdnUse use) {
		Optional<RgNode> parent = tree.parent(use);
		if (parent.isPresent() && parent.get() instanceof RgLocation && ((RgLocation) parent.get()).getField() == use) {
			RgIdnUse receiver = ((RgLocation) parent.get()).getReceiver();
			Type receiverType = types.typeOfIdn(receiver);
			if (!(receiverType instanceof RefType)) {
				ctx.error(new InvalidReceiverIssue(receiver, receiverType, InvalidReceiverIssue.Reason.NOT_A_REFERENCE));
				return;
			}
			Optional<RgStruct> struct = types.receiverStruct(receiver);
			if (!struct.isPresent()) {
				ctx.error(new InvalidReceiverIssue(receiver, receiverType, InvalidReceiverIssue.Reason.NOT_A_STRUCT));
			} else if (!struct.get().getField(use.getName()).isPresent()) {
				ctx.error(new NoMatchingFieldIssue(use, struct.get()));
			}
			return;
		}
		if (names.entity(use) instanceof UnknownEntity) {
			ctx.error(new DanglingReferenceIssue(use));
		}
	}

	private void checkRuleStatement(RgRuleStatement rule) {
		List<RgExpression> args = rule.getRegionPredicate().getArguments();
		if (!args.isEmpty() && !(args.get(0) instanceof RgIdnExp)) {
			ctx.error(new UnsupportedFeatureIssue(args.get(0),
					"the region id of " + rule.getStatementName() + " must be a variable"));
		}
		RgStatement body = rule.getBody();
		AtomicityKind expected = atomicity.expectedAtomicity(body);
		AtomicityKind actual = atomicity.atomicity(body);
		if (expected == AtomicityKind.ATOMIC && actual == AtomicityKind.NONATOMIC) {
			ctx.error(new AtomicityMismatchIssue(body, expected, actual));
		}
	}

	private void checkRegionResolves(RgIdnUse regionId) {
		if (!names.regionIdUsedWith(regionId).isPresent()) {
			ctx.error(new UnresolvedRegionIssue(regionId));
		}
	}

	private void checkHeapRead(RgHeapRead heapRead) {
		Entity lhs = names.entity(heapRead.getLhs());
		if (lhs instanceof LocalVariableEntity) {
			Type declared = ((LocalVariableEntity) lhs).getDeclaration().getType();
			Type locationType = types.typeOfLocation(heapRead.getHeapLocation());
			if (!TypeUtil.isCompatible(locationType, declared)) {
				ctx.error(new TypeMismatchIssue(heapRead.getHeapLocation(), declared, locationType));
			}
		} else {
			ctx.error(new InvalidAssignmentTargetIssue(heapRead.getLhs()));
		}
	}

	private void checkCall(RgProcedureCall call) {
		Entity callee = names.entity(call.getProcedure());
		if (callee.isErroneous()) {
			return;
		}
		if (!(callee instanceof ProcedureEntity)) {
			ctx.error(new InvalidReferenceIssue(call.getProcedure(), InvalidReferenceIssue.Reason.NOT_CALLABLE));
			return;
		}
		RgProcedure procedure = ((ProcedureEntity) callee).getDeclaration();
		List<RgFormalArgumentDecl> formals = procedure.getFormalArgs();
		List<RgExpression> actuals = call.getArguments();
		if (formals.size() != actuals.size()) {
			ctx.error(new ArgumentCountMismatchIssue(
					call, procedure.getId().getName(), formals.size(), actuals.size(), false));
		}
		for (int i = 0; i < Math.min(formals.size(), actuals.size()); i++) {
			Type actual = types.typ(actuals.get(i));
			if (!TypeUtil.isCompatible(actual, formals.get(i).getType())) {
				ctx.error(new TypeMismatchIssue(actuals.get(i), formals.get(i).getType(), actual));
			}
		}
	}

	private void checkExpression(RgExpression exp) {
		Type expected = types.expectedType(exp);
		Type actual = types.typ(exp);
		if (!TypeUtil.isCompatible(expected, actual)) {
			ctx.error(new TypeMismatchIssue(exp, expected, actual));
		}

		if (exp instanceof RgIdnExp) {
			RgIdnUse id = ((RgIdnExp) exp).getId();
			if (names.entity(id) instanceof ProcedureEntity) {
				ctx.error(new InvalidReferenceIssue(id, InvalidReferenceIssue.Reason.PROCEDURE_AS_VALUE));
			}
		} else if (exp instanceof RgPredicateExp) {
			checkPredicateInstance((RgPredicateExp) exp);
		} else if (exp instanceof RgRegionUpdateWitness) {
			checkRegionResolves(((RgRegionUpdateWitness) exp).getRegionId());
		} else if (exp instanceof RgSetComprehension && !isTranslatableComprehension((RgSetComprehension) exp)) {
			ctx.error(new UnsupportedFeatureIssue(exp,
					"set comprehensions are only supported as the right operand of a membership test"));
		}
	}

	private void checkPredicateInstance(RgPredicateExp exp) {
		Entity e = names.entity(exp.getPredicate());
		if (e.isErroneous()) {
			return;
		}
		int actual = exp.getArguments().size();
		if (e instanceof PredicateEntity) {
			RgPredicate predicate = ((PredicateEntity) e).getDeclaration();
			int expected = predicate.getFormalArgs().size();
			if (expected != actual) {
				ctx.error(new ArgumentCountMismatchIssue(
						exp.getPredicate(), predicate.getId().getName(), expected, actual, false));
			}
		} else if (e instanceof RegionEntity) {
			// region id, formal arguments, optional out-argument
			RgRegion region = ((RegionEntity) e).getDeclaration();
			int required = 1 + region.getFormalArgs().size();
			int delta = actual - required;
			if (delta != 0 && delta != 1) {
				ctx.error(new ArgumentCountMismatchIssue(
						exp.getPredicate(), region.getId().getName(), required, actual, true));
			}
		} else {
			ctx.error(new InvalidReferenceIssue(exp.getPredicate(), InvalidReferenceIssue.Reason.NOT_INSTANTIABLE_HERE));
		}
	}

	private boolean isTranslatableComprehension(RgSetComprehension comprehension) {
		Optional<RgNode> parent = tree.parent(comprehension);
		if (!parent.isPresent()) {
			return false;
		}
		RgNode p = parent.get();
		return (p instanceof RgSetContains && ((RgSetContains) p).getSet() == comprehension) ||
				(p instanceof RgAction && ((RgAction) p).getTo() == comprehension) ||
				(p instanceof RgInterferenceClause && ((RgInterferenceClause) p).getSet() == comprehension);
	}
}
