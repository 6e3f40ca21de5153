package rgv.trans.passes.codegen.ivl;

import rgv.InternalCompilerError;
import rgv.Unreachable;
import rgv.model.ivl.*;
import rgv.model.rg.*;
import rgv.model.type.CollectionType;
import rgv.model.type.Type;
import rgv.scope.*;
import rgv.trans.passes.region.RegionInstance;
import rgv.trans.passes.region.RegionModel;
import rgv.trans.passes.scope.LogicalVariableContext;
import rgv.trans.passes.scope.NameAnalysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static rgv.model.ivl.IVLBuilder.*;

/**
 * Translates assertions and expressions. Every generated expression records the expression it
 * was translated from as its origin.
 */
public class ExpressionTranslator extends RgExpressionVisitor<IVLExpression, RuntimeException> {
	private final TranslationContext ctx;
	private final RegionTerms terms;

	public ExpressionTranslator(TranslationContext ctx) {
		this.ctx = ctx;
		this.terms = new RegionTerms(ctx.getRegions());
	}

	public IVLExpression translate(RgExpression expression) {
		return sourced(expression.accept(this), expression);
	}

	public List<IVLExpression> translate(List<RgExpression> expressions) {
		List<IVLExpression> result = new ArrayList<>();
		for (RgExpression expression : expressions) {
			result.add(translate(expression));
		}
		return result;
	}

	/**
	 * @return the region id followed by the region's formal arguments
	 */
	public List<IVLExpression> inArgs(RegionInstance instance) {
		return translate(instance.getInArgs());
	}

	public IVLLocalVar variable(RgIdnUse use) {
		Entity e = ctx.getNames().entity(use);
		if (e instanceof ArgumentEntity) {
			RgFormalArgumentDecl decl = ((ArgumentEntity) e).getDeclaration();
			return sourced(local(decl.getId().getName(), TypeTranslator.translate(decl.getType())), use);
		} else if (e instanceof LocalVariableEntity) {
			RgLocalVariableDecl decl = ((LocalVariableEntity) e).getDeclaration();
			return sourced(local(decl.getId().getName(), TypeTranslator.translate(decl.getType())), use);
		}
		throw new InternalCompilerError(use + " does not denote a variable but " + e);
	}

	public IVLFieldAccess location(RgLocation location) {
		RgStruct struct = ctx.getTypes().receiverStruct(location.getReceiver())
				.orElseThrow(() -> new InternalCompilerError("receiver of " + location + " is not a struct"));
		RgFieldDecl fieldDecl = struct.getField(location.getField().getName())
				.orElseThrow(() -> new InternalCompilerError("no field " + location.getField() + " in " + struct));
		IVLField ivlField = new IVLField(RegionModel.fieldName(struct, fieldDecl), TypeTranslator.translate(fieldDecl.getType()));
		return sourced(field(variable(location.getReceiver()), ivlField), location);
	}

	/**
	 * The region state of an instance, or its state before the enclosing block opened it.
	 */
	public IVLExpression state(RgRegion region, List<IVLExpression> inArgs) {
		IVLFuncApp state = terms.state(region, inArgs);
		Optional<OpenRegion> open = ctx.findOpenRegion(region, inArgs);
		if (open.isPresent()) {
			return old(state, open.get().getLabel());
		}
		return state;
	}

	private static boolean isBinder(RgExpression expression) {
		return expression instanceof RgLogicalVariableBinder;
	}

	private IVLExpression logicalVariable(RgLogicalVariableBinder binder, RgNode use) {
		IVLExpression value = ctx.substitution(binder).orElseGet(() -> boundValue(binder));
		LogicalVariableContext bound = ctx.getNames().usageContext(binder);
		if (ctx.getNames().usageContext(use) == LogicalVariableContext.POSTCONDITION &&
				(bound == LogicalVariableContext.PRECONDITION || bound == LogicalVariableContext.INTERFERENCE)) {
			return old(value);
		}
		return value;
	}

	private IVLExpression boundValue(RgLogicalVariableBinder binder) {
		RgNode context = ctx.getNames().boundBy(binder)
				.orElseThrow(() -> new InternalCompilerError("logical variable " + binder + " is not bound"));
		if (context instanceof RgPointsTo) {
			return location(((RgPointsTo) context).getHeapLocation());
		} else if (context instanceof RgPredicateExp) {
			RegionInstance instance = ctx.getRegions().instance((RgPredicateExp) context);
			return state(instance.getRegion(), inArgs(instance));
		} else if (context instanceof RgInterferenceClause) {
			RegionInstance instance = ctx.getRegions().instanceOf(((RgInterferenceClause) context).getRegionId());
			return state(instance.getRegion(), inArgs(instance));
		}
		throw new InternalCompilerError("logical variable " + binder + " bound by " + context + " is used outside of its binder");
	}

	@Override
	public IVLExpression visit(RgIntLit intLit) {
		return new IVLIntLit(intLit.getValue());
	}

	@Override
	public IVLExpression visit(RgBoolLit boolLit) {
		return bool(boolLit.getValue());
	}

	@Override
	public IVLExpression visit(RgNullLit nullLit) {
		return new IVLNullLit();
	}

	@Override
	public IVLExpression visit(RgRet ret) {
		RgProcedure procedure = ctx.getNames().enclosingMember(ret)
				.filter(RgProcedure.class::isInstance)
				.map(RgProcedure.class::cast)
				.orElseThrow(() -> new InternalCompilerError("ret used outside of a procedure"));
		return local(NameAnalysis.RETURN_VARIABLE, TypeTranslator.translate(procedure.getReturnType()));
	}

	@Override
	public IVLExpression visit(RgIdnExp idnExp) {
		Entity e = ctx.getNames().entity(idnExp.getId());
		if (e instanceof LogicalVariableEntity) {
			return logicalVariable(((LogicalVariableEntity) e).getDeclaration(), idnExp);
		}
		return variable(idnExp.getId());
	}

	@Override
	public IVLExpression visit(RgBinOp binOp) {
		IVLBinaryOp.Operator operator;
		switch (binOp.getOperator()) {
			case ADD:
				operator = IVLBinaryOp.Operator.ADD;
				break;
			case SUB:
				operator = IVLBinaryOp.Operator.SUB;
				break;
			case MOD:
				operator = IVLBinaryOp.Operator.MOD;
				break;
			case DIV:
				operator = IVLBinaryOp.Operator.DIV;
				break;
			case AND:
				operator = IVLBinaryOp.Operator.AND;
				break;
			case OR:
				operator = IVLBinaryOp.Operator.OR;
				break;
			case EQUALS:
				operator = IVLBinaryOp.Operator.EQ;
				break;
			case LESS:
				operator = IVLBinaryOp.Operator.LT;
				break;
			case AT_MOST:
				operator = IVLBinaryOp.Operator.LE;
				break;
			case GREATER:
				operator = IVLBinaryOp.Operator.GT;
				break;
			case AT_LEAST:
				operator = IVLBinaryOp.Operator.GE;
				break;
			default:
				throw new Unreachable();
		}
		return binop(operator, translate(binOp.getLeft()), translate(binOp.getRight()));
	}

	@Override
	public IVLExpression visit(RgNot not) {
		return new IVLUnaryOp(IVLUnaryOp.Operator.NOT, translate(not.getOperand()));
	}

	@Override
	public IVLExpression visit(RgConditional conditional) {
		return new IVLCondExp(
				translate(conditional.getCondition()),
				translate(conditional.getThen()),
				translate(conditional.getElse()));
	}

	@Override
	public IVLExpression visit(RgNumberSet numberSet) {
		String function = numberSet.getKind() == RgNumberSet.Kind.INT ?
				ProgramTranslator.INT_SET_FUNCTION : ProgramTranslator.NAT_SET_FUNCTION;
		return app(function, new ArrayList<>(), setType(intType()));
	}

	private IVLType elementType(RgExpression collection) {
		Type type = ctx.getTypes().typ(collection);
		if (!(type instanceof CollectionType)) {
			throw new InternalCompilerError(collection + " is not of a collection type but of " + type);
		}
		return TypeTranslator.translate(((CollectionType) type).getElementType());
	}

	@Override
	public IVLExpression visit(RgExplicitSet explicitSet) {
		return new IVLExplicitSet(translate(explicitSet.getElements()), elementType(explicitSet));
	}

	@Override
	public IVLExpression visit(RgExplicitSeq explicitSeq) {
		return new IVLExplicitSeq(translate(explicitSeq.getElements()), elementType(explicitSeq));
	}

	@Override
	public IVLExpression visit(RgSetComprehension setComprehension) {
		throw new InternalCompilerError("set comprehension " + setComprehension + " outside of a membership test");
	}

	/**
	 * The filter of a comprehension with its binder replaced by the element.
	 */
	public IVLExpression comprehensionMembership(IVLExpression element, RgSetComprehension comprehension) {
		ctx.substitute(comprehension.getBinder(), element);
		try {
			return translate(comprehension.getFilter());
		} finally {
			ctx.clearSubstitution(comprehension.getBinder());
		}
	}

	@Override
	public IVLExpression visit(RgSetContains setContains) {
		IVLExpression element = translate(setContains.getElement());
		if (setContains.getSet() instanceof RgSetComprehension) {
			return comprehensionMembership(element, (RgSetComprehension) setContains.getSet());
		}
		return contains(element, translate(setContains.getSet()));
	}

	@Override
	public IVLExpression visit(RgSeqSize seqSize) {
		return new IVLSeqLength(translate(seqSize.getSeq()));
	}

	@Override
	public IVLExpression visit(RgSeqHead seqHead) {
		return new IVLSeqIndex(translate(seqHead.getSeq()), num(0));
	}

	@Override
	public IVLExpression visit(RgSeqTail seqTail) {
		return new IVLSeqDrop(translate(seqTail.getSeq()), num(1));
	}

	/**
	 * Access to a predicate instance; for a region, to the instance without its out-argument.
	 */
	public IVLPredicateAccessPredicate predicateAccess(RgPredicateExp predicateExp) {
		Entity e = ctx.getNames().entity(predicateExp.getPredicate());
		if (e instanceof RegionEntity) {
			RegionInstance instance = ctx.getRegions().instance(predicateExp);
			return sourced(terms.regionAccess(instance.getRegion(), inArgs(instance)), predicateExp);
		} else if (e instanceof PredicateEntity) {
			return sourced(acc(predicateExp.getPredicate().getName(), translate(predicateExp.getArguments())), predicateExp);
		}
		throw new InternalCompilerError(predicateExp + " is not a predicate instance");
	}

	@Override
	public IVLExpression visit(RgUnfolding unfolding) {
		return new IVLUnfolding(predicateAccess(unfolding.getPredicate()), translate(unfolding.getBody()));
	}

	@Override
	public IVLExpression visit(RgPointsTo pointsTo) {
		IVLExpression access = acc(location(pointsTo.getHeapLocation()));
		if (isBinder(pointsTo.getValue())) {
			return access;
		}
		return and(access, eq(location(pointsTo.getHeapLocation()), translate(pointsTo.getValue())));
	}

	@Override
	public IVLExpression visit(RgPredicateExp predicateExp) {
		IVLPredicateAccessPredicate access = predicateAccess(predicateExp);
		if (!(ctx.getNames().entity(predicateExp.getPredicate()) instanceof RegionEntity)) {
			return access;
		}
		RegionInstance instance = ctx.getRegions().instance(predicateExp);
		Optional<RgExpression> out = instance.getOutArg();
		if (!out.isPresent() || isBinder(out.get())) {
			return access;
		}
		return and(access, eq(terms.state(instance.getRegion(), inArgs(instance)), translate(out.get())));
	}

	@Override
	public IVLExpression visit(RgGuardExp guardExp) {
		GuardEntity guard = ctx.getRegions().guardOf(guardExp);
		return terms.guardAccess(guard.getRegion(), guard.getDeclaration(), variable(guardExp.getRegionId()));
	}

	@Override
	public IVLExpression visit(RgDiamond diamond) {
		return acc(terms.diamond(variable(diamond.getRegionId())));
	}

	@Override
	public IVLExpression visit(RgRegionUpdateWitness regionUpdateWitness) {
		RgRegion region = ctx.getRegions().regionOf(regionUpdateWitness.getRegionId());
		IVLLocalVar id = variable(regionUpdateWitness.getRegionId());
		List<IVLExpression> conjuncts = new ArrayList<>();
		conjuncts.add(acc(terms.stepFrom(region, id)));
		conjuncts.add(acc(terms.stepTo(region, id)));
		if (!isBinder(regionUpdateWitness.getFrom())) {
			conjuncts.add(eq(terms.stepFrom(region, id), translate(regionUpdateWitness.getFrom())));
		}
		if (!isBinder(regionUpdateWitness.getTo())) {
			conjuncts.add(eq(terms.stepTo(region, id), translate(regionUpdateWitness.getTo())));
		}
		return and(conjuncts);
	}

	@Override
	public IVLExpression visit(RgLogicalVariableBinder logicalVariableBinder) {
		return logicalVariable(logicalVariableBinder, logicalVariableBinder);
	}
}
