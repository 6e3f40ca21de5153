package rgv.trans.passes.codegen.ivl;

import rgv.model.ivl.*;
import rgv.model.rg.*;
import rgv.model.type.Type;
import rgv.model.type.VoidType;
import rgv.trans.passes.region.RegionInstance;
import rgv.trans.passes.region.RegionModel;
import rgv.trans.passes.scope.NameAnalysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static rgv.model.ivl.IVLBuilder.*;

/**
 * Translates a checked program into an IVL program.
 *
 * Besides one member per declaration the output carries the ghost fields of regions (the
 * diamond and one step-from/step-to pair per distinct state type) and the functions that
 * describe region states, interference contexts and guard closures.
 */
public class ProgramTranslator {
	public static final String INT_SET_FUNCTION = "IntSet";
	public static final String NAT_SET_FUNCTION = "NatSet";

	private static final Logger logger = Logger.getLogger("RGV.Translator");

	private final TranslationContext ctx;
	private final RegionModel regions;
	private final RegionTerms terms;
	private final ExpressionTranslator expressions;
	private final StatementTranslator statements;

	private ProgramTranslator(TranslationContext ctx) {
		this.ctx = ctx;
		this.regions = ctx.getRegions();
		this.terms = new RegionTerms(regions);
		this.statements = new StatementTranslator(ctx);
		this.expressions = new ExpressionTranslator(ctx);
	}

	public static IVLProgram perform(TranslationContext ctx) {
		return new ProgramTranslator(ctx).translate(ctx.getNames().getTree().getRoot());
	}

	private IVLProgram translate(RgProgram program) {
		List<IVLField> fields = new ArrayList<>();
		List<IVLFunction> functions = new ArrayList<>();
		List<IVLPredicate> predicates = new ArrayList<>();
		List<IVLMethod> methods = new ArrayList<>();

		for (RgStruct struct : program.getStructs()) {
			for (RgFieldDecl field : struct.getFields()) {
				fields.add(sourced(new IVLField(RegionModel.fieldName(struct, field),
						TypeTranslator.translate(field.getType())), field));
			}
		}
		fields.add(RegionTerms.diamondField());
		Map<String, Type> stateTypes = regions.distinctStateTypes(program);
		for (Type stateType : stateTypes.values()) {
			fields.add(RegionTerms.stepFromField(stateType));
			fields.add(RegionTerms.stepToField(stateType));
		}

		functions.add(intSetFunction());
		functions.add(natSetFunction());

		for (RgPredicate predicate : program.getPredicates()) {
			predicates.add(sourced(new IVLPredicate(
					predicate.getId().getName(),
					formalArgs(predicate.getFormalArgs()),
					Optional.of(expressions.translate(predicate.getBody()))), predicate));
		}
		for (RgRegion region : program.getRegions()) {
			translateRegion(region, functions, predicates);
		}
		for (RgProcedure procedure : program.getProcedures()) {
			methods.add(translateProcedure(procedure, stateTypes));
		}

		logger.fine("generated " + fields.size() + " fields, " + functions.size() + " functions, " +
				predicates.size() + " predicates and " + methods.size() + " methods");
		return sourced(new IVLProgram(fields, functions, predicates, methods), program);
	}

	private static IVLFunction intSetFunction() {
		IVLLocalVarDecl n = decl("n", intType());
		IVLResult result = new IVLResult(setType(intType()));
		return abstractFunction(INT_SET_FUNCTION, Collections.emptyList(), setType(intType()),
				Collections.emptyList(),
				Collections.singletonList(forall(Collections.singletonList(n), contains(local(n), result))));
	}

	private static IVLFunction natSetFunction() {
		IVLLocalVarDecl n = decl("n", intType());
		IVLResult result = new IVLResult(setType(intType()));
		IVLExpression nonNegative = binop(IVLBinaryOp.Operator.LE, num(0), local(n));
		return abstractFunction(NAT_SET_FUNCTION, Collections.emptyList(), setType(intType()),
				Collections.emptyList(),
				Collections.singletonList(forall(Collections.singletonList(n), and(
						implies(contains(local(n), result), nonNegative),
						implies(binop(IVLBinaryOp.Operator.LE, num(0), local(n)), contains(local(n), result))))));
	}

	private static List<IVLLocalVarDecl> formalArgs(List<RgFormalArgumentDecl> args) {
		List<IVLLocalVarDecl> result = new ArrayList<>();
		for (RgFormalArgumentDecl arg : args) {
			result.add(sourced(decl(arg.getId().getName(), TypeTranslator.translate(arg.getType())), arg));
		}
		return result;
	}

	private static List<IVLLocalVarDecl> regionArgs(RgRegion region) {
		List<IVLLocalVarDecl> result = new ArrayList<>();
		result.add(sourced(decl(region.getRegionId().getId().getName(), refType()), region.getRegionId()));
		result.addAll(formalArgs(region.getFormalArgs()));
		return result;
	}

	private static List<IVLExpression> locals(List<IVLLocalVarDecl> decls) {
		List<IVLExpression> result = new ArrayList<>();
		for (IVLLocalVarDecl decl : decls) {
			result.add(local(decl));
		}
		return result;
	}

	private static List<IVLLocalVarDecl> append(List<IVLLocalVarDecl> decls, IVLLocalVarDecl... more) {
		List<IVLLocalVarDecl> result = new ArrayList<>(decls);
		result.addAll(Arrays.asList(more));
		return result;
	}

	private void translateRegion(RgRegion region, List<IVLFunction> functions, List<IVLPredicate> predicates) {
		List<IVLLocalVarDecl> args = regionArgs(region);
		List<IVLExpression> inArgs = locals(args);
		IVLType stateType = terms.stateType(region);
		IVLLocalVarDecl id = args.get(0);

		predicates.add(sourced(new IVLPredicate(
				RegionModel.predicateName(region), args,
				Optional.of(expressions.translate(region.getInterpretation()))), region));
		for (RgGuardDecl guard : region.getGuards()) {
			predicates.add(sourced(abstractPredicate(
					RegionModel.guardPredicateName(region, guard), Collections.singletonList(id)), guard));
		}

		functions.add(sourced(new IVLFunction(
				RegionModel.stateFunctionName(region), args, stateType,
				Collections.singletonList(terms.regionAccess(region, inArgs)),
				Collections.emptyList(),
				Optional.of(new IVLUnfolding(
						terms.regionAccess(region, inArgs),
						expressions.translate(region.getState())))), region));
		functions.add(sourced(abstractFunction(
				RegionModel.atomicityContextFunctionName(region), args, setType(stateType),
				Collections.emptyList(), Collections.emptyList()), region));

		for (RgGuardDecl guard : region.getGuards()) {
			functions.add(stepFunction(region, guard, args, stateType));
			functions.add(closureFunction(region, guard, args, stateType));
		}
	}

	/**
	 * Whether {@code to} is reachable from {@code from} by one of the guard's actions.
	 */
	private IVLFunction stepFunction(RgRegion region, RgGuardDecl guard, List<IVLLocalVarDecl> args,
	                                 IVLType stateType) {
		IVLLocalVarDecl from = decl("$from", stateType);
		IVLLocalVarDecl to = decl("$to", stateType);
		List<IVLExpression> disjuncts = new ArrayList<>();
		for (RgAction action : regions.actions(region, guard)) {
			ctx.substitute(action.getFrom(), local(from));
			try {
				disjuncts.add(sourced(membership(local(to), action.getTo()), action));
			} finally {
				ctx.clearSubstitution(action.getFrom());
			}
		}
		return sourced(new IVLFunction(
				RegionModel.stepFunctionName(region, guard), append(args, from, to), boolType(),
				Collections.emptyList(), Collections.emptyList(),
				Optional.of(or(disjuncts))), guard);
	}

	/**
	 * The states reachable from {@code from} by any number of the guard's actions, axiomatised
	 * as a set containing {@code from} and closed under single steps.
	 */
	private IVLFunction closureFunction(RgRegion region, RgGuardDecl guard, List<IVLLocalVarDecl> args,
	                                    IVLType stateType) {
		IVLLocalVarDecl from = decl("$from", stateType);
		IVLLocalVarDecl s = decl("$s", stateType);
		IVLLocalVarDecl t = decl("$t", stateType);
		IVLResult result = new IVLResult(setType(stateType));
		IVLExpression closed = forall(Arrays.asList(s, t), implies(
				and(contains(local(s), result), terms.step(region, guard, locals(args), local(s), local(t))),
				contains(local(t), result)));
		return sourced(abstractFunction(
				RegionModel.closureFunctionName(region, guard), append(args, from), setType(stateType),
				Collections.emptyList(),
				Arrays.asList(contains(local(from), result), closed)), guard);
	}

	private IVLExpression membership(IVLExpression element, RgExpression set) {
		if (set instanceof RgSetComprehension) {
			return expressions.comprehensionMembership(element, (RgSetComprehension) set);
		}
		return contains(element, expressions.translate(set));
	}

	private List<IVLExpression> interferencePreconditions(RgInterferenceClause clause) {
		RegionInstance instance = regions.instanceOf(clause.getRegionId());
		RgRegion region = instance.getRegion();
		List<IVLExpression> inArgs = expressions.inArgs(instance);
		IVLExpression context = terms.atomicityContext(region, inArgs);
		IVLExpression allowed;
		if (clause.getSet() instanceof RgSetComprehension) {
			IVLLocalVarDecl x = decl("$x", terms.stateType(region));
			allowed = forall(Collections.singletonList(x),
					eq(contains(local(x), terms.atomicityContext(region, inArgs)), membership(local(x), clause.getSet())));
		} else {
			allowed = eq(context, expressions.translate(clause.getSet()));
		}
		return Arrays.asList(
				sourced(contains(terms.state(region, inArgs), terms.atomicityContext(region, inArgs)), clause),
				sourced(allowed, clause));
	}

	private IVLMethod translateProcedure(RgProcedure procedure, Map<String, Type> stateTypes) {
		List<IVLLocalVarDecl> returns = new ArrayList<>();
		if (!(procedure.getReturnType() instanceof VoidType)) {
			returns.add(decl(NameAnalysis.RETURN_VARIABLE, TypeTranslator.translate(procedure.getReturnType())));
		}

		List<IVLExpression> pres = new ArrayList<>();
		for (RgInterferenceClause clause : procedure.getInters()) {
			pres.addAll(interferencePreconditions(clause));
		}
		for (RgPreconditionClause pre : procedure.getPres()) {
			pres.add(sourced(expressions.translate(pre.getAssertion()), pre));
		}
		List<IVLExpression> posts = new ArrayList<>();
		for (RgPostconditionClause post : procedure.getPosts()) {
			posts.add(sourced(expressions.translate(post.getAssertion()), post));
		}

		List<IVLLocalVarDecl> locals = new ArrayList<>();
		for (RgLocalVariableDecl local : procedure.getLocals()) {
			locals.add(sourced(decl(local.getId().getName(), TypeTranslator.translate(local.getType())), local));
		}
		for (Type stateType : stateTypes.values()) {
			locals.add(decl(RegionModel.tmpVariableName(stateType), TypeTranslator.translate(stateType)));
		}

		IVLSeqn body = statements.translateBlock(procedure.getBody());
		return sourced(new IVLMethod(
				procedure.getId().getName(), formalArgs(procedure.getFormalArgs()), returns,
				pres, posts, locals, Optional.of(body)), procedure);
	}
}
