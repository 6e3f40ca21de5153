package rgv.trans.passes.codegen.ivl;

import rgv.InternalCompilerError;
import rgv.model.ivl.*;
import rgv.model.rg.*;
import rgv.scope.GuardEntity;
import rgv.trans.passes.backtranslation.*;
import rgv.trans.passes.region.RegionInstance;
import rgv.trans.passes.region.RegionModel;
import rgv.verifier.FailureReason;
import rgv.verifier.VerificationFailure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static rgv.model.ivl.IVLBuilder.*;

/**
 * Encodes the four atomicity proof rules.
 *
 * Each rule registers the error transformers for its own obligations while it is translated,
 * keyed by the identity of the IVL node that encodes the obligation. Rules nested in a body
 * register later and are therefore tried first.
 */
public class RuleTranslator {
	static final String LOOP_INVARIANT_HINT = "A common source of this problem are insufficient loop invariants";

	private final TranslationContext ctx;
	private final ExpressionTranslator expressions;
	private final StatementTranslator statements;
	private final RegionTerms terms;

	RuleTranslator(TranslationContext ctx, ExpressionTranslator expressions, StatementTranslator statements) {
		this.ctx = ctx;
		this.expressions = expressions;
		this.statements = statements;
		this.terms = new RegionTerms(ctx.getRegions());
	}

	private RegionInstance instance(RgRuleStatement rule) {
		RegionInstance instance = ctx.getRegions().instance(rule.getRegionPredicate());
		if (instance.getOutArg().isPresent()) {
			throw new InternalCompilerError(rule.getStatementName() + " on " + rule.getRegionPredicate() +
					" must not have an out-argument");
		}
		return instance;
	}

	private static RgIdnUse regionId(RegionInstance instance) {
		return instance.getRegionId().orElseThrow(() ->
				new InternalCompilerError("region id of " + instance.getPredicate() + " is not a variable"));
	}

	private RgGuardDecl guard(RgGuardExp guardExp, RgRegion region) {
		GuardEntity guard = ctx.getRegions().guardOf(guardExp);
		if (guard.getRegion() != region) {
			throw new InternalCompilerError("guard " + guardExp + " does not belong to region " + region.getId());
		}
		return guard.getDeclaration();
	}

	/**
	 * The guard's access permission, or {@code true} for a duplicable guard.
	 */
	private IVLExpression guardAccess(RgGuardExp guardExp, RgRegion region, IVLExpression regionId) {
		RgGuardDecl guard = guard(guardExp, region);
		if (guard.isDuplicable()) {
			return sourced(trueLit(), guardExp);
		}
		return sourced(terms.guardAccess(region, guard, regionId), guardExp);
	}

	private void onFailure(VerificationFailure.Kind kind, IVLNode node,
	                       Function<VerificationFailure, VerificationIssue> issue) {
		ctx.getBacktranslator().addErrorTransformer(new ErrorTransformer(
				f -> f.getKind() == kind && f.causedBy(node), issue));
	}

	private VerificationIssue withLoopHint(VerificationIssue issue, RgStatement body, RgNode anchor) {
		if (!ctx.getNames().getTree().subtree(body, RgWhile.class).isEmpty()) {
			issue.dueTo(new AdditionalErrorClarification(LOOP_INVARIANT_HINT, anchor));
		}
		return issue;
	}

	private List<IVLLocalVarDecl> quantifiedArgs(RgRegion region) {
		List<IVLLocalVarDecl> vars = new ArrayList<>();
		vars.add(decl("$" + region.getRegionId().getId().getName(), refType()));
		for (RgFormalArgumentDecl arg : region.getFormalArgs()) {
			vars.add(decl("$" + arg.getId().getName(), TypeTranslator.translate(arg.getType())));
		}
		return vars;
	}

	/**
	 * Forgets what is known about the state of one region instance.
	 */
	private List<IVLStatement> stabilise(RgRegion region, List<IVLExpression> inArgs,
	                                     Function<IVLExhale, ErrorTransformer> onExhaleFailure) {
		String label = ctx.freshLabel("pre_havoc");
		IVLExhale exhale = exhale(terms.regionAccess(region, inArgs));
		ctx.getBacktranslator().addErrorTransformer(onExhaleFailure.apply(exhale));
		return ctx.section("stabilise " + region.getId().getName(), Arrays.asList(
				label(label),
				exhale,
				inhale(terms.regionAccess(region, inArgs))));
	}

	/**
	 * Forgets what is known about the states of all held instances of a region.
	 */
	private List<IVLStatement> stabiliseAll(RgRegion region) {
		String label = ctx.freshLabel("pre_havoc");
		List<IVLLocalVarDecl> vars = quantifiedArgs(region);
		List<IVLExpression> args = new ArrayList<>();
		for (IVLLocalVarDecl var : vars) {
			args.add(local(var));
		}
		IVLPredicateAccess instance = predicate(RegionModel.predicateName(region), args);
		IVLExpression held = binop(IVLBinaryOp.Operator.GT, old(perm(instance), label), new IVLNoPerm());
		return ctx.section("stabilise all " + region.getId().getName(), Arrays.asList(
				label(label),
				exhale(forall(vars, implies(held, terms.regionAccess(region, args)))),
				inhale(forall(vars, implies(held, terms.regionAccess(region, args))))));
	}

	private List<IVLStatement> stabiliseAllExcept(RgRegion excluded) {
		List<IVLStatement> result = new ArrayList<>();
		for (RgRegion region : ctx.getNames().getTree().getRoot().getRegions()) {
			if (region != excluded) {
				result.addAll(stabiliseAll(region));
			}
		}
		return result;
	}

	private List<IVLStatement> stabiliseAllRegions() {
		List<IVLStatement> result = new ArrayList<>();
		for (RgRegion region : ctx.getNames().getTree().getRoot().getRegions()) {
			result.addAll(stabiliseAll(region));
		}
		return result;
	}

	public List<IVLStatement> translate(RgMakeAtomic makeAtomic) {
		RegionInstance instance = instance(makeAtomic);
		RgRegion region = instance.getRegion();
		RgGuardDecl guard = guard(makeAtomic.getGuard(), region);
		RgIdnUse regionId = regionId(instance);
		RgPredicateExp regionPredicate = makeAtomic.getRegionPredicate();
		List<IVLExpression> inArgs = expressions.inArgs(instance);
		IVLExpression id = inArgs.get(0);
		List<IVLStatement> result = new ArrayList<>();

		result.add(sourced(inhale(acc(terms.diamond(id))), makeAtomic));

		IVLExhale exhaleGuard = sourced(exhale(guardAccess(makeAtomic.getGuard(), region, id)), makeAtomic.getGuard());
		onFailure(VerificationFailure.Kind.EXHALE_FAILED, exhaleGuard,
				f -> new MakeAtomicError(makeAtomic, new InsufficientGuardPermissionError(makeAtomic.getGuard())));
		result.add(exhaleGuard);

		Function<IVLExhale, ErrorTransformer> regionMissing = exhale -> new ErrorTransformer(
				f -> f.getKind() == VerificationFailure.Kind.EXHALE_FAILED && f.causedBy(exhale),
				f -> new MakeAtomicError(makeAtomic, new InsufficientRegionPermissionError(regionPredicate)));
		result.addAll(stabilise(region, inArgs, regionMissing));

		result.addAll(statements.translate(makeAtomic.getBody()));

		IVLFieldAccess stepFrom = sourced(terms.stepFrom(region, id), regionId);
		IVLSetContains stepFromAllowed = sourced(contains(stepFrom, terms.atomicityContext(region, inArgs)), makeAtomic);
		IVLAssert checkFrom = sourced(assertS(stepFromAllowed), makeAtomic);
		ctx.getBacktranslator().addErrorTransformer(new ErrorTransformer(
				f -> f.getKind() == VerificationFailure.Kind.ASSERT_FAILED && f.causedBy(checkFrom) &&
						f.getReason().getKind() == FailureReason.Kind.INSUFFICIENT_PERMISSION &&
						f.getReason().causedBy(stepFrom),
				f -> new MakeAtomicError(makeAtomic, new InsufficientTrackingResourcePermissionError(regionPredicate, regionId))
						.dueTo(new AdditionalErrorClarification(
								"The tracking resource only exists if the body updates the region with update_region",
								regionId))));
		ctx.getBacktranslator().addErrorTransformer(new ErrorTransformer(
				f -> f.getKind() == VerificationFailure.Kind.ASSERT_FAILED && f.causedBy(checkFrom) &&
						f.getReason().getKind() == FailureReason.Kind.ASSERTION_FALSE &&
						f.getReason().causedBy(stepFromAllowed),
				f -> withLoopHint(new MakeAtomicError(makeAtomic, new IllegalRegionStateChangeError(makeAtomic.getBody()))
						.dueTo(new AdditionalErrorClarification(
								"In particular, it cannot be shown that the region is transitioned from a " +
								"state that is compatible with the procedure's interference specification",
								regionId)), makeAtomic.getBody(), regionId)));

		IVLAssert checkTo = sourced(assertS(sourced(contains(
				terms.stepTo(region, id),
				terms.closure(region, guard, inArgs, terms.stepFrom(region, id))), makeAtomic)), makeAtomic);
		onFailure(VerificationFailure.Kind.ASSERT_FAILED, checkTo,
				f -> withLoopHint(new MakeAtomicError(makeAtomic, new IllegalRegionStateChangeError(makeAtomic.getGuard()))
						.dueTo(new AdditionalErrorClarification(
								"In particular, it cannot be shown that the region is transitioned to a " +
								"state that is compatible with the procedure's interference specification",
								regionId)), makeAtomic.getBody(), regionId));
		result.addAll(ctx.section("check update permitted", Arrays.asList(checkFrom, checkTo)));

		result.addAll(stabilise(region, inArgs, regionMissing));

		result.add(inhale(eq(terms.state(region, inArgs), terms.stepTo(region, id))));
		result.add(inhale(eq(old(terms.state(region, inArgs)), terms.stepFrom(region, id))));
		result.add(sourced(inhale(guardAccess(makeAtomic.getGuard(), region, id)), makeAtomic.getGuard()));

		IVLExhale exhaleTracking = sourced(exhale(and(
				sourced(acc(terms.stepFrom(region, id)), regionPredicate),
				sourced(acc(terms.stepTo(region, id)), regionPredicate))), regionPredicate);
		onFailure(VerificationFailure.Kind.EXHALE_FAILED, exhaleTracking,
				f -> withLoopHint(new MakeAtomicError(makeAtomic,
						new InsufficientTrackingResourcePermissionError(regionPredicate, regionId)),
						makeAtomic.getBody(), regionId));
		result.add(exhaleTracking);

		return ctx.section(makeAtomic.getStatementName(), result);
	}

	public List<IVLStatement> translate(RgUpdateRegion updateRegion) {
		RegionInstance instance = instance(updateRegion);
		RgRegion region = instance.getRegion();
		RgIdnUse regionId = regionId(instance);
		RgPredicateExp regionPredicate = updateRegion.getRegionPredicate();
		List<IVLExpression> inArgs = expressions.inArgs(instance);
		IVLExpression id = inArgs.get(0);
		List<IVLStatement> result = new ArrayList<>();

		IVLExhale exhaleDiamond = sourced(exhale(acc(terms.diamond(id))), updateRegion);
		onFailure(VerificationFailure.Kind.EXHALE_FAILED, exhaleDiamond,
				f -> new UpdateRegionError(updateRegion,
						new InsufficientDiamondResourcePermissionError(regionPredicate, regionId)));
		result.add(exhaleDiamond);

		String label = ctx.freshLabel("pre_region_update");
		result.add(label(label));

		IVLUnfold unfold = sourced(unfold(terms.regionAccess(region, inArgs)), regionPredicate);
		onFailure(VerificationFailure.Kind.UNFOLD_FAILED, unfold,
				f -> new UpdateRegionError(updateRegion, new InsufficientRegionPermissionError(regionPredicate)));
		result.add(unfold);

		result.addAll(stabiliseAllRegions());

		result.addAll(statements.translate(updateRegion.getBody()));

		IVLFold fold = sourced(fold(terms.regionAccess(region, inArgs)), regionPredicate);
		onFailure(VerificationFailure.Kind.FOLD_FAILED, fold,
				f -> new UpdateRegionError(updateRegion, ctx.getBacktranslator().translate(f.getReason())));
		result.add(fold);

		IVLExpression changed = ne(terms.state(region, inArgs), old(terms.state(region, inArgs), label));
		IVLSeqn recordStep = seqn(
				inhale(and(acc(terms.stepFrom(region, id)), acc(terms.stepTo(region, id)))),
				new IVLFieldAssign(terms.stepFrom(region, id), old(terms.state(region, inArgs), label)),
				new IVLFieldAssign(terms.stepTo(region, id), terms.state(region, inArgs)));
		IVLSeqn keepDiamond = seqn(inhale(acc(terms.diamond(id))));
		result.addAll(ctx.section("record step", Arrays.asList(
				sourced(new IVLIf(changed, recordStep, keepDiamond), updateRegion))));

		return ctx.section(updateRegion.getStatementName(), result);
	}

	public List<IVLStatement> translate(RgUseAtomic useAtomic) {
		RegionInstance instance = instance(useAtomic);
		RgRegion region = instance.getRegion();
		RgGuardDecl guard = guard(useAtomic.getGuard(), region);
		RgPredicateExp regionPredicate = useAtomic.getRegionPredicate();
		List<IVLExpression> inArgs = expressions.inArgs(instance);
		IVLExpression id = inArgs.get(0);
		List<IVLStatement> result = new ArrayList<>();

		String label = ctx.freshLabel("pre_use_atomic");
		result.add(label(label));

		IVLUnfold unfold = sourced(unfold(terms.regionAccess(region, inArgs)), regionPredicate);
		onFailure(VerificationFailure.Kind.UNFOLD_FAILED, unfold,
				f -> new UseAtomicError(useAtomic, new InsufficientRegionPermissionError(regionPredicate)));
		result.add(unfold);

		OpenRegion open = new OpenRegion(region, inArgs, label);
		ctx.pushOpenRegion(open);

		IVLExhale exhaleGuard = sourced(exhale(guardAccess(useAtomic.getGuard(), region, id)), useAtomic.getGuard());
		onFailure(VerificationFailure.Kind.EXHALE_FAILED, exhaleGuard,
				f -> new UseAtomicError(useAtomic, new InsufficientGuardPermissionError(useAtomic.getGuard())));
		result.add(exhaleGuard);

		result.addAll(stabiliseAllExcept(region));
		result.addAll(stabiliseAll(region));

		result.add(sourced(inhale(guardAccess(useAtomic.getGuard(), region, id)), useAtomic.getGuard()));

		result.addAll(statements.translate(useAtomic.getBody()));

		IVLFold fold = sourced(fold(terms.regionAccess(region, inArgs)), regionPredicate);
		onFailure(VerificationFailure.Kind.FOLD_FAILED, fold,
				f -> new UseAtomicError(useAtomic, new IllegalRegionStateChangeError(regionPredicate))
						.dueTo(new AdditionalErrorClarification(
								"In particular, closing the region at the end of the use-atomic block might fail",
								regionPredicate))
						.dueTo(ctx.getBacktranslator().translate(f.getReason())));
		result.add(fold);

		ctx.popOpenRegion(open);

		IVLAssert checkStep = sourced(assertS(contains(
				terms.state(region, inArgs),
				terms.closure(region, guard, inArgs, old(terms.state(region, inArgs), label)))), useAtomic);
		onFailure(VerificationFailure.Kind.ASSERT_FAILED, checkStep,
				f -> new UseAtomicError(useAtomic, new IllegalRegionStateChangeError(useAtomic.getBody())));
		result.addAll(ctx.section("check step permitted", Arrays.asList(checkStep)));

		return ctx.section(useAtomic.getStatementName(), result);
	}

	public List<IVLStatement> translate(RgOpenRegion openRegion) {
		RegionInstance instance = instance(openRegion);
		RgRegion region = instance.getRegion();
		RgPredicateExp regionPredicate = openRegion.getRegionPredicate();
		List<IVLExpression> inArgs = expressions.inArgs(instance);
		List<IVLStatement> result = new ArrayList<>();

		String label = ctx.freshLabel("pre_open_region");
		result.add(label(label));

		IVLUnfold unfold = sourced(unfold(terms.regionAccess(region, inArgs)), regionPredicate);
		onFailure(VerificationFailure.Kind.UNFOLD_FAILED, unfold,
				f -> new OpenRegionError(openRegion, new InsufficientRegionPermissionError(regionPredicate)));
		result.add(unfold);

		OpenRegion open = new OpenRegion(region, inArgs, label);
		ctx.pushOpenRegion(open);

		result.addAll(statements.translate(openRegion.getBody()));

		IVLFold fold = sourced(fold(terms.regionAccess(region, inArgs)), regionPredicate);
		onFailure(VerificationFailure.Kind.FOLD_FAILED, fold,
				f -> new OpenRegionError(openRegion, ctx.getBacktranslator().translate(f.getReason())));
		result.add(fold);

		ctx.popOpenRegion(open);

		IVLAssert checkUnchanged = sourced(assertS(eq(
				terms.state(region, inArgs),
				old(terms.state(region, inArgs), label))), openRegion);
		onFailure(VerificationFailure.Kind.ASSERT_FAILED, checkUnchanged,
				f -> new OpenRegionError(openRegion, new IllegalRegionStateChangeError(openRegion.getBody())));
		result.addAll(ctx.section("check state unchanged", Arrays.asList(checkUnchanged)));

		return ctx.section(openRegion.getStatementName(), result);
	}
}
