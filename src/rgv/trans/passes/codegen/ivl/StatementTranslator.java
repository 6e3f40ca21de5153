package rgv.trans.passes.codegen.ivl;

import rgv.model.ivl.*;
import rgv.model.rg.*;
import rgv.scope.RegionEntity;
import rgv.trans.passes.region.RegionInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static rgv.model.ivl.IVLBuilder.*;

/**
 * Translates statements into IVL statement sequences. Proof rules are handed to the
 * {@link RuleTranslator}.
 */
public class StatementTranslator extends RgStatementVisitor<List<IVLStatement>, RuntimeException> {
	private final TranslationContext ctx;
	private final ExpressionTranslator expressions;
	private final RuleTranslator rules;

	public StatementTranslator(TranslationContext ctx) {
		this.ctx = ctx;
		this.expressions = new ExpressionTranslator(ctx);
		this.rules = new RuleTranslator(ctx, expressions, this);
	}

	public List<IVLStatement> translate(RgStatement statement) {
		return statement.accept(this);
	}

	public IVLSeqn translateBlock(RgStatement statement) {
		return sourced(seqn(translate(statement)), statement);
	}

	private static List<IVLStatement> single(IVLStatement statement, RgStatement origin) {
		return Collections.singletonList(sourced(statement, origin));
	}

	@Override
	public List<IVLStatement> visit(RgBlock block) {
		List<IVLStatement> result = new ArrayList<>();
		for (RgStatement statement : block.getStatements()) {
			result.addAll(translate(statement));
		}
		return result;
	}

	@Override
	public List<IVLStatement> visit(RgSkip skip) {
		return Collections.emptyList();
	}

	@Override
	public List<IVLStatement> visit(RgIf rgIf) {
		return single(new IVLIf(
				expressions.translate(rgIf.getCondition()),
				translateBlock(rgIf.getThen()),
				translateBlock(rgIf.getElse())), rgIf);
	}

	@Override
	public List<IVLStatement> visit(RgWhile rgWhile) {
		List<IVLExpression> invariants = new ArrayList<>();
		for (RgInvariantClause invariant : rgWhile.getInvariants()) {
			invariants.add(sourced(expressions.translate(invariant.getAssertion()), invariant));
		}
		return single(new IVLWhile(
				expressions.translate(rgWhile.getCondition()),
				invariants,
				translateBlock(rgWhile.getBody())), rgWhile);
	}

	@Override
	public List<IVLStatement> visit(RgAssign assign) {
		return single(new IVLLocalAssign(
				expressions.variable(assign.getLhs()),
				expressions.translate(assign.getRhs())), assign);
	}

	@Override
	public List<IVLStatement> visit(RgHeapRead heapRead) {
		return single(new IVLLocalAssign(
				expressions.variable(heapRead.getLhs()),
				expressions.location(heapRead.getHeapLocation())), heapRead);
	}

	@Override
	public List<IVLStatement> visit(RgHeapWrite heapWrite) {
		return single(new IVLFieldAssign(
				expressions.location(heapWrite.getHeapLocation()),
				expressions.translate(heapWrite.getRhs())), heapWrite);
	}

	@Override
	public List<IVLStatement> visit(RgProcedureCall procedureCall) {
		List<IVLLocalVar> targets = new ArrayList<>();
		procedureCall.getResult().ifPresent(result -> targets.add(expressions.variable(result)));
		return single(new IVLMethodCall(
				procedureCall.getProcedure().getName(),
				expressions.translate(procedureCall.getArguments()),
				targets), procedureCall);
	}

	/**
	 * An assertion that a region instance's state is the given out-argument, if there is one
	 * and it is not a binder.
	 */
	private Optional<IVLStatement> stateAssertion(RgPredicateExp predicate) {
		if (!(ctx.getNames().entity(predicate.getPredicate()) instanceof RegionEntity)) {
			return Optional.empty();
		}
		RegionInstance instance = ctx.getRegions().instance(predicate);
		Optional<RgExpression> out = instance.getOutArg();
		if (!out.isPresent() || out.get() instanceof RgLogicalVariableBinder) {
			return Optional.empty();
		}
		IVLExpression state = new RegionTerms(ctx.getRegions()).state(instance.getRegion(), expressions.inArgs(instance));
		return Optional.of(sourced(assertS(sourced(eq(state, expressions.translate(out.get())), predicate)), predicate));
	}

	@Override
	public List<IVLStatement> visit(RgFold fold) {
		List<IVLStatement> result = new ArrayList<>();
		result.add(sourced(fold(expressions.predicateAccess(fold.getPredicate())), fold));
		stateAssertion(fold.getPredicate()).ifPresent(result::add);
		return result;
	}

	@Override
	public List<IVLStatement> visit(RgUnfold unfold) {
		List<IVLStatement> result = new ArrayList<>();
		stateAssertion(unfold.getPredicate()).ifPresent(result::add);
		result.add(sourced(unfold(expressions.predicateAccess(unfold.getPredicate())), unfold));
		return result;
	}

	@Override
	public List<IVLStatement> visit(RgInhale inhale) {
		return single(inhale(expressions.translate(inhale.getAssertion())), inhale);
	}

	@Override
	public List<IVLStatement> visit(RgExhale exhale) {
		return single(exhale(expressions.translate(exhale.getAssertion())), exhale);
	}

	@Override
	public List<IVLStatement> visit(RgAssume assume) {
		return single(inhale(expressions.translate(assume.getAssertion())), assume);
	}

	@Override
	public List<IVLStatement> visit(RgAssert rgAssert) {
		return single(assertS(expressions.translate(rgAssert.getAssertion())), rgAssert);
	}

	@Override
	public List<IVLStatement> visit(RgMakeAtomic makeAtomic) {
		return rules.translate(makeAtomic);
	}

	@Override
	public List<IVLStatement> visit(RgUpdateRegion updateRegion) {
		return rules.translate(updateRegion);
	}

	@Override
	public List<IVLStatement> visit(RgUseAtomic useAtomic) {
		return rules.translate(useAtomic);
	}

	@Override
	public List<IVLStatement> visit(RgOpenRegion openRegion) {
		return rules.translate(openRegion);
	}
}
