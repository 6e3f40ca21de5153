package rgv.trans;

import org.junit.Before;
import org.junit.Test;
import rgv.RGVOptions;
import rgv.RgExamples;
import rgv.model.ivl.*;
import rgv.model.rg.RgMakeAtomic;
import rgv.model.rg.RgProcedure;
import rgv.model.rg.RgProcedureBuilder;
import rgv.model.rg.RgProgram;
import rgv.trans.passes.backtranslation.*;
import rgv.trans.passes.validation.DanglingReferenceIssue;
import rgv.trans.passes.validation.UntypableExpressionIssue;
import rgv.verifier.FailureReason;
import rgv.verifier.VerificationFailure;
import rgv.verifier.Verifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.*;
import static rgv.model.ivl.IVLBuilder.acc;
import static rgv.model.ivl.IVLBuilder.local;
import static rgv.model.ivl.IVLBuilder.refType;
import static rgv.model.rg.RgBuilder.assign;
import static rgv.model.rg.RgBuilder.bool;
import static rgv.model.rg.RgBuilder.comprehension;
import static rgv.model.rg.RgBuilder.conditional;
import static rgv.model.rg.RgBuilder.contains;
import static rgv.model.rg.RgBuilder.eq;
import static rgv.model.rg.RgBuilder.idexp;
import static rgv.model.rg.RgBuilder.num;

public class RGVTranslatorTest {

	private RGVOptions options;
	private List<IVLProgram> verified;

	@Before
	public void setup() {
		options = new RGVOptions();
		options.sectionComments = false;
		verified = new ArrayList<>();
	}

	private static IVLStatement find(IVLProgram program, Predicate<IVLStatement> matches) {
		for (IVLMethod method : program.getMethods()) {
			for (IVLStatement statement : method.getBody().get().getStatements()) {
				if (matches.test(statement)) {
					return statement;
				}
			}
		}
		throw new java.lang.AssertionError("no matching statement");
	}

	/**
	 * A verifier that fails the first statement matching the predicate.
	 */
	private Verifier failing(Predicate<IVLStatement> matches, VerificationFailure.Kind kind,
	                         boolean insufficientPermission) {
		return program -> {
			verified.add(program);
			IVLStatement statement = find(program, matches);
			FailureReason reason = insufficientPermission
					? FailureReason.insufficientPermission(statement)
					: FailureReason.assertionFalse(statement);
			return Collections.singletonList(new VerificationFailure(kind, statement, reason));
		};
	}

	@Test
	public void verifiedProgram() {
		TranslationResult result = new RGVTranslator(options, program -> {
			verified.add(program);
			return Collections.emptyList();
		}).run(RgExamples.incrementingCell());

		assertTrue(result.isVerified());
		assertEquals(1, verified.size());
		assertSame(verified.get(0), result.getProgram().get());
		assertTrue(result.getVerificationIssues().isEmpty());
	}

	@Test
	public void programWithDiagnosticsIsNotVerified() {
		RgProgram program = RgExamples.cellWith(assign("z", num(1)));
		TranslationResult result = new RGVTranslator(options, p -> {
			throw new IllegalStateException("must not be called");
		}).run(program);

		assertFalse(result.isVerified());
		assertFalse(result.getProgram().isPresent());
		assertTrue(result.getIssues().getIssues().stream().anyMatch(i -> i instanceof DanglingReferenceIssue));
	}

	@Test
	public void typeCycleIsReportedAsUntypable() {
		RgProgram program = RgExamples.withMembers(new RgProcedureBuilder("p")
				.addPrecondition(contains(num(1),
						comprehension("c", eq(conditional(bool(true), idexp("c"), idexp("c")), num(1)))))
				.build());
		TranslationResult result = new RGVTranslator(options, p -> {
			throw new IllegalStateException("must not be called");
		}).run(program);

		assertFalse(result.isVerified());
		assertFalse(result.getProgram().isPresent());
		assertTrue(result.getIssues().getIssues().stream().anyMatch(i -> i instanceof UntypableExpressionIssue));
	}

	@Test
	public void missingGuardIsReportedOnMakeAtomic() {
		IVLPredicateAccessPredicate guard = acc("Cell_incr", Collections.<IVLExpression>singletonList(local("r", refType())));
		RgProgram program = RgExamples.incrementingCell();
		TranslationResult result = new RGVTranslator(options, failing(
				s -> s instanceof IVLExhale && ((IVLExhale) s).getExp().equals(guard),
				VerificationFailure.Kind.EXHALE_FAILED, true)).run(program);

		assertFalse(result.isVerified());
		assertEquals(1, result.getVerificationIssues().size());
		VerificationIssue issue = result.getVerificationIssues().get(0);
		assertThat(issue, instanceOf(MakeAtomicError.class));
		RgProcedure incr = program.getProcedures().get(0);
		assertSame(incr.getBody().getChildren().get(0), issue.getNode());
		assertThat(issue.getClarifications().get(0), instanceOf(InsufficientGuardPermissionError.class));
		assertSame(((RgMakeAtomic) issue.getNode()).getGuard(), issue.getClarifications().get(0).getNode());
	}

	@Test
	public void disallowedTargetStateIsReportedOnTheGuard() {
		RgProgram program = RgExamples.incrementingCell();
		TranslationResult result = new RGVTranslator(options, failing(
				s -> s instanceof IVLAssert && ((IVLAssert) s).getExp() instanceof IVLSetContains &&
						((IVLSetContains) ((IVLAssert) s).getExp()).getSet() instanceof IVLFuncApp &&
						((IVLFuncApp) ((IVLSetContains) ((IVLAssert) s).getExp()).getSet())
								.getFunctionName().equals("Cell_incr_closure"),
				VerificationFailure.Kind.ASSERT_FAILED, false)).run(program);

		VerificationIssue issue = result.getVerificationIssues().get(0);
		assertThat(issue, instanceOf(MakeAtomicError.class));
		RgMakeAtomic makeAtomic = (RgMakeAtomic) issue.getNode();
		assertThat(issue.getClarifications().get(0), instanceOf(IllegalRegionStateChangeError.class));
		assertSame(makeAtomic.getGuard(), issue.getClarifications().get(0).getNode());
		assertTrue(issue.getClarifications().get(1).getMessage().contains("transitioned to a state"));
		// the body has no loop
		assertEquals(2, issue.getClarifications().size());
		assertTrue(result.getIssues().format().contains(issue.getDescription()));
	}

	@Test
	public void failuresNobodyClaimsAreDropped() {
		TranslationResult result = new RGVTranslator(options, failing(
				s -> s instanceof IVLInhale,
				VerificationFailure.Kind.INHALE_FAILED, true)).run(RgExamples.incrementingCell());

		assertEquals(1, verified.size());
		assertTrue(result.getVerificationIssues().isEmpty());
		assertFalse(result.getIssues().hasErrors());
	}
}
