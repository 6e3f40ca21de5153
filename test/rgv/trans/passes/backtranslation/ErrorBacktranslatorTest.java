package rgv.trans.passes.backtranslation;

import org.junit.Before;
import org.junit.Test;
import rgv.RGVOptions;
import rgv.model.ivl.IVLAssert;
import rgv.model.ivl.IVLBoolLit;
import rgv.model.ivl.IVLExhale;
import rgv.model.rg.RgAssert;
import rgv.verifier.FailureReason;
import rgv.verifier.VerificationFailure;

import java.util.Arrays;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.*;
import static rgv.model.ivl.IVLBuilder.*;
import static rgv.model.rg.RgBuilder.assertS;
import static rgv.model.rg.RgBuilder.bool;

public class ErrorBacktranslatorTest {

	private ErrorBacktranslator backtranslator;
	private RgAssert source;
	private IVLAssert encoded;
	private IVLBoolLit condition;

	@Before
	public void setup() {
		backtranslator = new ErrorBacktranslator(new RGVOptions());
		source = assertS(bool(false));
		condition = trueLit();
		encoded = sourced(rgv.model.ivl.IVLBuilder.assertS(condition), source);
	}

	private VerificationFailure assertFailed() {
		return new VerificationFailure(VerificationFailure.Kind.ASSERT_FAILED, encoded,
				FailureReason.assertionFalse(condition));
	}

	@Test
	public void failedAssertMapsToAssertionError() {
		VerificationIssue issue = backtranslator.translate(assertFailed()).get();
		assertThat(issue, instanceOf(AssertionError.class));
		assertSame(source, issue.getNode());
		assertEquals("Assertion \"true\" might not hold", issue.getClarifications().get(0).getMessage());
	}

	@Test
	public void laterTransformersTakePrecedence() {
		backtranslator.addErrorTransformer(new ErrorTransformer(
				f -> f.causedBy(encoded),
				f -> new AssertionError(source, "first")));
		backtranslator.addErrorTransformer(new ErrorTransformer(
				f -> f.causedBy(encoded),
				f -> new AssertionError(source, "second")));

		VerificationIssue issue = backtranslator.translate(assertFailed()).get();
		assertEquals("second", issue.getClarifications().get(0).getMessage());
	}

	@Test
	public void transformersMatchTheVeryNode() {
		IVLAssert equal = sourced(rgv.model.ivl.IVLBuilder.assertS(trueLit()), source);
		backtranslator.addErrorTransformer(new ErrorTransformer(
				f -> f.causedBy(equal),
				f -> new AssertionError(source, "matched by equality")));

		VerificationIssue issue = backtranslator.translate(assertFailed()).get();
		assertNotEquals("matched by equality", issue.getClarifications().get(0).getMessage());
	}

	@Test
	public void unattributableFailuresAreDropped() {
		IVLExhale internal = exhale(trueLit());
		VerificationFailure failure = new VerificationFailure(VerificationFailure.Kind.EXHALE_FAILED, internal,
				FailureReason.insufficientPermission(internal));

		assertEquals(Optional.empty(), backtranslator.translate(failure));
		assertEquals(1, backtranslator.translate(Arrays.asList(failure, assertFailed())).size());
	}

	@Test
	public void unknownReasonsKeepTheVerifiersMessage() {
		FailureReason reason = new FailureReason(FailureReason.Kind.OTHER, trueLit(), "Division by zero");
		assertEquals("Division by zero", backtranslator.translate(reason));

		backtranslator.addReasonTransformer(new ReasonTransformer(
				r -> r.getKind() == FailureReason.Kind.OTHER,
				r -> "custom"));
		assertEquals("custom", backtranslator.translate(reason));
	}
}
