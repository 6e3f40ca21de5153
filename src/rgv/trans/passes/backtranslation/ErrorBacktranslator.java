package rgv.trans.passes.backtranslation;

import rgv.RGVOptions;
import rgv.model.rg.RgAssign;
import rgv.model.rg.RgHeapRead;
import rgv.model.rg.RgHeapWrite;
import rgv.model.rg.RgNode;
import rgv.model.rg.RgStatement;
import rgv.verifier.FailureReason;
import rgv.verifier.VerificationFailure;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Maps verifier failures back to issues about the program.
 *
 * Transformers are tried most recently registered first, so that the specific transformers a
 * proof rule registers for its own obligations take precedence over the general defaults. A
 * failure no transformer applies to is dropped; those are obligations whose failure the
 * translation does not attribute to anything the user wrote.
 */
public class ErrorBacktranslator {
	private static final Logger logger = Logger.getLogger("RGV.Backtranslator");

	private final LinkedList<ErrorTransformer> errorTransformers;
	private final LinkedList<ReasonTransformer> reasonTransformers;
	private final boolean reportDroppedFailures;

	public ErrorBacktranslator(RGVOptions options) {
		this.errorTransformers = new LinkedList<>();
		this.reasonTransformers = new LinkedList<>();
		this.reportDroppedFailures = options.reportDroppedFailures;
		addDefaultTransformers();
	}

	private void addDefaultTransformers() {
		addErrorTransformer(new ErrorTransformer(
				f -> f.getKind() == VerificationFailure.Kind.ASSIGNMENT_FAILED && source(f).filter(n ->
						n instanceof RgAssign || n instanceof RgHeapRead || n instanceof RgHeapWrite).isPresent(),
				f -> new AssignmentError((RgStatement) source(f).get(), translate(f.getReason()))));
		addErrorTransformer(new ErrorTransformer(
				f -> f.getKind() == VerificationFailure.Kind.POSTCONDITION_VIOLATED && source(f).isPresent(),
				f -> new PostconditionError(source(f).get(), translate(f.getReason()))));
		addErrorTransformer(new ErrorTransformer(
				f -> f.getKind() == VerificationFailure.Kind.PRECONDITION_IN_CALL_FALSE && source(f).isPresent(),
				f -> new PreconditionError(source(f).get(), translate(f.getReason()))));
		addErrorTransformer(new ErrorTransformer(
				f -> f.getKind() == VerificationFailure.Kind.ASSERT_FAILED && source(f).isPresent(),
				f -> new AssertionError(source(f).get(), translate(f.getReason()))));

		addReasonTransformer(new ReasonTransformer(
				r -> r.getKind() == FailureReason.Kind.INSUFFICIENT_PERMISSION,
				r -> "There might be insufficient permission to " + Source.describe(r.getOffendingNode())));
		addReasonTransformer(new ReasonTransformer(
				r -> r.getKind() == FailureReason.Kind.ASSERTION_FALSE,
				r -> "Assertion \"" + Source.describe(r.getOffendingNode()) + "\" might not hold"));
	}

	private static Optional<RgNode> source(VerificationFailure failure) {
		return Source.of(failure.getOffendingNode());
	}

	public void addErrorTransformer(ErrorTransformer transformer) {
		errorTransformers.addFirst(transformer);
	}

	public void addReasonTransformer(ReasonTransformer transformer) {
		reasonTransformers.addFirst(transformer);
	}

	public Optional<VerificationIssue> translate(VerificationFailure failure) {
		for (ErrorTransformer transformer : errorTransformers) {
			if (transformer.appliesTo(failure)) {
				return Optional.of(transformer.transform(failure));
			}
		}
		if (reportDroppedFailures) {
			logger.fine("dropping verification failure with no matching transformer: " + failure);
		}
		return Optional.empty();
	}

	public String translate(FailureReason reason) {
		for (ReasonTransformer transformer : reasonTransformers) {
			if (transformer.appliesTo(reason)) {
				return transformer.transform(reason);
			}
		}
		return reason.getReadableMessage();
	}

	public List<VerificationIssue> translate(List<VerificationFailure> failures) {
		List<VerificationIssue> issues = new ArrayList<>();
		for (VerificationFailure failure : failures) {
			translate(failure).ifPresent(issues::add);
		}
		return issues;
	}
}
