package rgv.trans.passes.backtranslation;

import rgv.verifier.VerificationFailure;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A partial mapping from verifier failures to issues: defined where {@code applies} holds.
 */
public class ErrorTransformer {
	private final Predicate<VerificationFailure> applies;
	private final Function<VerificationFailure, VerificationIssue> transform;

	public ErrorTransformer(Predicate<VerificationFailure> applies,
	                        Function<VerificationFailure, VerificationIssue> transform) {
		this.applies = applies;
		this.transform = transform;
	}

	public boolean appliesTo(VerificationFailure failure) {
		return applies.test(failure);
	}

	public VerificationIssue transform(VerificationFailure failure) {
		return transform.apply(failure);
	}
}
