package rgv.trans.passes.backtranslation;

import rgv.verifier.FailureReason;

import java.util.function.Function;
import java.util.function.Predicate;

public class ReasonTransformer {
	private final Predicate<FailureReason> applies;
	private final Function<FailureReason, String> transform;

	public ReasonTransformer(Predicate<FailureReason> applies, Function<FailureReason, String> transform) {
		this.applies = applies;
		this.transform = transform;
	}

	public boolean appliesTo(FailureReason reason) {
		return applies.test(reason);
	}

	public String transform(FailureReason reason) {
		return transform.apply(reason);
	}
}
