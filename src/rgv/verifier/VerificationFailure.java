package rgv.verifier;

import rgv.model.ivl.IVLNode;

/**
 * A failed proof obligation. The offending node is the IVL statement or expression whose
 * obligation failed, compared by identity when matching failures to the constructs that
 * emitted them.
 */
public class VerificationFailure {
	public enum Kind {
		ASSIGNMENT_FAILED("Assignment might fail"),
		POSTCONDITION_VIOLATED("Postcondition might not hold"),
		PRECONDITION_IN_CALL_FALSE("The precondition of a method might not hold"),
		ASSERT_FAILED("Assert might fail"),
		EXHALE_FAILED("Exhale might fail"),
		INHALE_FAILED("Inhale might fail"),
		FOLD_FAILED("Folding might fail"),
		UNFOLD_FAILED("Unfolding might fail"),
		LOOP_INVARIANT_NOT_ESTABLISHED("Loop invariant might not hold on entry"),
		LOOP_INVARIANT_NOT_PRESERVED("Loop invariant might not be preserved");

		private final String description;

		Kind(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Kind kind;
	private final IVLNode offendingNode;
	private final FailureReason reason;

	public VerificationFailure(Kind kind, IVLNode offendingNode, FailureReason reason) {
		this.kind = kind;
		this.offendingNode = offendingNode;
		this.reason = reason;
	}

	public Kind getKind() {
		return kind;
	}

	public IVLNode getOffendingNode() {
		return offendingNode;
	}

	public FailureReason getReason() {
		return reason;
	}

	/**
	 * @return whether node (the very node, not an equal one) is the failed obligation
	 */
	public boolean causedBy(IVLNode node) {
		return offendingNode == node;
	}

	@Override
	public String toString() {
		return kind.getDescription() + ". " + reason.getReadableMessage();
	}
}
