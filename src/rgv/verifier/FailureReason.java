package rgv.verifier;

import rgv.model.ivl.IVLNode;

/**
 * Why a proof obligation failed, anchored at the IVL node the verifier blames.
 */
public class FailureReason {
	public enum Kind {
		INSUFFICIENT_PERMISSION,
		ASSERTION_FALSE,
		OTHER,
	}

	private final Kind kind;
	private final IVLNode offendingNode;
	private final String readableMessage;

	public FailureReason(Kind kind, IVLNode offendingNode, String readableMessage) {
		this.kind = kind;
		this.offendingNode = offendingNode;
		this.readableMessage = readableMessage;
	}

	public static FailureReason insufficientPermission(IVLNode offendingNode) {
		return new FailureReason(Kind.INSUFFICIENT_PERMISSION, offendingNode,
				"There might be insufficient permission to access " + offendingNode);
	}

	public static FailureReason assertionFalse(IVLNode offendingNode) {
		return new FailureReason(Kind.ASSERTION_FALSE, offendingNode,
				"Assertion " + offendingNode + " might not hold");
	}

	public Kind getKind() {
		return kind;
	}

	public IVLNode getOffendingNode() {
		return offendingNode;
	}

	public String getReadableMessage() {
		return readableMessage;
	}

	/**
	 * @return whether the reason blames exactly this node, by identity
	 */
	public boolean causedBy(IVLNode node) {
		return offendingNode == node;
	}

	@Override
	public String toString() {
		return readableMessage;
	}
}
