package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgIdnUse;
import rgv.model.type.Type;

/**
 * The receiver of a field access is not a reference to a declared struct.
 */
public class InvalidReceiverIssue extends Issue {
	public enum Reason {
		NOT_A_REFERENCE,
		NOT_A_STRUCT,
	}

	private final RgIdnUse receiver;
	private final Type receiverType;
	private final Reason reason;

	public InvalidReceiverIssue(RgIdnUse receiver, Type receiverType, Reason reason) {
		this.receiver = receiver;
		this.receiverType = receiverType;
		this.reason = reason;
	}

	public RgIdnUse getReceiver() {
		return receiver;
	}

	public Type getReceiverType() {
		return receiverType;
	}

	public Reason getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
