package rgv.trans.passes.backtranslation;

import rgv.errors.Issue;
import rgv.model.rg.RgNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A verifier failure mapped back onto the program construct it concerns.
 */
public abstract class VerificationIssue extends Issue {
	private final RgNode node;
	private final List<ErrorClarification> clarifications;

	public VerificationIssue(RgNode node) {
		this.node = node;
		this.clarifications = new ArrayList<>();
	}

	public VerificationIssue(RgNode node, ErrorClarification clarification) {
		this(node);
		clarifications.add(clarification);
	}

	public VerificationIssue(RgNode node, String reason) {
		this(node);
		clarifications.add(new AdditionalErrorClarification(reason, node));
	}

	public RgNode getNode() {
		return node;
	}

	/**
	 * @return a short description of what might fail, e.g. "Assignment might fail"
	 */
	public abstract String getDescription();

	public List<ErrorClarification> getClarifications() {
		return Collections.unmodifiableList(clarifications);
	}

	public VerificationIssue dueTo(ErrorClarification clarification) {
		clarifications.add(clarification);
		return this;
	}

	public VerificationIssue dueTo(String reason) {
		return dueTo(new AdditionalErrorClarification(reason, node));
	}
}
