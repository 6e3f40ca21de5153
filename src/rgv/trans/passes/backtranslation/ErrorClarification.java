package rgv.trans.passes.backtranslation;

import rgv.model.rg.RgNode;

/**
 * A possible cause attached to a verification issue, anchored at the construct it blames.
 */
public abstract class ErrorClarification {
	private final RgNode node;

	public ErrorClarification(RgNode node) {
		this.node = node;
	}

	public RgNode getNode() {
		return node;
	}

	public abstract String getMessage();

	@Override
	public String toString() {
		return getMessage();
	}
}
