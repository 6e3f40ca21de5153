package rgv.trans.passes.backtranslation;

import rgv.model.rg.RgNode;

/**
 * A free-text hint, such as a translated failure reason.
 */
public class AdditionalErrorClarification extends ErrorClarification {
	private final String message;

	public AdditionalErrorClarification(String message, RgNode node) {
		super(node);
		this.message = message;
	}

	@Override
	public String getMessage() {
		return message;
	}
}
