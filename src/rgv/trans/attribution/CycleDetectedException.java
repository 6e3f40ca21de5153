package rgv.trans.attribution;

import rgv.RGVException;
import rgv.model.rg.RgNode;

/**
 * Raised when an attribute is demanded for a node while that same attribute is already
 * being computed for it.
 */
public class CycleDetectedException extends RGVException {

	private static final long serialVersionUID = 2294812285403150671L;

	private final String attributeName;
	private final transient RgNode node;

	public CycleDetectedException(String attributeName, RgNode node) {
		super("Cycle detected", "attribute " + attributeName + " depends on itself at " + node);
		this.attributeName = attributeName;
		this.node = node;
	}

	public String getAttributeName() {
		return attributeName;
	}

	public RgNode getNode() {
		return node;
	}
}
