package rgv.trans;

import rgv.RGVException;

/**
 * Exception raised while checking or translating a program tree
 */
public class RGVTransException extends RGVException {

	private static final long serialVersionUID = 4102837712230918475L;
	private static final String prefix = "Translation Error";

	public RGVTransException(String msg) {
		super(prefix, msg);
	}

}
