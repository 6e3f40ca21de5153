package rgv;

public class RGVOptionException extends Exception {

	private static final long serialVersionUID = -6610957409815132904L;

	public RGVOptionException(String msg) {
		super(msg);
	}

	public RGVOptionException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
