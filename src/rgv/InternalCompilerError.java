package rgv;

/**
 * A violated translator invariant. Never a user error; aborts the run.
 */
public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError() {
		super("internal compiler error");
	}

	public InternalCompilerError(String detail) {
		super("internal compiler error: " + detail);
	}

	public InternalCompilerError(Exception e) {
		super("internal compiler error", e);
	}
}
