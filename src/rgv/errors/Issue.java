package rgv.errors;

import rgv.Unreachable;
import rgv.formatters.IndentingWriter;
import rgv.formatters.IssueFormattingVisitor;
import rgv.trans.RGVTransException;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A user-facing diagnostic.
 */
public abstract class Issue extends RGVTransException {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
}
