package rgv.model.ivl;

import rgv.Unreachable;
import rgv.formatters.IVLNodeFormattingVisitor;
import rgv.formatters.IndentingWriter;
import rgv.util.Derived;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A node of the intermediate verification language handed to the verifier.
 *
 * Equality is structural and ignores origins. The origins record which program construct a
 * node encodes, which is how verifier failures are traced back to the source.
 */
public abstract class IVLNode extends Derived {

	public abstract <T, E extends Throwable> T accept(IVLNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new IVLNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
