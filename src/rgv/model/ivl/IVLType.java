package rgv.model.ivl;

import rgv.Unreachable;
import rgv.formatters.IVLTypeFormattingVisitor;
import rgv.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

public abstract class IVLType {

	public abstract <T, E extends Throwable> T accept(IVLTypeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new IVLTypeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
