package rgv.model.type;

import rgv.Unreachable;
import rgv.formatters.IndentingWriter;
import rgv.formatters.TypeFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * The types of the annotated-program language. Types are values: equality is structural.
 */
public abstract class Type {

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new TypeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
