package rgv.model.rg;

import rgv.Unreachable;
import rgv.formatters.IndentingWriter;
import rgv.formatters.RgExpressionFormattingVisitor;
import rgv.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Expressions double as assertions: points-to, predicate, guard and diamond expressions
 * denote resources and only make sense in specification positions.
 */
public abstract class RgExpression extends RgNode {
	public RgExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new RgExpressionFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
