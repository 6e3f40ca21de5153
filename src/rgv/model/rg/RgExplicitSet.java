package rgv.model.rg;

import rgv.model.type.Type;
import rgv.util.SourceLocation;

import java.util.List;

public class RgExplicitSet extends RgExplicitCollection {
	public RgExplicitSet(SourceLocation location, List<RgExpression> elements, Type typeAnnotation) {
		super(location, elements, typeAnnotation);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
