package rgv.model.rg;

import rgv.model.type.Type;
import rgv.util.SourceLocation;

import java.util.List;
import java.util.Optional;

/**
 * {@code Set(?c | filter)}. Only supported as the right operand of a membership test and as
 * the target set of an action.
 */
public class RgSetComprehension extends RgExpression {
	private final RgLogicalVariableBinder binder;
	private final RgExpression filter;
	private final Type typeAnnotation;

	public RgSetComprehension(SourceLocation location, RgLogicalVariableBinder binder, RgExpression filter,
	                          Type typeAnnotation) {
		super(location);
		this.binder = binder;
		this.filter = filter;
		this.typeAnnotation = typeAnnotation;
	}

	public RgLogicalVariableBinder getBinder() {
		return binder;
	}

	public RgExpression getFilter() {
		return filter;
	}

	public Optional<Type> getTypeAnnotation() {
		return Optional.ofNullable(typeAnnotation);
	}

	@Override
	public List<RgNode> getChildren() {
		return children(binder, filter);
	}

	@Override
	public <T, E extends Throwable> T accept(RgExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
