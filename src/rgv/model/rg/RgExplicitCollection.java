package rgv.model.rg;

import rgv.model.type.Type;
import rgv.util.SourceLocation;

import java.util.List;
import java.util.Optional;

public abstract class RgExplicitCollection extends RgExpression {
	private final List<RgExpression> elements;
	private final Type typeAnnotation;

	public RgExplicitCollection(SourceLocation location, List<RgExpression> elements, Type typeAnnotation) {
		super(location);
		this.elements = elements;
		this.typeAnnotation = typeAnnotation;
	}

	public List<RgExpression> getElements() {
		return elements;
	}

	/**
	 * @return the declared element type, if the collection was written as {@code Set<T>(...)}
	 */
	public Optional<Type> getTypeAnnotation() {
		return Optional.ofNullable(typeAnnotation);
	}

	@Override
	public List<RgNode> getChildren() {
		return children(elements);
	}
}
