package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

public class RgGuardDecl extends RgDeclaration {

	public enum Modifier {
		// exclusively owned
		UNIQUE,
		// freely shareable, so never exhaled
		DUPLICABLE,
	}

	private final Modifier modifier;

	public RgGuardDecl(SourceLocation location, RgIdnDef id, Modifier modifier) {
		super(location, id);
		this.modifier = modifier;
	}

	public Modifier getModifier() {
		return modifier;
	}

	public boolean isDuplicable() {
		return modifier == Modifier.DUPLICABLE;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(getId());
	}

	@Override
	public String toString() {
		return modifier.name().toLowerCase() + " " + getId().getName();
	}
}
