package rgv.model.rg;

import rgv.model.type.Type;
import rgv.util.SourceLocation;

import java.util.List;

public class RgFieldDecl extends RgDeclaration {
	private final Type type;

	public RgFieldDecl(SourceLocation location, RgIdnDef id, Type type) {
		super(location, id);
		this.type = type;
	}

	public Type getType() {
		return type;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(getId());
	}

	@Override
	public String toString() {
		return getId().getName() + ": " + type;
	}
}
