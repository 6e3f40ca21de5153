package rgv.model.rg;

import rgv.model.type.Type;
import rgv.util.SourceLocation;

import java.util.List;

public class RgLocalVariableDecl extends RgDeclaration {
	private final Type type;

	public RgLocalVariableDecl(SourceLocation location, RgIdnDef id, Type type) {
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
