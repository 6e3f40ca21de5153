package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;
import java.util.Optional;

public class RgStruct extends RgMember {
	private final List<RgFieldDecl> fields;

	public RgStruct(SourceLocation location, RgIdnDef id, List<RgFieldDecl> fields) {
		super(location, id);
		this.fields = fields;
	}

	public List<RgFieldDecl> getFields() {
		return fields;
	}

	public Optional<RgFieldDecl> getField(String name) {
		return fields.stream().filter(f -> f.getId().getName().equals(name)).findFirst();
	}

	@Override
	public List<RgNode> getChildren() {
		return children(getId(), fields);
	}

	@Override
	public <T, E extends Throwable> T accept(RgMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
