package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;

/**
 * A heap location {@code receiver.field}.
 */
public class RgLocation extends RgNode {
	private final RgIdnUse receiver;
	private final RgIdnUse field;

	public RgLocation(SourceLocation location, RgIdnUse receiver, RgIdnUse field) {
		super(location);
		this.receiver = receiver;
		this.field = field;
	}

	public RgIdnUse getReceiver() {
		return receiver;
	}

	public RgIdnUse getField() {
		return field;
	}

	@Override
	public List<RgNode> getChildren() {
		return children(receiver, field);
	}

	@Override
	public String toString() {
		return receiver.getName() + "." + field.getName();
	}
}
