package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * An occurrence of an identifier, either defining or using.
 */
public abstract class RgIdnNode extends RgNode {
	private final String name;

	public RgIdnNode(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public List<RgNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		return name;
	}
}
