package rgv.model.rg;

import rgv.scope.UID;
import rgv.util.SourceLocatable;
import rgv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A node of the annotated-program tree. The tree is built once by the parser and never
 * mutated; node identity (its {@link UID}) is what attributes are keyed by.
 */
public abstract class RgNode extends SourceLocatable {

	private final SourceLocation location;
	private final UID uid;

	public RgNode(SourceLocation location) {
		this.location = location;
		this.uid = new UID();
		this.uid.addOrigin(this);
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public UID getUID() {
		return uid;
	}

	/**
	 * @return the direct children of this node, in document order
	 */
	public abstract List<RgNode> getChildren();

	/**
	 * Flattens nodes and collections of nodes into a child list, skipping absent (null) parts.
	 */
	protected static List<RgNode> children(Object... parts) {
		List<RgNode> result = new ArrayList<>();
		for (Object part : parts) {
			if (part instanceof RgNode) {
				result.add((RgNode) part);
			} else if (part instanceof Collection) {
				for (Object o : (Collection<?>) part) {
					result.add((RgNode) o);
				}
			}
		}
		return Collections.unmodifiableList(result);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " " + location.prettyString();
	}
}
