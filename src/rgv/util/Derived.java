package rgv.util;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * Something that was derived from something else: a UID derived from a tree node,
 * or an IVL node derived from the source construct it encodes.
 *
 */
public abstract class Derived implements Origin {
	private final List<Origin> origins;

	public Derived() {
		this.origins = new ArrayList<>();
	}

	public Derived addOrigin(Origin origin) {
		origins.add(origin);
		return this;
	}

	public List<Origin> getOrigins() {
		return origins;
	}

	@Override
	public <T, E extends Throwable> T accept(OriginVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
