package rgv.scope;

import rgv.util.Derived;
import rgv.util.Origin;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of a program tree node. Attribute tables and scope tables are keyed by UID,
 * so two structurally equal nodes at different positions never share results.
 */
public class UID extends Derived {
	private static final AtomicLong nextId = new AtomicLong();

	private final long id;

	public UID() {
		this.id = nextId.getAndIncrement();
	}

	public long getId() {
		return id;
	}

	@Override
	public String toString() {
		StringBuilder b = new StringBuilder("UID#").append(id);
		b.append("(from ");
		boolean first = true;
		for (Origin o : getOrigins()) {
			if (first) {
				first = false;
			} else {
				b.append(", ");
			}
			b.append(o);
		}
		b.append(")");
		return b.toString();
	}
}
