package rgv.trans.attribution;

import rgv.model.rg.RgNode;
import rgv.scope.UID;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * A lazily computed, memoised property of tree nodes. Values are cached per node identity
 * for the lifetime of the attribute, which is one analysis run.
 *
 * Demanding the value for a node whose computation is still in progress throws
 * {@link CycleDetectedException}; a computation that throws leaves nothing cached.
 *
 * @param <N> the kind of node the attribute is defined on
 * @param <V> the attribute value
 */
public class Attribute<N extends RgNode, V> {
	private final String name;
	private final Function<N, V> definition;
	private final Map<UID, V> memo;
	private final Set<UID> inProgress;

	public Attribute(String name, Function<N, V> definition) {
		this.name = name;
		this.definition = definition;
		this.memo = new HashMap<>();
		this.inProgress = new HashSet<>();
	}

	public V apply(N node) {
		UID uid = node.getUID();
		if (memo.containsKey(uid)) {
			return memo.get(uid);
		}
		if (!inProgress.add(uid)) {
			throw new CycleDetectedException(name, node);
		}
		try {
			V value = definition.apply(node);
			memo.put(uid, value);
			return value;
		} finally {
			inProgress.remove(uid);
		}
	}

	public String getName() {
		return name;
	}
}
