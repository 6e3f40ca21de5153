package rgv.trans.passes.scope;

import rgv.scope.ChainMap;
import rgv.scope.Entity;
import rgv.scope.MultipleEntity;

import java.util.Collections;
import java.util.Map;

/**
 * One scope layer under construction. Definitions only ever land in this layer; lookups
 * made through {@link #getBindings()} fall through to the enclosing layers.
 */
public class ScopeBuilder {
	private final ChainMap<String, Entity> bindings;

	public ScopeBuilder() {
		this.bindings = new ChainMap<>(Collections.emptyMap());
	}

	private ScopeBuilder(Map<String, Entity> parent) {
		this.bindings = new ChainMap<>(parent);
	}

	public ScopeBuilder makeNestedScope() {
		return new ScopeBuilder(bindings);
	}

	/**
	 * Binds name in this layer. A second definition of the same name in the same layer turns
	 * its binding into a {@link MultipleEntity}.
	 *
	 * @return whether this was the first definition of name in this layer
	 */
	public boolean defineIfNew(String name, Entity entity) {
		if (bindings.containsLocalKey(name)) {
			bindings.put(name, new MultipleEntity());
			return false;
		}
		bindings.put(name, entity);
		return true;
	}

	public Map<String, Entity> getBindings() {
		return bindings;
	}
}
