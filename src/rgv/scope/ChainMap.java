package rgv.scope;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 *
 * One layer of a scope chain. Lookups fall through to the parent layer; modifications
 * only ever touch this layer.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class ChainMap<K, V> implements Map<K, V> {
	private final Map<K, V> parent;
	private final Map<K, V> members;

	public ChainMap(Map<K, V> parent) {
		this.parent = parent;
		this.members = new HashMap<>();
	}

	public Map<K, V> getParent() {
		return parent;
	}

	/**
	 * @return whether k is bound in this layer, ignoring the parents
	 */
	public boolean containsLocalKey(Object k) {
		return members.containsKey(k);
	}

	@Override
	public void clear() {
		members.clear();
	}

	@Override
	public boolean containsKey(Object k) {
		return members.containsKey(k) || parent.containsKey(k);
	}

	@Override
	public boolean containsValue(Object v) {
		return members.containsValue(v) || parent.containsValue(v);
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		Map<K, V> result = new HashMap<>(members);
		for (Entry<K, V> e : parent.entrySet()) {
			result.putIfAbsent(e.getKey(), e.getValue());
		}
		return result.entrySet();
	}

	@Override
	public V get(Object k) {
		if (members.containsKey(k)) {
			return members.get(k);
		}
		return parent.get(k);
	}

	@Override
	public boolean isEmpty() {
		return members.isEmpty() && parent.isEmpty();
	}

	@Override
	public Set<K> keySet() {
		Set<K> result = new HashSet<>(members.keySet());
		result.addAll(parent.keySet());
		return result;
	}

	@Override
	public V put(K k, V v) {
		return members.put(k, v);
	}

	@Override
	public void putAll(Map<? extends K, ? extends V> arg) {
		members.putAll(arg);
	}

	@Override
	public V remove(Object k) {
		return members.remove(k);
	}

	@Override
	public int size() {
		return keySet().size();
	}

	@Override
	public Collection<V> values() {
		return entrySet().stream().map(Entry::getValue).collect(Collectors.toList());
	}
}
