package rgv.model.rg;

import rgv.scope.UID;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Structural queries over one program tree: parents and document order.
 * The index is computed once, when the tree is wrapped.
 */
public class RgTree {
	private final RgProgram root;
	private final Map<UID, RgNode> parents;
	private final List<RgNode> preorder;

	public RgTree(RgProgram root) {
		this.root = root;
		this.parents = new HashMap<>();
		this.preorder = new ArrayList<>();
		index(root);
	}

	private void index(RgNode node) {
		preorder.add(node);
		for (RgNode child : node.getChildren()) {
			if (parents.put(child.getUID(), node) != null) {
				throw new IllegalArgumentException("node " + child + " occurs more than once in the tree");
			}
			index(child);
		}
	}

	public RgProgram getRoot() {
		return root;
	}

	public Optional<RgNode> parent(RgNode node) {
		return Optional.ofNullable(parents.get(node.getUID()));
	}

	/**
	 * @return every node of the tree, in document order
	 */
	public List<RgNode> getNodes() {
		return Collections.unmodifiableList(preorder);
	}

	/**
	 * @return the nearest proper ancestor of node satisfying the predicate
	 */
	public Optional<RgNode> enclosing(RgNode node, Predicate<RgNode> predicate) {
		Optional<RgNode> current = parent(node);
		while (current.isPresent() && !predicate.test(current.get())) {
			current = parent(current.get());
		}
		return current;
	}

	public <N extends RgNode> Optional<N> enclosing(RgNode node, Class<N> kind) {
		return enclosing(node, kind::isInstance).map(kind::cast);
	}

	/**
	 * @return node and all of its descendants, in document order
	 */
	public List<RgNode> subtree(RgNode node) {
		List<RgNode> result = new ArrayList<>();
		collect(node, result);
		return result;
	}

	public <N extends RgNode> List<N> subtree(RgNode node, Class<N> kind) {
		return subtree(node).stream().filter(kind::isInstance).map(kind::cast).collect(Collectors.toList());
	}

	private static void collect(RgNode node, List<RgNode> into) {
		into.add(node);
		for (RgNode child : node.getChildren()) {
			collect(child, into);
		}
	}
}
