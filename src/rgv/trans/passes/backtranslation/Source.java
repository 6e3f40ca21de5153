package rgv.trans.passes.backtranslation;

import rgv.model.ivl.IVLNode;
import rgv.model.rg.RgNode;
import rgv.util.Derived;
import rgv.util.Origin;
import rgv.util.OriginVisitor;
import rgv.util.SourceLocatable;

import java.util.Optional;

/**
 * Finds the program construct an IVL node was generated from.
 */
public class Source {
	private Source() {}

	public static Optional<RgNode> of(IVLNode node) {
		return find(node);
	}

	private static Optional<RgNode> find(Derived derived) {
		for (Origin origin : derived.getOrigins()) {
			Optional<RgNode> found = origin.accept(new OriginVisitor<Optional<RgNode>, RuntimeException>() {
				@Override
				public Optional<RgNode> visit(SourceLocatable sourceLocatable) {
					if (sourceLocatable instanceof RgNode) {
						return Optional.of((RgNode) sourceLocatable);
					}
					return Optional.empty();
				}

				@Override
				public Optional<RgNode> visit(Derived derived) {
					return find(derived);
				}
			});
			if (found.isPresent()) {
				return found;
			}
		}
		return Optional.empty();
	}

	/**
	 * @return the originating construct, printed, or else the IVL node itself
	 */
	public static String describe(IVLNode node) {
		return of(node).map(RgNode::toString).orElseGet(node::toString);
	}
}
