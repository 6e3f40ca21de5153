package rgv.util;

/**
 *
 * Where something was Derived from.
 *
 * The visitor lets translation code find out what the origin actually was,
 * which is how a generated IVL node is traced back to the program tree.
 *
 */
public interface Origin {
	<T, E extends Throwable> T accept(OriginVisitor<T, E> v) throws E;
}
