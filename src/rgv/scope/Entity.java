package rgv.scope;

/**
 * What an identifier denotes. The variants are closed: every consumer matches them through
 * {@link EntityVisitor}, so adding a variant is a compile error everywhere it is not handled.
 */
public abstract class Entity {
	public abstract <T, E extends Throwable> T accept(EntityVisitor<T, E> v) throws E;

	/**
	 * Unknown and Multiple entities stand for an error that is reported where the name is
	 * declared or used; consumers skip further checks on them.
	 */
	public boolean isErroneous() {
		return false;
	}
}
