package rgv.model.type;

import org.junit.Test;

import static org.junit.Assert.*;

public class TypeUtilTest {

	@Test
	public void equalTypesAreCompatible() {
		assertTrue(TypeUtil.isCompatible(new SetType(new IntType()), new SetType(new IntType())));
		assertFalse(TypeUtil.isCompatible(new SetType(new IntType()), new SeqType(new IntType())));
		assertFalse(TypeUtil.isCompatible(new IntType(), new BoolType()));
	}

	@Test
	public void nullIsCompatibleWithReferencesOnly() {
		assertTrue(TypeUtil.isCompatible(new RefType("Box"), new NullType()));
		assertTrue(TypeUtil.isCompatible(new NullType(), new RefType("Box")));
		assertFalse(TypeUtil.isCompatible(new NullType(), new IntType()));
	}

	@Test
	public void referencesToDifferentStructsDiffer() {
		assertFalse(TypeUtil.isCompatible(new RefType("Box"), new RefType("Node")));
	}

	@Test
	public void unknownIsCompatibleWithAnything() {
		assertTrue(TypeUtil.isCompatible(new UnknownType(), new IntType()));
		assertTrue(TypeUtil.isCompatible(new SeqType(new BoolType()), new UnknownType()));
	}
}
