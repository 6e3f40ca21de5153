package rgv.trans.attribution;

import org.junit.Test;
import rgv.model.rg.RgIntLit;
import rgv.model.rg.RgNode;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;
import static rgv.model.rg.RgBuilder.num;

public class AttributeTest {

	@Test
	public void valuesAreMemoisedPerNode() {
		AtomicInteger evaluations = new AtomicInteger();
		Attribute<RgIntLit, Integer> doubled = new Attribute<>("doubled", n -> {
			evaluations.incrementAndGet();
			return n.getValue().intValue() * 2;
		});
		RgIntLit one = num(1);
		RgIntLit otherOne = num(1);

		assertEquals(Integer.valueOf(2), doubled.apply(one));
		assertEquals(Integer.valueOf(2), doubled.apply(one));
		assertEquals(1, evaluations.get());
		assertEquals(Integer.valueOf(2), doubled.apply(otherOne));
		assertEquals(2, evaluations.get());
	}

	private Attribute<RgNode, Integer> selfDependent;

	@Test
	public void selfDependencyIsACycle() {
		selfDependent = new Attribute<>("selfDependent", n -> selfDependent.apply(n) + 1);
		RgIntLit node = num(0);
		try {
			selfDependent.apply(node);
			fail("expected a cycle");
		} catch (CycleDetectedException e) {
			assertEquals("selfDependent", e.getAttributeName());
			assertSame(node, e.getNode());
		}
		// nothing was cached, so the next demand runs into the cycle again
		try {
			selfDependent.apply(node);
			fail("expected a cycle");
		} catch (CycleDetectedException e) {
			assertSame(node, e.getNode());
		}
	}
}
