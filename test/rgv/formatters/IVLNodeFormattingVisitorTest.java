package rgv.formatters;

import org.junit.Test;
import rgv.model.ivl.IVLBinaryOp;
import rgv.model.ivl.IVLExpression;
import rgv.model.ivl.IVLExplicitSet;
import rgv.model.ivl.IVLField;
import rgv.model.ivl.IVLFieldAssign;
import rgv.model.ivl.IVLLocalVar;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static rgv.model.ivl.IVLBuilder.*;

public class IVLNodeFormattingVisitorTest {

	private final IVLLocalVar r = local("r", refType());

	@Test
	public void fieldPermission() {
		assertEquals("acc(r.$diamond)", acc(field(r, new IVLField("$diamond", intType()))).toString());
	}

	@Test
	public void labelledOldOfFunction() {
		IVLExpression state = app("Cell_state", Collections.<IVLExpression>singletonList(r), intType());
		assertEquals("(Cell_state(r) != old[pre_region_update_0](Cell_state(r)))",
				ne(state, old(state, "pre_region_update_0")).toString());
	}

	@Test
	public void emptySetCarriesElementType() {
		assertEquals("Set[Int]()", new IVLExplicitSet(Collections.<IVLExpression>emptyList(), intType()).toString());
		assertEquals("Set(1, 2)", new IVLExplicitSet(Arrays.<IVLExpression>asList(num(1), num(2)), intType()).toString());
	}

	@Test
	public void statements() {
		IVLField stepTo = new IVLField("$stepTo_Int", intType());
		assertEquals("r.$stepTo_Int := 1", new IVLFieldAssign(field(r, stepTo), num(1)).toString());
		assertEquals("label pre_havoc_3", label("pre_havoc_3").toString());
		assertEquals("// BEGIN make_atomic", comment("BEGIN make_atomic").toString());
		assertEquals("exhale (true ==> acc(Cell_incr(r)))",
				exhale(binop(IVLBinaryOp.Operator.IMPLIES, trueLit(),
						acc("Cell_incr", Collections.<IVLExpression>singletonList(r)))).toString());
	}
}
