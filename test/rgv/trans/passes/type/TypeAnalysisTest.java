package rgv.trans.passes.type;

import org.junit.Test;
import rgv.RgExamples;
import rgv.model.rg.*;
import rgv.model.type.*;
import rgv.trans.passes.scope.ScopingPass;

import static org.junit.Assert.*;
import static rgv.model.rg.RgBuilder.*;

public class TypeAnalysisTest {

	private static TypeAnalysis analyse(RgProgram program) {
		return new TypeAnalysis(ScopingPass.perform(new RgTree(program)));
	}

	private static RgProgram requiring(RgExpression assertion) {
		return RgExamples.withMembers(new RgProcedureBuilder("p")
				.addArgument("x", new RefType("Box"))
				.addPrecondition(assertion)
				.build());
	}

	@Test
	public void regionStateIsTypedByItsInterpretation() {
		RgRegion cell = RgExamples.cell();
		TypeAnalysis types = analyse(program(RgExamples.box(), cell));
		assertEquals(new IntType(), types.stateType(cell));
		RgPointsTo interpretation = (RgPointsTo) cell.getInterpretation();
		assertEquals(new IntType(), types.typeOfLocation(interpretation.getHeapLocation()));
		assertEquals(new SetType(new IntType()), types.typ(cell.getActions().get(0).getTo()));
	}

	@Test
	public void comprehensionBinderTakesItsExpectedType() {
		RgSetComprehension comprehension = comprehension("c", binop(RgBinOp.Operator.LESS, idexp("c"), num(3)));
		TypeAnalysis types = analyse(requiring(contains(num(1), comprehension)));
		assertEquals(new IntType(), types.typeOfLogicalVariable(comprehension.getBinder()));
		assertEquals(new SetType(new IntType()), types.typ(comprehension));
	}

	@Test
	public void selfReferentialComprehensionIsUntyped() {
		RgSetComprehension comprehension = comprehension("c", eq(idexp("c"), idexp("c")));
		TypeAnalysis types = analyse(requiring(contains(num(1), comprehension)));
		assertEquals(new UnknownType(), types.typeOfLogicalVariable(comprehension.getBinder()));
	}

	@Test
	public void comprehensionBinderTypedThroughConditionalIsUntyped() {
		RgIdnExp thn = idexp("c");
		RgIdnExp els = idexp("c");
		RgSetComprehension comprehension = comprehension("c", eq(conditional(bool(true), thn, els), num(1)));
		TypeAnalysis types = analyse(requiring(contains(num(1), comprehension)));
		assertEquals(new UnknownType(), types.typeOfLogicalVariable(comprehension.getBinder()));
		assertEquals(new UnknownType(), types.expectedType(els));
		assertEquals(new UnknownType(), types.typ(thn));
	}

	@Test
	public void explicitCollections() {
		RgExplicitSet ints = set(num(1), num(2));
		RgExplicitSet empty = set();
		RgExplicitSet typedEmpty = typedSet(new BoolType());
		RgExplicitSeq seq = seq(num(1));
		RgSeqHead head = seqHead(seq);
		TypeAnalysis types = analyse(requiring(and(
				and(eq(ints, ints), eq(empty, empty)),
				and(eq(typedEmpty, typedEmpty), eq(head, num(1))))));

		assertEquals(new SetType(new IntType()), types.typ(ints));
		assertEquals(new UnknownType(), types.typ(empty));
		assertEquals(new SetType(new BoolType()), types.typ(typedEmpty));
		assertEquals(new SeqType(new IntType()), types.typ(seq));
		assertEquals(new IntType(), types.typ(head));
	}

	@Test
	public void heapWriteExpectsTheFieldType() {
		RgHeapWrite write = heapWrite("x", "val", bool(true));
		TypeAnalysis types = analyse(RgExamples.withMembers(new RgProcedureBuilder("p")
				.addArgument("x", new RefType("Box"))
				.build(write)));
		assertEquals(new IntType(), types.expectedType(write.getRhs()));
		assertEquals(new BoolType(), types.typ(write.getRhs()));
	}
}
