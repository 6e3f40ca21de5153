package rgv.trans.passes.atomicity;

import org.junit.Before;
import org.junit.Test;
import rgv.RgExamples;
import rgv.model.rg.*;
import rgv.model.type.IntType;
import rgv.model.type.RefType;
import rgv.trans.passes.scope.ScopingPass;

import static org.junit.Assert.*;
import static rgv.model.rg.RgBuilder.*;

public class AtomicityAnalysisTest {

	private RgHeapWrite write;
	private RgHeapRead read;
	private RgBlock twoWrites;
	private RgBlock writeAndGhost;
	private RgIf conditional;
	private RgBlock ghostOnly;
	private RgProcedureCall slowCall;
	private RgProcedureCall primitiveCall;
	private RgProcedureCall abstractCall;
	private AtomicityAnalysis atomicity;

	private static RgProcedure callee(String name, RgProcedure.Atomicity atomicity) {
		return new RgProcedureBuilder(name).setAtomicity(atomicity).build();
	}

	@Before
	public void setup() {
		write = heapWrite("x", "val", num(1));
		read = heapRead("y", "x", "val");
		twoWrites = block(heapWrite("x", "val", num(2)), heapWrite("x", "val", num(3)));
		writeAndGhost = block(assertS(bool(true)), heapWrite("x", "val", num(4)), inhale(bool(true)));
		conditional = ifS(bool(true), skip(), skip());
		ghostOnly = block(assume(bool(true)), exhale(bool(true)));
		slowCall = call("slow");
		primitiveCall = call("primitive");
		abstractCall = call("abstract");
		RgProcedure procedure = new RgProcedureBuilder("p")
				.addArgument("x", new RefType("Box"))
				.addLocal("y", new IntType())
				.setAtomicity(RgProcedure.Atomicity.PRIMITIVE_ATOMIC)
				.build(write, read, twoWrites, writeAndGhost, conditional, ghostOnly,
						slowCall, primitiveCall, abstractCall);
		atomicity = new AtomicityAnalysis(ScopingPass.perform(new RgTree(RgExamples.withMembers(procedure,
				callee("slow", RgProcedure.Atomicity.NOT_ATOMIC),
				callee("primitive", RgProcedure.Atomicity.PRIMITIVE_ATOMIC),
				callee("abstract", RgProcedure.Atomicity.ABSTRACT_ATOMIC)))));
	}

	@Test
	public void heapAccessIsAtomic() {
		assertEquals(AtomicityKind.ATOMIC, atomicity.atomicity(write));
		assertEquals(AtomicityKind.ATOMIC, atomicity.atomicity(read));
	}

	@Test
	public void sequencesOfRealStatementsAreNot() {
		assertEquals(AtomicityKind.NONATOMIC, atomicity.atomicity(twoWrites));
		assertEquals(AtomicityKind.NONATOMIC, atomicity.atomicity(conditional));
	}

	@Test
	public void ghostStatementsDoNotCount() {
		assertEquals(AtomicityKind.ATOMIC, atomicity.atomicity(writeAndGhost));
		assertTrue(atomicity.isGhost(ghostOnly));
		assertFalse(atomicity.isGhost(writeAndGhost));
		assertEquals(AtomicityKind.ATOMIC, atomicity.atomicity(ghostOnly));
	}

	@Test
	public void statementsAmongOthersNeedNotBeAtomic() {
		assertEquals(AtomicityKind.NONATOMIC, atomicity.expectedAtomicity(write));
	}

	@Test
	public void callsTakeTheCalleesAtomicity() {
		assertEquals(AtomicityKind.NONATOMIC, atomicity.atomicity(slowCall));
		assertEquals(AtomicityKind.ATOMIC, atomicity.atomicity(primitiveCall));
		assertEquals(AtomicityKind.ATOMIC, atomicity.atomicity(abstractCall));
		assertFalse(atomicity.isGhost(primitiveCall));
	}

	@Test
	public void ruleBodiesExceptMakeAtomicMustBeAtomic() {
		RgBlock updated = block(heapWrite("x", "val", num(1)));
		RgUpdateRegion update = updateRegion(RgExamples.cellInstance(), updated);
		RgBlock body = block(update);
		RgMakeAtomic makeAtomic = makeAtomic(guard("incr", "r"), RgExamples.cellInstance(), body);
		AtomicityAnalysis analysis = new AtomicityAnalysis(ScopingPass.perform(new RgTree(
				RgExamples.withMembers(RgExamples.cellProcedure("incr", makeAtomic)))));

		assertEquals(AtomicityKind.NONATOMIC, analysis.expectedAtomicity(body));
		assertEquals(AtomicityKind.ATOMIC, analysis.expectedAtomicity(updated));
	}
}
