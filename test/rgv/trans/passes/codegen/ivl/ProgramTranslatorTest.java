package rgv.trans.passes.codegen.ivl;

import org.junit.Test;
import rgv.RGVOptions;
import rgv.RgExamples;
import rgv.model.ivl.*;
import rgv.model.rg.RgBinOp;
import rgv.model.rg.RgBuilder;
import rgv.model.rg.RgProcedure;
import rgv.model.rg.RgProcedureBuilder;
import rgv.model.rg.RgProgram;
import rgv.model.rg.RgTree;
import rgv.model.type.IntType;
import rgv.model.type.RefType;
import rgv.model.type.RegionIdType;
import rgv.trans.passes.backtranslation.ErrorBacktranslator;
import rgv.trans.passes.scope.ScopingPass;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;
import static rgv.model.ivl.IVLBuilder.*;

public class ProgramTranslatorTest {

	private static IVLProgram translate(RgProgram program) {
		RGVOptions options = new RGVOptions();
		TypeAnalysis types = new TypeAnalysis(ScopingPass.perform(new RgTree(program)));
		return ProgramTranslator.perform(new TranslationContext(options, types, new ErrorBacktranslator(options)));
	}

	private static IVLFunction function(IVLProgram program, String name) {
		for (IVLFunction function : program.getFunctions()) {
			if (function.getName().equals(name)) {
				return function;
			}
		}
		throw new java.lang.AssertionError("no function " + name);
	}

	private static List<String> names(List<? extends IVLMember> members) {
		List<String> result = new ArrayList<>();
		for (IVLMember member : members) {
			if (member instanceof IVLFunction) {
				result.add(((IVLFunction) member).getName());
			} else if (member instanceof IVLPredicate) {
				result.add(((IVLPredicate) member).getName());
			}
		}
		return result;
	}

	private final IVLLocalVar r = local("r", refType());
	private final IVLLocalVar x = local("x", refType());
	private final IVLField boxVal = new IVLField("$Box_val", intType());

	@Test
	public void ghostFields() {
		IVLProgram program = translate(RgExamples.incrementingCell());
		assertEquals(Arrays.asList(
				boxVal,
				new IVLField("$diamond", intType()),
				new IVLField("$stepFrom_Int", intType()),
				new IVLField("$stepTo_Int", intType())), program.getFields());
	}

	@Test
	public void regionMembers() {
		IVLProgram program = translate(RgExamples.incrementingCell());
		assertEquals(Arrays.asList("Cell", "Cell_incr"), names(program.getPredicates()));
		assertEquals(Arrays.asList("IntSet", "NatSet", "Cell_state", "Cell_atomicity_context_df",
				"Cell_incr_step", "Cell_incr_closure"), names(program.getFunctions()));

		IVLPredicate cell = program.getPredicates().get(0);
		assertEquals(Arrays.asList(decl("r", refType()), decl("x", refType())), cell.getFormalArgs());
		assertEquals(acc(field(x, boxVal)), cell.getBody().get());
		assertFalse(program.getPredicates().get(1).getBody().isPresent());

		IVLFunction state = function(program, "Cell_state");
		assertEquals(new IVLUnfolding(acc("Cell", Arrays.<IVLExpression>asList(r, x)), field(x, boxVal)),
				state.getBody().get());
		assertEquals(Collections.singletonList(acc("Cell", Arrays.<IVLExpression>asList(r, x))), state.getPres());
	}

	@Test
	public void stepRelationSubstitutesTheActionBinder() {
		IVLFunction step = function(translate(RgExamples.incrementingCell()), "Cell_incr_step");
		IVLLocalVar from = local("$from", intType());
		IVLLocalVar to = local("$to", intType());

		assertEquals(boolType(), step.getType());
		assertEquals(Arrays.asList(decl("r", refType()), decl("x", refType()), decl("$from", intType()),
				decl("$to", intType())), step.getFormalArgs());
		assertEquals(contains(to, new IVLExplicitSet(
				Collections.<IVLExpression>singletonList(binop(IVLBinaryOp.Operator.ADD, from, num(1))), intType())),
				step.getBody().get());
	}

	@Test
	public void closureIsAxiomatised() {
		IVLFunction closure = function(translate(RgExamples.incrementingCell()), "Cell_incr_closure");
		assertFalse(closure.getBody().isPresent());
		assertEquals(setType(intType()), closure.getType());
		assertEquals(2, closure.getPosts().size());
		assertEquals(contains(local("$from", intType()), new IVLResult(setType(intType()))), closure.getPosts().get(0));
	}

	@Test
	public void interferenceInPostconditionRefersToPreState() {
		RgProcedure procedure = new RgProcedureBuilder("p")
				.addArgument("r", new RegionIdType())
				.addArgument("x", new RefType("Box"))
				.setAtomicity(RgProcedure.Atomicity.ABSTRACT_ATOMIC)
				.addInterference("c", RgBuilder.set(RgBuilder.num(0)), "r")
				.addPrecondition(RgExamples.cellInstance())
				.addPostcondition(RgBuilder.binop(RgBinOp.Operator.AT_LEAST, RgBuilder.idexp("c"), RgBuilder.num(0)))
				.build();
		IVLProgram program = translate(RgExamples.withMembers(procedure));

		IVLExpression state = app("Cell_state", Arrays.<IVLExpression>asList(r, x), intType());
		assertEquals(Collections.singletonList(binop(IVLBinaryOp.Operator.GE, old(state), num(0))),
				program.getMethods().get(0).getPosts());
	}

	@Test
	public void callStoresTheResultInItsTarget() {
		RgProcedure callee = new RgProcedureBuilder("q")
				.addArgument("a", new IntType())
				.setReturnType(new IntType())
				.build();
		RgProcedure caller = new RgProcedureBuilder("p")
				.addLocal("y", new IntType())
				.build(RgBuilder.callInto("y", "q", RgBuilder.num(1)));
		IVLProgram program = translate(RgBuilder.program(callee, caller));

		IVLMethod q = program.getMethods().get(0);
		assertEquals("q", q.getName());
		assertEquals(Collections.singletonList(decl("ret", intType())), q.getFormalReturns());

		IVLMethod p = program.getMethods().get(1);
		assertEquals(Collections.singletonList(decl("y", intType())), p.getLocals());
		assertEquals(Collections.singletonList(new IVLMethodCall("q",
						Collections.<IVLExpression>singletonList(num(1)),
						Collections.singletonList(local("y", intType())))),
				p.getBody().get().getStatements());
	}
}
