package rgv.trans.passes.codegen.ivl;

import org.junit.Before;
import org.junit.Test;
import rgv.InternalCompilerError;
import rgv.RGVOptions;
import rgv.RgExamples;
import rgv.model.ivl.*;
import rgv.model.rg.RgBuilder;
import rgv.model.rg.RgProcedure;
import rgv.model.rg.RgProcedureBuilder;
import rgv.model.rg.RgProgram;
import rgv.model.rg.RgTree;
import rgv.model.type.IntType;
import rgv.model.type.RefType;
import rgv.model.type.RegionIdType;
import rgv.trans.RGVTranslator;
import rgv.trans.TranslationResult;
import rgv.trans.passes.backtranslation.ErrorBacktranslator;
import rgv.trans.passes.scope.ScopingPass;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;
import static rgv.model.ivl.IVLBuilder.*;
import static rgv.model.rg.RgBuilder.block;
import static rgv.model.rg.RgBuilder.guard;
import static rgv.model.rg.RgBuilder.heapRead;
import static rgv.model.rg.RgBuilder.heapWrite;
import static rgv.model.rg.RgBuilder.idexp;
import static rgv.model.rg.RgBuilder.makeAtomic;
import static rgv.model.rg.RgBuilder.openRegion;
import static rgv.model.rg.RgBuilder.pred;
import static rgv.model.rg.RgBuilder.set;
import static rgv.model.rg.RgBuilder.updateRegion;
import static rgv.model.rg.RgBuilder.useAtomic;

public class RuleTranslatorTest {

	private RGVOptions options;

	private final IVLLocalVar r = local("r", refType());
	private final IVLLocalVar x = local("x", refType());
	private final List<IVLExpression> in = Arrays.<IVLExpression>asList(r, x);
	private final IVLField diamond = new IVLField("$diamond", intType());
	private final IVLField stepFrom = new IVLField("$stepFrom_Int", intType());
	private final IVLField stepTo = new IVLField("$stepTo_Int", intType());

	@Before
	public void setup() {
		options = new RGVOptions();
		options.sectionComments = false;
	}

	private IVLProgram translate(RgProgram program) {
		TranslationResult result = new RGVTranslator(options, p -> Collections.emptyList()).run(program);
		assertFalse(result.getIssues().format(), result.getIssues().hasErrors());
		return result.getProgram().get();
	}

	private static IVLMethod method(IVLProgram program, String name) {
		for (IVLMethod method : program.getMethods()) {
			if (method.getName().equals(name)) {
				return method;
			}
		}
		throw new java.lang.AssertionError("no method " + name);
	}

	private static List<IVLStatement> body(IVLProgram program, String name) {
		return method(program, name).getBody().get().getStatements();
	}

	private IVLFuncApp state() {
		return app("Cell_state", in, intType());
	}

	private IVLPredicateAccessPredicate cell() {
		return acc("Cell", in);
	}

	private List<IVLStatement> stabiliseAllCells(String label) {
		List<IVLLocalVarDecl> vars = Arrays.asList(decl("$r", refType()), decl("$x", refType()));
		List<IVLExpression> args = Arrays.<IVLExpression>asList(local(vars.get(0)), local(vars.get(1)));
		IVLExpression held = binop(IVLBinaryOp.Operator.GT,
				old(perm(predicate("Cell", args)), label), new IVLNoPerm());
		return Arrays.asList(
				label(label),
				exhale(forall(vars, implies(held, acc("Cell", args)))),
				inhale(forall(vars, implies(held, acc("Cell", args)))));
	}

	@Test
	public void makeAtomicAroundUpdateRegion() {
		List<IVLStatement> expected = new ArrayList<>();
		expected.add(inhale(acc(field(r, diamond))));
		expected.add(exhale(acc("Cell_incr", Collections.<IVLExpression>singletonList(r))));
		expected.add(label("pre_havoc_0"));
		expected.add(exhale(cell()));
		expected.add(inhale(cell()));

		expected.add(exhale(acc(field(r, diamond))));
		expected.add(label("pre_region_update_0"));
		expected.add(unfold(cell()));
		expected.addAll(stabiliseAllCells("pre_havoc_1"));
		expected.add(new IVLFieldAssign(field(x, new IVLField("$Box_val", intType())), num(1)));
		expected.add(fold(cell()));
		expected.add(new IVLIf(
				ne(state(), old(state(), "pre_region_update_0")),
				seqn(
						inhale(and(acc(field(r, stepFrom)), acc(field(r, stepTo)))),
						new IVLFieldAssign(field(r, stepFrom), old(state(), "pre_region_update_0")),
						new IVLFieldAssign(field(r, stepTo), state())),
				seqn(inhale(acc(field(r, diamond))))));

		expected.add(assertS(contains(field(r, stepFrom),
				app("Cell_atomicity_context_df", in, setType(intType())))));
		expected.add(assertS(contains(field(r, stepTo),
				app("Cell_incr_closure", Arrays.asList(r, x, field(r, stepFrom)), setType(intType())))));
		expected.add(label("pre_havoc_2"));
		expected.add(exhale(cell()));
		expected.add(inhale(cell()));
		expected.add(inhale(eq(state(), field(r, stepTo))));
		expected.add(inhale(eq(old(state()), field(r, stepFrom))));
		expected.add(inhale(acc("Cell_incr", Collections.<IVLExpression>singletonList(r))));
		expected.add(exhale(and(acc(field(r, stepFrom)), acc(field(r, stepTo)))));

		assertEquals(expected, body(translate(RgExamples.incrementingCell()), "incr"));
	}

	@Test
	public void interferenceBecomesPreconditions() {
		IVLMethod incr = method(translate(RgExamples.incrementingCell()), "incr");
		IVLFuncApp context = app("Cell_atomicity_context_df", in, setType(intType()));
		assertEquals(Arrays.asList(
				contains(state(), context),
				eq(context, new IVLExplicitSet(Collections.<IVLExpression>singletonList(num(0)), intType())),
				and(cell(), acc("Cell_incr", Collections.<IVLExpression>singletonList(r)))),
				incr.getPres());
		assertEquals(Collections.singletonList(decl("tmp_Int", intType())), incr.getLocals());
	}

	@Test
	public void sectionCommentsWrapRules() {
		options.sectionComments = true;
		List<IVLStatement> statements = body(translate(RgExamples.incrementingCell()), "incr");
		assertEquals(comment("BEGIN make_atomic"), statements.get(0));
		assertEquals(comment("END make_atomic"), statements.get(statements.size() - 1));
		assertTrue(statements.contains(comment("BEGIN update_region")));
		assertTrue(statements.contains(comment("BEGIN check update permitted")));
	}

	@Test
	public void useAtomicChecksStepAgainstClosure() {
		RgProgram program = RgExamples.cellWith(
				useAtomic(guard("incr", "r"), RgExamples.cellInstance(), block(heapWrite("x", "val", RgBuilder.num(1)))));
		List<IVLStatement> statements = body(translate(program), "p");

		assertEquals(label("pre_use_atomic_0"), statements.get(0));
		assertEquals(unfold(cell()), statements.get(1));
		assertEquals(exhale(acc("Cell_incr", Collections.<IVLExpression>singletonList(r))), statements.get(2));
		assertEquals(stabiliseAllCells("pre_havoc_0"), statements.subList(3, 6));
		assertEquals(inhale(acc("Cell_incr", Collections.<IVLExpression>singletonList(r))), statements.get(6));
		assertThat(statements.get(7), is(instanceOf(IVLFieldAssign.class)));
		assertEquals(fold(cell()), statements.get(8));
		assertEquals(assertS(contains(state(),
				app("Cell_incr_closure", Arrays.asList(r, x, old(state(), "pre_use_atomic_0")), setType(intType())))),
				statements.get(9));
		assertEquals(10, statements.size());
	}

	@Test
	public void openRegionChecksStateUnchanged() {
		RgProgram program = RgExamples.withMembers(
				new RgProcedureBuilder("peek")
						.addArgument("r", new RegionIdType())
						.addArgument("x", new RefType("Box"))
						.addLocal("y", new IntType())
						.addPrecondition(RgExamples.cellInstance())
						.build(openRegion(RgExamples.cellInstance(), block(heapRead("y", "x", "val")))));
		List<IVLStatement> statements = body(translate(program), "peek");

		assertEquals(Arrays.asList(
				label("pre_open_region_0"),
				unfold(cell()),
				new IVLLocalAssign(local("y", intType()), field(x, new IVLField("$Box_val", intType()))),
				fold(cell()),
				assertS(eq(state(), old(state(), "pre_open_region_0")))), statements);
	}

	@Test
	public void nestedRulesLeaveNoRegionOpen() {
		RgProgram program = RgExamples.withMembers(
				new RgProcedureBuilder("nested")
						.addArgument("r", new RegionIdType())
						.addArgument("x", new RefType("Box"))
						.addLocal("y", new IntType())
						.setAtomicity(RgProcedure.Atomicity.ABSTRACT_ATOMIC)
						.addInterference("c", set(RgBuilder.num(0)), "r")
						.addPrecondition(RgExamples.cellInstance())
						.build(makeAtomic(guard("incr", "r"), RgExamples.cellInstance(), block(
								useAtomic(guard("incr", "r"), RgExamples.cellInstance(), block(
										openRegion(RgExamples.cellInstance(), block(heapRead("y", "x", "val")))))))));
		TypeAnalysis types = new TypeAnalysis(ScopingPass.perform(new RgTree(program)));
		TranslationContext ctx = new TranslationContext(options, types, new ErrorBacktranslator(options));

		ProgramTranslator.perform(ctx);
		assertEquals(0, ctx.openRegionDepth());
		assertEquals("pre_use_atomic_1", ctx.freshLabel("pre_use_atomic"));
		assertEquals("pre_open_region_1", ctx.freshLabel("pre_open_region"));
	}

	@Test(expected = InternalCompilerError.class)
	public void outArgumentOnRuleIsRejected() {
		RgProgram program = RgExamples.cellWith(
				openRegion(pred("Cell", idexp("r"), idexp("x"), RgBuilder.num(0)), block(heapWrite("x", "val", RgBuilder.num(1)))));
		new RGVTranslator(options, p -> Collections.emptyList()).run(program);
	}
}
