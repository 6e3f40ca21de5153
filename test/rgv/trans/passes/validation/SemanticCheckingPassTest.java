package rgv.trans.passes.validation;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import rgv.RgExamples;
import rgv.errors.Issue;
import rgv.errors.TopLevelIssueContext;
import rgv.model.rg.*;
import rgv.model.type.IntType;
import rgv.model.type.RefType;
import rgv.model.type.RegionIdType;
import rgv.trans.passes.atomicity.AtomicityAnalysis;
import rgv.trans.passes.scope.NameAnalysis;
import rgv.trans.passes.scope.ScopingPass;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static rgv.model.rg.RgBuilder.*;

@RunWith(Parameterized.class)
public class SemanticCheckingPassTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		RgRegion flag = region("Flag", "f",
				Collections.<RgFormalArgumentDecl>emptyList(),
				Collections.singletonList(uniqueGuard("set")),
				bool(true),
				num(0),
				Collections.<RgAction>emptyList());
		RgProcedure inc = new RgProcedureBuilder("inc")
				.addArgument("a", new IntType())
				.setReturnType(new IntType())
				.build();
		RgProcedure slow = new RgProcedureBuilder("slow").build();
		RgProcedure primitive = new RgProcedureBuilder("primitive")
				.setAtomicity(RgProcedure.Atomicity.PRIMITIVE_ATOMIC)
				.build();

		return Arrays.asList(new Object[][] {
				{
						"incrementing a cell",
						RgExamples.incrementingCell(),
						Collections.emptyList(),
				},
				{
						"predicate declared twice",
						program(
								predicate("P", Collections.<RgFormalArgumentDecl>emptyList(), bool(true)),
								predicate("P", Collections.<RgFormalArgumentDecl>emptyList(), bool(true))),
						Arrays.asList(MultipleDeclarationIssue.class, MultipleDeclarationIssue.class),
				},
				{
						"assignment to an undeclared variable",
						program(new RgProcedureBuilder("p").build(assign("z", num(1)))),
						Arrays.asList(InvalidAssignmentTargetIssue.class, DanglingReferenceIssue.class),
				},
				{
						"region instances with too few and too many arguments",
						program(flag, new RgProcedureBuilder("p")
								.addArgument("f", new RegionIdType())
								.addPrecondition(and(pred("Flag"), pred("Flag", idexp("f"), num(0), num(1))))
								.build()),
						Arrays.asList(ArgumentCountMismatchIssue.class, ArgumentCountMismatchIssue.class),
				},
				{
						"use_atomic around two heap writes",
						RgExamples.cellWith(useAtomic(guard("incr", "r"), RgExamples.cellInstance(), block(
								heapWrite("x", "val", num(1)),
								heapWrite("x", "val", num(2))))),
						Collections.singletonList(AtomicityMismatchIssue.class),
				},
				{
						"open_region on a region id that is not a variable",
						RgExamples.cellWith(openRegion(pred("Cell", nullLit(), idexp("x")),
								block(heapWrite("x", "val", num(1))))),
						Collections.singletonList(UnsupportedFeatureIssue.class),
				},
				{
						"interference on an id no region is used with",
						RgExamples.withMembers(new RgProcedureBuilder("p")
								.addArgument("q", new RegionIdType())
								.addInterference("c", set(num(0)), "q")
								.build()),
						Collections.singletonList(UnresolvedRegionIssue.class),
				},
				{
						"boolean assigned to an integer",
						program(new RgProcedureBuilder("p")
								.addLocal("y", new IntType())
								.build(assign("y", bool(true)))),
						Collections.singletonList(TypeMismatchIssue.class),
				},
				{
						"empty sets without element type",
						program(new RgProcedureBuilder("p")
								.addPrecondition(eq(set(), set()))
								.build()),
						Arrays.asList(UntypableExpressionIssue.class, UntypableExpressionIssue.class),
				},
				{
						"set comprehension compared for equality",
						program(new RgProcedureBuilder("p")
								.addPrecondition(eq(
										comprehension("c", binop(RgBinOp.Operator.LESS, idexp("c"), num(3))),
										typedSet(new IntType())))
								.build()),
						Collections.singletonList(UnsupportedFeatureIssue.class),
				},
				{
						"field of a struct that does not have it",
						RgExamples.withMembers(new RgProcedureBuilder("p")
								.addArgument("x", new RefType("Box"))
								.addLocal("y", new IntType())
								.build(heapRead("y", "x", "missing"))),
						Collections.singletonList(NoMatchingFieldIssue.class),
				},
				{
						"field read through an integer",
						program(new RgProcedureBuilder("p")
								.addArgument("x", new IntType())
								.addLocal("y", new IntType())
								.build(heapRead("y", "x", "val"))),
						Collections.singletonList(InvalidReceiverIssue.class),
				},
				{
						"field written through a reference to a region",
						RgExamples.withMembers(new RgProcedureBuilder("p")
								.addArgument("x", new RefType("Cell"))
								.build(heapWrite("x", "val", num(1)))),
						Collections.singletonList(InvalidReceiverIssue.class),
				},
				{
						"call storing its result",
						program(inc, new RgProcedureBuilder("p")
								.addLocal("y", new IntType())
								.build(callInto("y", "inc", num(1)))),
						Collections.emptyList(),
				},
				{
						"call with too many arguments",
						program(inc, new RgProcedureBuilder("p").build(call("inc", num(1), num(2)))),
						Collections.singletonList(ArgumentCountMismatchIssue.class),
				},
				{
						"call with an argument of the wrong type",
						program(inc, new RgProcedureBuilder("p").build(call("inc", bool(true)))),
						Collections.singletonList(TypeMismatchIssue.class),
				},
				{
						"calling a predicate",
						program(
								predicate("P", Collections.<RgFormalArgumentDecl>emptyList(), bool(true)),
								new RgProcedureBuilder("p").build(call("P"))),
						Collections.singletonList(InvalidReferenceIssue.class),
				},
				{
						"procedure used as a value",
						program(inc, new RgProcedureBuilder("p")
								.addLocal("y", new IntType())
								.build(assign("y", idexp("inc")))),
						Collections.singletonList(InvalidReferenceIssue.class),
				},
				{
						"use_atomic around a non-atomic call",
						program(RgExamples.box(), RgExamples.cell(), slow, RgExamples.cellProcedure("p",
								useAtomic(guard("incr", "r"), RgExamples.cellInstance(), block(call("slow"))))),
						Collections.singletonList(AtomicityMismatchIssue.class),
				},
				{
						"use_atomic around a primitive atomic call",
						program(RgExamples.box(), RgExamples.cell(), primitive, RgExamples.cellProcedure("p",
								useAtomic(guard("incr", "r"), RgExamples.cellInstance(), block(call("primitive"))))),
						Collections.emptyList(),
				},
		});
	}

	private final RgProgram program;
	private final List<Class<? extends Issue>> expectedIssues;

	public SemanticCheckingPassTest(String description, RgProgram program, List<Class<? extends Issue>> expectedIssues) {
		this.program = program;
		this.expectedIssues = expectedIssues;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		NameAnalysis names = ScopingPass.perform(new RgTree(program));
		SemanticCheckingPass.perform(ctx, names, new TypeAnalysis(names), new AtomicityAnalysis(names));

		List<Class<? extends Issue>> actual = new ArrayList<>();
		for (Issue issue : ctx.getIssues()) {
			actual.add(issue.getClass());
		}
		assertEquals(ctx.format(), expectedIssues, actual);
	}
}
