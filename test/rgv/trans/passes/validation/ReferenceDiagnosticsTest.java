package rgv.trans.passes.validation;

import org.junit.Test;
import rgv.RgExamples;
import rgv.errors.Issue;
import rgv.errors.TopLevelIssueContext;
import rgv.model.rg.*;
import rgv.model.type.IntType;
import rgv.model.type.RefType;
import rgv.trans.passes.atomicity.AtomicityAnalysis;
import rgv.trans.passes.scope.NameAnalysis;
import rgv.trans.passes.scope.ScopingPass;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.Collections;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.*;
import static rgv.model.rg.RgBuilder.*;

public class ReferenceDiagnosticsTest {

	private static Issue onlyIssue(RgProgram program) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		NameAnalysis names = ScopingPass.perform(new RgTree(program));
		SemanticCheckingPass.perform(ctx, names, new TypeAnalysis(names), new AtomicityAnalysis(names));
		assertEquals(ctx.format(), 1, ctx.getIssues().size());
		return ctx.getIssues().get(0);
	}

	@Test
	public void callingAPredicate() {
		RgProcedureCall call = call("P");
		Issue issue = onlyIssue(program(
				predicate("P", Collections.<RgFormalArgumentDecl>emptyList(), bool(true)),
				new RgProcedureBuilder("p").build(call)));

		assertThat(issue, instanceOf(InvalidReferenceIssue.class));
		assertEquals(InvalidReferenceIssue.Reason.NOT_CALLABLE, ((InvalidReferenceIssue) issue).getReason());
		assertSame(call.getProcedure(), ((InvalidReferenceIssue) issue).getUse());
	}

	@Test
	public void procedureAsValue() {
		RgIdnExp value = idexp("q");
		Issue issue = onlyIssue(program(
				new RgProcedureBuilder("q").setReturnType(new IntType()).build(),
				new RgProcedureBuilder("p").addLocal("y", new IntType()).build(assign("y", value))));

		assertThat(issue, instanceOf(InvalidReferenceIssue.class));
		assertEquals(InvalidReferenceIssue.Reason.PROCEDURE_AS_VALUE, ((InvalidReferenceIssue) issue).getReason());
		assertSame(value.getId(), ((InvalidReferenceIssue) issue).getUse());
	}

	@Test
	public void receiverThatIsNotAReference() {
		RgHeapRead read = heapRead("y", "x", "val");
		Issue issue = onlyIssue(program(new RgProcedureBuilder("p")
				.addArgument("x", new IntType())
				.addLocal("y", new IntType())
				.build(read)));

		assertThat(issue, instanceOf(InvalidReceiverIssue.class));
		InvalidReceiverIssue receiverIssue = (InvalidReceiverIssue) issue;
		assertEquals(InvalidReceiverIssue.Reason.NOT_A_REFERENCE, receiverIssue.getReason());
		assertSame(read.getHeapLocation().getReceiver(), receiverIssue.getReceiver());
		assertEquals(new IntType(), receiverIssue.getReceiverType());
	}

	@Test
	public void referenceToARegion() {
		Issue issue = onlyIssue(RgExamples.withMembers(new RgProcedureBuilder("p")
				.addArgument("x", new RefType("Cell"))
				.build(heapWrite("x", "val", num(1)))));

		assertThat(issue, instanceOf(InvalidReceiverIssue.class));
		assertEquals(InvalidReceiverIssue.Reason.NOT_A_STRUCT, ((InvalidReceiverIssue) issue).getReason());
		assertEquals(new RefType("Cell"), ((InvalidReceiverIssue) issue).getReceiverType());
	}
}
