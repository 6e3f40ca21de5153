package rgv.trans.passes.scope;

import org.junit.Test;
import rgv.RgExamples;
import rgv.model.rg.*;
import rgv.model.type.IntType;
import rgv.model.type.RefType;
import rgv.model.type.RegionIdType;
import rgv.scope.*;

import java.util.Collections;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.*;
import static rgv.model.rg.RgBuilder.*;

public class NameAnalysisTest {

	private static NameAnalysis analyse(RgProgram program) {
		return ScopingPass.perform(new RgTree(program));
	}

	@Test
	public void repeatedTopLevelNameIsAmbiguous() {
		RgStruct first = RgExamples.box();
		RgStruct second = RgExamples.box();
		NameAnalysis names = analyse(program(first, second));
		assertThat(names.entity(first.getId()), instanceOf(MultipleEntity.class));
		assertThat(names.entity(second.getId()), instanceOf(MultipleEntity.class));
	}

	@Test
	public void guardResolvesThroughTheRegionOfItsId() {
		RgRegion cell = RgExamples.cell();
		RgRegion queue = region("Queue", "q",
				Collections.singletonList(arg("y", new RefType("Box"))),
				Collections.singletonList(uniqueGuard("incr")),
				pointsTo("y", "val", binder("w")),
				idexp("w"),
				Collections.<RgAction>emptyList());
		RgUseAtomic useAtomic = useAtomic(guard("incr", "r"), RgExamples.cellInstance(),
				block(heapWrite("x", "val", num(1))));
		RgProcedure procedure = new RgProcedureBuilder("p")
				.addArgument("r", new RegionIdType())
				.addArgument("x", new RefType("Box"))
				.build(useAtomic);
		NameAnalysis names = analyse(program(RgExamples.box(), cell, queue, procedure));

		Entity guard = names.entity(useAtomic.getGuard().getGuard());
		assertThat(guard, instanceOf(GuardEntity.class));
		assertSame(cell, ((GuardEntity) guard).getRegion());
		assertSame(cell.getGuards().get(0), ((GuardEntity) guard).getDeclaration());
	}

	@Test
	public void actionGuardResolvesInItsOwnRegion() {
		RgRegion cell = RgExamples.cell();
		NameAnalysis names = analyse(program(RgExamples.box(), cell));
		Entity guard = names.entity(cell.getActions().get(0).getGuard());
		assertThat(guard, instanceOf(GuardEntity.class));
		assertSame(cell, ((GuardEntity) guard).getRegion());
	}

	@Test
	public void undeclaredVariableIsUnknown() {
		RgAssign assign = assign("z", num(1));
		NameAnalysis names = analyse(program(new RgProcedureBuilder("p").build(assign)));
		assertThat(names.entity(assign.getLhs()), instanceOf(UnknownEntity.class));
	}

	@Test
	public void retIsTheProceduresResultVariable() {
		RgAssign assign = assign(NameAnalysis.RETURN_VARIABLE, num(1));
		RgProcedure procedure = new RgProcedureBuilder("p").setReturnType(new IntType()).build(assign);
		NameAnalysis names = analyse(program(procedure));

		Entity ret = names.entity(assign.getLhs());
		assertThat(ret, instanceOf(LocalVariableEntity.class));
		assertSame(names.returnDeclaration(procedure), ((LocalVariableEntity) ret).getDeclaration());
		assertEquals(new IntType(), names.returnDeclaration(procedure).getType());
	}

	@Test
	public void regionIdIsMatchedWithFirstInstance() {
		RgProgram program = RgExamples.incrementingCell();
		NameAnalysis names = analyse(program);
		RgProcedure incr = program.getProcedures().get(0);
		RgIdnUse regionId = incr.getInters().get(0).getRegionId();

		RegionUse use = names.regionIdUsedWith(regionId).get();
		assertSame(program.getRegions().get(0), use.getRegion());
		// the instance in the precondition comes first
		RgBinOp pre = (RgBinOp) incr.getPres().get(0).getAssertion();
		assertSame(pre.getLeft(), use.getPredicate().get());
	}

	@Test
	public void logicalVariableBinders() {
		RgRegion cell = RgExamples.cell();
		NameAnalysis names = analyse(program(RgExamples.box(), cell));
		RgPointsTo interpretation = (RgPointsTo) cell.getInterpretation();
		RgLogicalVariableBinder v = (RgLogicalVariableBinder) interpretation.getValue();

		assertSame(interpretation, names.boundBy(v).get());
		assertEquals(LogicalVariableContext.REGION, names.usageContext(cell.getState()));
		Entity state = names.entity(((RgIdnExp) cell.getState()).getId());
		assertThat(state, instanceOf(LogicalVariableEntity.class));
	}
}
