package rgv.trans.passes.region;

import org.junit.Test;
import rgv.InternalCompilerError;
import rgv.RgExamples;
import rgv.model.rg.*;
import rgv.model.type.*;
import rgv.trans.passes.scope.ScopingPass;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.*;
import static rgv.model.rg.RgBuilder.*;

public class RegionModelTest {

	private static RegionModel model(RgProgram program) {
		return new RegionModel(new TypeAnalysis(ScopingPass.perform(new RgTree(program))));
	}

	private static RgProgram requiring(RgExpression assertion) {
		return RgExamples.withMembers(new RgProcedureBuilder("p")
				.addArgument("r", new RegionIdType())
				.addArgument("x", new RefType("Box"))
				.addPrecondition(assertion)
				.build());
	}

	@Test
	public void mangledNames() {
		assertEquals("Int", RegionModel.mangle(new IntType()));
		assertEquals("Ref", RegionModel.mangle(new RefType("Box")));
		assertEquals("Ref", RegionModel.mangle(new RegionIdType()));
		assertEquals("Set_Seq_Bool", RegionModel.mangle(new SetType(new SeqType(new BoolType()))));
		assertEquals("$stepFrom_Set_Int", RegionModel.stepFromFieldName(new SetType(new IntType())));
		assertEquals("tmp_Int", RegionModel.tmpVariableName(new IntType()));
	}

	@Test(expected = InternalCompilerError.class)
	public void voidHasNoEncoding() {
		RegionModel.mangle(new VoidType());
	}

	@Test
	public void instanceWithoutOutArgument() {
		RgPredicateExp instance = RgExamples.cellInstance();
		RegionInstance split = model(requiring(instance)).instance(instance);
		assertEquals("Cell", split.getRegion().getId().getName());
		assertEquals(instance.getArguments(), split.getInArgs());
		assertFalse(split.getOutArg().isPresent());
		assertEquals("r", split.getRegionId().get().getName());
	}

	@Test
	public void instanceWithOutArgument() {
		RgPredicateExp instance = pred("Cell", idexp("r"), idexp("x"), num(3));
		RegionInstance split = model(requiring(instance)).instance(instance);
		assertEquals(instance.getArguments().subList(0, 2), split.getInArgs());
		assertSame(instance.getArguments().get(2), split.getOutArg().get());
	}

	@Test(expected = InternalCompilerError.class)
	public void instanceWithTooManyArguments() {
		RgPredicateExp instance = pred("Cell", idexp("r"), idexp("x"), num(3), num(4));
		model(requiring(instance)).instance(instance);
	}

	@Test
	public void guardsLicenseTheirOwnActions() {
		RgRegion counter = region("Counter", "c",
				Collections.singletonList(arg("x", new RefType("Box"))),
				Arrays.asList(uniqueGuard("inc"), duplicableGuard("reset")),
				pointsTo("x", "val", binder("v")),
				idexp("v"),
				Arrays.asList(
						action("inc", "n", set(plus(idexp("n"), num(1)))),
						action("reset", "n", set(num(0))),
						action("inc", "n", set(plus(idexp("n"), num(2))))));
		RegionModel model = model(program(RgExamples.box(), counter));

		RgGuardDecl inc = counter.getGuards().get(0);
		RgGuardDecl reset = counter.getGuards().get(1);
		assertEquals(Arrays.asList(counter.getActions().get(0), counter.getActions().get(2)), model.actions(counter, inc));
		assertEquals(Collections.singletonList(counter.getActions().get(1)), model.actions(counter, reset));
		assertEquals("Counter_inc_closure", RegionModel.closureFunctionName(counter, inc));
	}

	@Test
	public void stateTypesAreSharedByEncoding() {
		RgRegion flag = region("Flag", "f",
				Collections.<RgFormalArgumentDecl>emptyList(),
				Collections.singletonList(uniqueGuard("set")),
				bool(true),
				bool(false),
				Collections.<RgAction>emptyList());
		RgRegion counter = region("Counter", "c",
				Collections.<RgFormalArgumentDecl>emptyList(),
				Collections.singletonList(uniqueGuard("inc")),
				bool(true),
				num(0),
				Collections.<RgAction>emptyList());
		RgProgram program = program(RgExamples.box(), RgExamples.cell(), flag, counter);

		Map<String, Type> stateTypes = model(program).distinctStateTypes(program);
		assertEquals(Arrays.asList("Int", "Bool"), Arrays.asList(stateTypes.keySet().toArray()));
		assertEquals(new BoolType(), stateTypes.get("Bool"));
	}
}
