package rgv.trans.passes.codegen.ivl;

import rgv.model.ivl.*;
import rgv.model.rg.RgGuardDecl;
import rgv.model.rg.RgRegion;
import rgv.model.type.Type;
import rgv.trans.passes.region.RegionModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static rgv.model.ivl.IVLBuilder.*;

/**
 * Builds the IVL terms that stand for region predicates, region states, guards and the ghost
 * fields of regions. Each call builds fresh nodes.
 */
public class RegionTerms {
	private final RegionModel regions;

	public RegionTerms(RegionModel regions) {
		this.regions = regions;
	}

	public IVLType stateType(RgRegion region) {
		return TypeTranslator.translate(regions.stateType(region));
	}

	public IVLPredicateAccessPredicate regionAccess(RgRegion region, List<IVLExpression> inArgs) {
		return acc(RegionModel.predicateName(region), new ArrayList<>(inArgs));
	}

	public IVLFuncApp state(RgRegion region, List<IVLExpression> inArgs) {
		return app(RegionModel.stateFunctionName(region), new ArrayList<>(inArgs), stateType(region));
	}

	public IVLFuncApp atomicityContext(RgRegion region, List<IVLExpression> inArgs) {
		return app(RegionModel.atomicityContextFunctionName(region), new ArrayList<>(inArgs),
				setType(stateType(region)));
	}

	public IVLFuncApp closure(RgRegion region, RgGuardDecl guard, List<IVLExpression> inArgs, IVLExpression from) {
		List<IVLExpression> args = new ArrayList<>(inArgs);
		args.add(from);
		return app(RegionModel.closureFunctionName(region, guard), args, setType(stateType(region)));
	}

	public IVLFuncApp step(RgRegion region, RgGuardDecl guard, List<IVLExpression> inArgs,
	                       IVLExpression from, IVLExpression to) {
		List<IVLExpression> args = new ArrayList<>(inArgs);
		args.add(from);
		args.add(to);
		return app(RegionModel.stepFunctionName(region, guard), args, boolType());
	}

	public IVLPredicateAccessPredicate guardAccess(RgRegion region, RgGuardDecl guard, IVLExpression regionId) {
		return acc(RegionModel.guardPredicateName(region, guard), Collections.singletonList(regionId));
	}

	public static IVLField diamondField() {
		return new IVLField(RegionModel.DIAMOND_FIELD, intType());
	}

	public static IVLField stepFromField(Type stateType) {
		return new IVLField(RegionModel.stepFromFieldName(stateType), TypeTranslator.translate(stateType));
	}

	public static IVLField stepToField(Type stateType) {
		return new IVLField(RegionModel.stepToFieldName(stateType), TypeTranslator.translate(stateType));
	}

	public IVLFieldAccess diamond(IVLExpression regionId) {
		return field(regionId, diamondField());
	}

	public IVLFieldAccess stepFrom(RgRegion region, IVLExpression regionId) {
		return field(regionId, stepFromField(regions.stateType(region)));
	}

	public IVLFieldAccess stepTo(RgRegion region, IVLExpression regionId) {
		return field(regionId, stepToField(regions.stateType(region)));
	}
}
