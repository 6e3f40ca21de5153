package rgv.trans.passes.region;

import rgv.InternalCompilerError;
import rgv.model.rg.*;
import rgv.model.type.*;
import rgv.scope.Entity;
import rgv.scope.GuardEntity;
import rgv.scope.RegionEntity;
import rgv.trans.passes.scope.NameAnalysis;
import rgv.trans.passes.scope.RegionUse;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derived queries over region declarations, and the names under which regions and their
 * guards are encoded.
 *
 * A region R with guard G is encoded as
 * <ul>
 *     <li>a predicate {@code R(id, args)} holding the interpretation,</li>
 *     <li>a predicate {@code R_G(id)} per guard,</li>
 *     <li>a function {@code R_state(id, args)} returning the abstract state,</li>
 *     <li>an abstract function {@code R_atomicity_context_df(id, args)} for the states an
 *     interference clause allows,</li>
 *     <li>a function {@code R_G_step(id, args, from, to)} for one action step and an abstract
 *     function {@code R_G_closure(id, args, from)} for the states reachable by G's actions.</li>
 * </ul>
 */
public class RegionModel {
	public static final String DIAMOND_FIELD = "$diamond";

	private final NameAnalysis names;
	private final TypeAnalysis types;

	public RegionModel(TypeAnalysis types) {
		this.names = types.getNames();
		this.types = types;
	}

	public Type stateType(RgRegion region) {
		return types.stateType(region);
	}

	/**
	 * @return the region a guard expression refers to
	 */
	public GuardEntity guardOf(RgGuardExp guardExp) {
		Entity e = names.entity(guardExp.getGuard());
		if (!(e instanceof GuardEntity)) {
			throw new InternalCompilerError("guard " + guardExp + " does not resolve to a guard but to " + e);
		}
		return (GuardEntity) e;
	}

	/**
	 * @return the actions the guard licenses, in declaration order
	 */
	public List<RgAction> actions(RgRegion region, RgGuardDecl guard) {
		List<RgAction> result = new ArrayList<>();
		for (RgAction action : region.getActions()) {
			Entity e = names.entity(action.getGuard());
			if (e instanceof GuardEntity && ((GuardEntity) e).getDeclaration() == guard) {
				result.add(action);
			}
		}
		return result;
	}

	/**
	 * Splits a region predicate use into region, in-arguments and out-argument.
	 */
	public RegionInstance instance(RgPredicateExp predicate) {
		Entity e = names.entity(predicate.getPredicate());
		if (!(e instanceof RegionEntity)) {
			throw new InternalCompilerError(predicate + " is not a region instance");
		}
		RgRegion region = ((RegionEntity) e).getDeclaration();
		List<RgExpression> args = predicate.getArguments();
		int inCount = 1 + region.getFormalArgs().size();
		if (args.size() == inCount) {
			return new RegionInstance(predicate, region, args, null);
		} else if (args.size() == inCount + 1) {
			return new RegionInstance(predicate, region, args.subList(0, inCount), args.get(inCount));
		}
		throw new InternalCompilerError("region instance " + predicate + " has " + args.size() +
				" arguments, expected " + inCount + " or " + (inCount + 1));
	}

	/**
	 * The region instance a region id is used with in its enclosing declaration.
	 */
	public RegionInstance instanceOf(RgIdnUse regionId) {
		Optional<RgPredicateExp> predicate = names.regionIdUsedWith(regionId).flatMap(RegionUse::getPredicate);
		if (!predicate.isPresent()) {
			throw new InternalCompilerError("no region instance is known for region id " + regionId);
		}
		return instance(predicate.get());
	}

	public RgRegion regionOf(RgIdnUse regionId) {
		return names.regionIdUsedWith(regionId)
				.map(RegionUse::getRegion)
				.orElseThrow(() -> new InternalCompilerError("no region is known for region id " + regionId));
	}

	/**
	 * @return the state types of all regions, without duplicates in encoded form, keyed by
	 * their mangled name
	 */
	public Map<String, Type> distinctStateTypes(RgProgram program) {
		Map<String, Type> result = new LinkedHashMap<>();
		for (RgRegion region : program.getRegions()) {
			Type t = stateType(region);
			result.putIfAbsent(mangle(t), t);
		}
		return result;
	}

	public static String predicateName(RgRegion region) {
		return region.getId().getName();
	}

	public static String guardPredicateName(RgRegion region, RgGuardDecl guard) {
		return region.getId().getName() + "_" + guard.getId().getName();
	}

	public static String stateFunctionName(RgRegion region) {
		return region.getId().getName() + "_state";
	}

	public static String atomicityContextFunctionName(RgRegion region) {
		return region.getId().getName() + "_atomicity_context_df";
	}

	public static String stepFunctionName(RgRegion region, RgGuardDecl guard) {
		return guardPredicateName(region, guard) + "_step";
	}

	public static String closureFunctionName(RgRegion region, RgGuardDecl guard) {
		return guardPredicateName(region, guard) + "_closure";
	}

	public static String fieldName(RgStruct struct, RgFieldDecl field) {
		return "$" + struct.getId().getName() + "_" + field.getId().getName();
	}

	public static String stepFromFieldName(Type stateType) {
		return "$stepFrom_" + mangle(stateType);
	}

	public static String stepToFieldName(Type stateType) {
		return "$stepTo_" + mangle(stateType);
	}

	public static String tmpVariableName(Type stateType) {
		return "tmp_" + mangle(stateType);
	}

	/**
	 * Encodes a type as an identifier fragment. Types with the same encoding share one.
	 */
	public static String mangle(Type type) {
		return type.accept(new TypeVisitor<String, RuntimeException>() {
			@Override
			public String visit(IntType intType) {
				return "Int";
			}

			@Override
			public String visit(BoolType boolType) {
				return "Bool";
			}

			@Override
			public String visit(VoidType voidType) {
				throw new InternalCompilerError("void has no encoding");
			}

			@Override
			public String visit(NullType nullType) {
				return "Ref";
			}

			@Override
			public String visit(RefType refType) {
				return "Ref";
			}

			@Override
			public String visit(RegionIdType regionIdType) {
				return "Ref";
			}

			@Override
			public String visit(SetType setType) {
				return "Set_" + setType.getElementType().accept(this);
			}

			@Override
			public String visit(SeqType seqType) {
				return "Seq_" + seqType.getElementType().accept(this);
			}

			@Override
			public String visit(UnknownType unknownType) {
				throw new InternalCompilerError("unknown type has no encoding");
			}
		});
	}
}
