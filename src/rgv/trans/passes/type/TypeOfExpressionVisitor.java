package rgv.trans.passes.type;

import rgv.model.rg.*;
import rgv.model.type.*;
import rgv.trans.passes.scope.NameAnalysis;

import java.util.Optional;
import java.util.function.Function;

public class TypeOfExpressionVisitor extends RgExpressionVisitor<Type, RuntimeException> {
	private final TypeAnalysis types;
	private final NameAnalysis names;

	public TypeOfExpressionVisitor(TypeAnalysis types, NameAnalysis names) {
		this.types = types;
		this.names = names;
	}

	@Override
	public Type visit(RgIntLit intLit) {
		return new IntType();
	}

	@Override
	public Type visit(RgBoolLit boolLit) {
		return new BoolType();
	}

	@Override
	public Type visit(RgNullLit nullLit) {
		return new NullType();
	}

	@Override
	public Type visit(RgRet ret) {
		Optional<RgMember> member = names.enclosingMember(ret);
		if (member.isPresent() && member.get() instanceof RgProcedure) {
			return ((RgProcedure) member.get()).getReturnType();
		}
		return new UnknownType();
	}

	@Override
	public Type visit(RgIdnExp idnExp) {
		return types.typeOfIdn(idnExp.getId());
	}

	@Override
	public Type visit(RgBinOp binOp) {
		if (binOp.getOperator().getCategory() == RgBinOp.Category.ARITHMETIC) {
			return new IntType();
		}
		return new BoolType();
	}

	@Override
	public Type visit(RgNot not) {
		return new BoolType();
	}

	@Override
	public Type visit(RgConditional conditional) {
		return types.typ(conditional.getThen());
	}

	@Override
	public Type visit(RgNumberSet numberSet) {
		return new SetType(new IntType());
	}

	private Type explicitCollection(RgExplicitCollection collection, Function<Type, Type> constructor) {
		if (collection.getTypeAnnotation().isPresent()) {
			return constructor.apply(collection.getTypeAnnotation().get());
		}
		if (!collection.getElements().isEmpty()) {
			return constructor.apply(types.typ(collection.getElements().get(0)));
		}
		return new UnknownType();
	}

	@Override
	public Type visit(RgExplicitSet explicitSet) {
		return explicitCollection(explicitSet, SetType::new);
	}

	@Override
	public Type visit(RgExplicitSeq explicitSeq) {
		return explicitCollection(explicitSeq, SeqType::new);
	}

	@Override
	public Type visit(RgSetComprehension setComprehension) {
		if (setComprehension.getTypeAnnotation().isPresent()) {
			return new SetType(setComprehension.getTypeAnnotation().get());
		}
		return new SetType(types.typeOfLogicalVariable(setComprehension.getBinder()));
	}

	@Override
	public Type visit(RgSetContains setContains) {
		return new BoolType();
	}

	@Override
	public Type visit(RgSeqSize seqSize) {
		return new IntType();
	}

	@Override
	public Type visit(RgSeqHead seqHead) {
		Type seqType = types.typ(seqHead.getSeq());
		if (seqType instanceof CollectionType) {
			return ((CollectionType) seqType).getElementType();
		}
		return new UnknownType();
	}

	@Override
	public Type visit(RgSeqTail seqTail) {
		return types.typ(seqTail.getSeq());
	}

	@Override
	public Type visit(RgUnfolding unfolding) {
		return types.typ(unfolding.getBody());
	}

	@Override
	public Type visit(RgPointsTo pointsTo) {
		return new BoolType();
	}

	@Override
	public Type visit(RgPredicateExp predicateExp) {
		return new BoolType();
	}

	@Override
	public Type visit(RgGuardExp guardExp) {
		return new BoolType();
	}

	@Override
	public Type visit(RgDiamond diamond) {
		return new BoolType();
	}

	@Override
	public Type visit(RgRegionUpdateWitness regionUpdateWitness) {
		return new BoolType();
	}

	@Override
	public Type visit(RgLogicalVariableBinder logicalVariableBinder) {
		return types.typeOfLogicalVariable(logicalVariableBinder);
	}
}
