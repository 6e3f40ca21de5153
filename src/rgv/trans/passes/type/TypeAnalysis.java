package rgv.trans.passes.type;

import rgv.model.rg.*;
import rgv.model.type.*;
import rgv.scope.*;
import rgv.trans.attribution.Attribute;
import rgv.trans.attribution.CycleDetectedException;
import rgv.trans.passes.scope.NameAnalysis;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes the type of every expression bottom-up, and the type every expression is expected
 * to have top-down from its syntactic position.
 */
public class TypeAnalysis {
	private final NameAnalysis names;
	private final RgTree tree;

	private final Attribute<RgExpression, Type> typ;
	private final Attribute<RgExpression, Type> expectedType;
	private final Attribute<RgIdnNode, Type> typeOfIdn;
	private final Attribute<RgLocation, Type> typeOfLocation;
	private final Attribute<RgLogicalVariableBinder, Type> typeOfLogicalVariable;

	public TypeAnalysis(NameAnalysis names) {
		this.names = names;
		this.tree = names.getTree();
		this.typ = new Attribute<>("typ", e -> e.accept(new TypeOfExpressionVisitor(this, names)));
		this.expectedType = new Attribute<>("expectedType", unknownOnCycle(this::computeExpectedType));
		this.typeOfIdn = new Attribute<>("typeOfIdn", this::computeTypeOfIdn);
		this.typeOfLocation = new Attribute<>("typeOfLocation", this::computeTypeOfLocation);
		this.typeOfLogicalVariable = new Attribute<>("typeOfLogicalVariable",
				unknownOnCycle(this::computeTypeOfLogicalVariable));
	}

	/**
	 * Expected types and logical variable types can depend on themselves through the types of
	 * neighbouring expressions; such a dependency has no answer and is read as Unknown.
	 */
	private static <N> Function<N, Type> unknownOnCycle(Function<N, Type> definition) {
		return node -> {
			try {
				return definition.apply(node);
			} catch (CycleDetectedException ex) {
				return new UnknownType();
			}
		};
	}

	public NameAnalysis getNames() {
		return names;
	}

	public Type typ(RgExpression expression) {
		return typ.apply(expression);
	}

	public Type expectedType(RgExpression expression) {
		return expectedType.apply(expression);
	}

	public Type typeOfIdn(RgIdnNode id) {
		return typeOfIdn.apply(id);
	}

	public Type typeOfLocation(RgLocation location) {
		return typeOfLocation.apply(location);
	}

	public Type typeOfLogicalVariable(RgLogicalVariableBinder binder) {
		return typeOfLogicalVariable.apply(binder);
	}

	public Type stateType(RgRegion region) {
		return typ(region.getState());
	}

	private Type computeTypeOfIdn(RgIdnNode id) {
		return names.entity(id).accept(new EntityVisitor<Type, RuntimeException>() {
			@Override
			public Type visit(StructEntity structEntity) {
				return new UnknownType();
			}

			@Override
			public Type visit(ProcedureEntity procedureEntity) {
				return procedureEntity.getDeclaration().getReturnType();
			}

			@Override
			public Type visit(PredicateEntity predicateEntity) {
				return new UnknownType();
			}

			@Override
			public Type visit(RegionEntity regionEntity) {
				return new UnknownType();
			}

			@Override
			public Type visit(GuardEntity guardEntity) {
				return new UnknownType();
			}

			@Override
			public Type visit(ArgumentEntity argumentEntity) {
				return argumentEntity.getDeclaration().getType();
			}

			@Override
			public Type visit(LocalVariableEntity localVariableEntity) {
				return localVariableEntity.getDeclaration().getType();
			}

			@Override
			public Type visit(LogicalVariableEntity logicalVariableEntity) {
				return typeOfLogicalVariable(logicalVariableEntity.getDeclaration());
			}

			@Override
			public Type visit(UnknownEntity unknownEntity) {
				return new UnknownType();
			}

			@Override
			public Type visit(MultipleEntity multipleEntity) {
				return new UnknownType();
			}
		});
	}

	/**
	 * @return the struct a reference-typed receiver points to, if it has one
	 */
	public Optional<RgStruct> receiverStruct(RgIdnUse receiver) {
		Type t = typeOfIdn(receiver);
		if (t instanceof RefType) {
			return names.struct(((RefType) t).getStructName());
		}
		return Optional.empty();
	}

	private Type computeTypeOfLocation(RgLocation location) {
		return receiverStruct(location.getReceiver())
				.flatMap(struct -> struct.getField(location.getField().getName()))
				.map(RgFieldDecl::getType)
				.orElseGet(UnknownType::new);
	}

	private Type computeTypeOfLogicalVariable(RgLogicalVariableBinder binder) {
		Optional<RgNode> context = names.boundBy(binder);
		if (!context.isPresent()) {
			return new UnknownType();
		}
		RgNode bindingContext = context.get();
		if (bindingContext instanceof RgPointsTo) {
			return typeOfLocation(((RgPointsTo) bindingContext).getHeapLocation());
		} else if (bindingContext instanceof RgPredicateExp) {
			RgPredicateExp exp = (RgPredicateExp) bindingContext;
			Entity e = names.entity(exp.getPredicate());
			if (!(e instanceof RegionEntity)) {
				return new UnknownType();
			}
			RgRegion region = ((RegionEntity) e).getDeclaration();
			List<RgExpression> args = exp.getArguments();
			// only the trailing out-argument of a region instance binds
			if (args.indexOf(binder) != region.getFormalArgs().size() + 1) {
				return new UnknownType();
			}
			return stateType(region);
		} else if (bindingContext instanceof RgInterferenceClause) {
			Type setType = typ(((RgInterferenceClause) bindingContext).getSet());
			if (setType instanceof SetType) {
				return ((SetType) setType).getElementType();
			}
			return new UnknownType();
		} else if (bindingContext instanceof RgAction) {
			return names.enclosingMember(bindingContext)
					.filter(RgRegion.class::isInstance)
					.map(r -> stateType((RgRegion) r))
					.orElseGet(UnknownType::new);
		} else if (bindingContext instanceof RgSetComprehension) {
			RgSetComprehension comprehension = (RgSetComprehension) bindingContext;
			if (comprehension.getTypeAnnotation().isPresent()) {
				return comprehension.getTypeAnnotation().get();
			}
			String name = binder.getId().getName();
			Set<Type> expectedTypes = new HashSet<>();
			for (RgIdnExp occurrence : tree.subtree(comprehension.getFilter(), RgIdnExp.class)) {
				if (occurrence.getId().getName().equals(name)) {
					expectedTypes.add(expectedType(occurrence));
				}
			}
			if (expectedTypes.size() != 1) {
				return new UnknownType();
			}
			return expectedTypes.iterator().next();
		}
		return new UnknownType();
	}

	private Type computeExpectedType(RgExpression e) {
		Optional<RgNode> parent = tree.parent(e);
		if (!parent.isPresent()) {
			return new UnknownType();
		}
		RgNode p = parent.get();
		if (p instanceof RgIf && ((RgIf) p).getCondition() == e) {
			return new BoolType();
		} else if (p instanceof RgWhile && ((RgWhile) p).getCondition() == e) {
			return new BoolType();
		} else if (p instanceof RgAssign) {
			Entity lhs = names.entity(((RgAssign) p).getLhs());
			if (lhs instanceof LocalVariableEntity) {
				return ((LocalVariableEntity) lhs).getDeclaration().getType();
			}
			return new UnknownType();
		} else if (p instanceof RgHeapWrite) {
			return typeOfLocation(((RgHeapWrite) p).getHeapLocation());
		} else if (p instanceof RgBinOp) {
			RgBinOp binOp = (RgBinOp) p;
			switch (binOp.getOperator().getCategory()) {
				case ARITHMETIC:
				case COMPARISON:
					return new IntType();
				case BOOLEAN:
					return new BoolType();
				case EQUALITY:
					// each side is expected to have the other side's type
					return binOp.getLeft() == e ? typ(binOp.getRight()) : typ(binOp.getLeft());
			}
		} else if (p instanceof RgNot) {
			return new BoolType();
		} else if (p instanceof RgConditional) {
			RgConditional conditional = (RgConditional) p;
			if (conditional.getCondition() == e) {
				return new BoolType();
			} else if (conditional.getElse() == e) {
				return typ(conditional.getThen());
			}
		} else if (p instanceof RgSetContains && ((RgSetContains) p).getSet() == e) {
			return new SetType(typ(((RgSetContains) p).getElement()));
		}
		return new UnknownType();
	}
}
