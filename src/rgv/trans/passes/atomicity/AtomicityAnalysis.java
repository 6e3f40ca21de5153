package rgv.trans.passes.atomicity;

import rgv.model.rg.*;
import rgv.scope.Entity;
import rgv.scope.ProcedureEntity;
import rgv.trans.attribution.Attribute;
import rgv.trans.passes.scope.NameAnalysis;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Classifies statements as atomic or not. Ghost code never affects the classification: a
 * sequence is as atomic as its only non-ghost component, and non-atomic when it has several.
 */
public class AtomicityAnalysis {
	private final NameAnalysis names;
	private final RgTree tree;

	private final Attribute<RgStatement, Boolean> isGhost;
	private final Attribute<RgStatement, AtomicityKind> atomicity;
	private final Attribute<RgStatement, AtomicityKind> expectedAtomicity;

	public AtomicityAnalysis(NameAnalysis names) {
		this.names = names;
		this.tree = names.getTree();
		this.isGhost = new Attribute<>("isGhost", this::computeIsGhost);
		this.atomicity = new Attribute<>("atomicity", s -> s.accept(new AtomicityVisitor()));
		this.expectedAtomicity = new Attribute<>("expectedAtomicity", this::computeExpectedAtomicity);
	}

	public boolean isGhost(RgStatement statement) {
		return isGhost.apply(statement);
	}

	public AtomicityKind atomicity(RgStatement statement) {
		return atomicity.apply(statement);
	}

	public AtomicityKind expectedAtomicity(RgStatement statement) {
		return expectedAtomicity.apply(statement);
	}

	private boolean computeIsGhost(RgStatement statement) {
		if (statement instanceof RgGhostStatement) {
			return true;
		}
		if (statement instanceof RgCompoundStatement) {
			return ((RgCompoundStatement) statement).getComponents().stream().allMatch(this::isGhost);
		}
		return false;
	}

	private AtomicityKind sequence(List<RgStatement> statements) {
		List<RgStatement> nonGhost = statements.stream().filter(s -> !isGhost(s)).collect(Collectors.toList());
		if (nonGhost.isEmpty()) {
			return AtomicityKind.ATOMIC;
		}
		if (nonGhost.size() == 1) {
			return atomicity(nonGhost.get(0));
		}
		return AtomicityKind.NONATOMIC;
	}

	private static AtomicityKind ofModifier(RgProcedure.Atomicity modifier) {
		switch (modifier) {
			case NOT_ATOMIC:
				return AtomicityKind.NONATOMIC;
			case PRIMITIVE_ATOMIC:
			case ABSTRACT_ATOMIC:
				return AtomicityKind.ATOMIC;
			default:
				throw new IllegalArgumentException("unknown procedure atomicity " + modifier);
		}
	}

	private AtomicityKind computeExpectedAtomicity(RgStatement statement) {
		Optional<RgNode> parent = tree.parent(statement);
		if (!parent.isPresent()) {
			return AtomicityKind.NONATOMIC;
		}
		RgNode p = parent.get();
		if (p instanceof RgProcedure) {
			return ofModifier(((RgProcedure) p).getAtomicity());
		} else if (p instanceof RgMakeAtomic) {
			return AtomicityKind.NONATOMIC;
		} else if (p instanceof RgRuleStatement) {
			return AtomicityKind.ATOMIC;
		} else if (p instanceof RgBlock) {
			RgBlock block = (RgBlock) p;
			boolean othersGhost = block.getStatements().stream()
					.filter(s -> s != statement)
					.allMatch(this::isGhost);
			return othersGhost ? expectedAtomicity(block) : AtomicityKind.NONATOMIC;
		}
		return AtomicityKind.NONATOMIC;
	}

	private class AtomicityVisitor extends RgStatementVisitor<AtomicityKind, RuntimeException> {
		@Override
		public AtomicityKind visit(RgBlock block) {
			return sequence(block.getStatements());
		}

		@Override
		public AtomicityKind visit(RgSkip skip) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgIf rgIf) {
			return AtomicityKind.NONATOMIC;
		}

		@Override
		public AtomicityKind visit(RgWhile rgWhile) {
			return AtomicityKind.NONATOMIC;
		}

		@Override
		public AtomicityKind visit(RgAssign assign) {
			return AtomicityKind.NONATOMIC;
		}

		@Override
		public AtomicityKind visit(RgHeapRead heapRead) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgHeapWrite heapWrite) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgProcedureCall procedureCall) {
			Entity callee = names.entity(procedureCall.getProcedure());
			if (callee instanceof ProcedureEntity) {
				return ofModifier(((ProcedureEntity) callee).getDeclaration().getAtomicity());
			}
			return AtomicityKind.NONATOMIC;
		}

		@Override
		public AtomicityKind visit(RgFold fold) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgUnfold unfold) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgInhale inhale) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgExhale exhale) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgAssume assume) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgAssert rgAssert) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgMakeAtomic makeAtomic) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgUpdateRegion updateRegion) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgUseAtomic useAtomic) {
			return AtomicityKind.ATOMIC;
		}

		@Override
		public AtomicityKind visit(RgOpenRegion openRegion) {
			return AtomicityKind.ATOMIC;
		}
	}
}
