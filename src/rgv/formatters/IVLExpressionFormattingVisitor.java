package rgv.formatters;

import rgv.model.ivl.*;

import java.io.IOException;
import java.util.List;

/**
 * Renders IVL expressions in Viper syntax. Compound expressions are fully parenthesized.
 */
public class IVLExpressionFormattingVisitor extends IVLExpressionVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IVLExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeCall(String name, List<IVLExpression> arguments) throws IOException {
		out.write(name);
		out.write("(");
		FormattingTools.writeCommaSeparated(out, arguments, a -> a.accept(this));
		out.write(")");
	}

	private void writeTyped(String constructor, IVLType elementType, List<IVLExpression> elements)
			throws IOException {
		out.write(constructor);
		if (elements.isEmpty()) {
			out.write("[");
			elementType.accept(new IVLTypeFormattingVisitor(out));
			out.write("]");
		}
		out.write("(");
		FormattingTools.writeCommaSeparated(out, elements, e -> e.accept(this));
		out.write(")");
	}

	@Override
	public Void visit(IVLIntLit intLit) throws IOException {
		out.write(intLit.getValue().toString());
		return null;
	}

	@Override
	public Void visit(IVLBoolLit boolLit) throws IOException {
		out.write(boolLit.getValue() ? "true" : "false");
		return null;
	}

	@Override
	public Void visit(IVLNullLit nullLit) throws IOException {
		out.write("null");
		return null;
	}

	@Override
	public Void visit(IVLLocalVar localVar) throws IOException {
		out.write(localVar.getName());
		return null;
	}

	@Override
	public Void visit(IVLResult result) throws IOException {
		out.write("result");
		return null;
	}

	@Override
	public Void visit(IVLFieldAccess fieldAccess) throws IOException {
		fieldAccess.getReceiver().accept(this);
		out.write(".");
		out.write(fieldAccess.getField().getName());
		return null;
	}

	@Override
	public Void visit(IVLFieldAccessPredicate fieldAccessPredicate) throws IOException {
		out.write("acc(");
		fieldAccessPredicate.getLocation().accept(this);
		if (!(fieldAccessPredicate.getPermission() instanceof IVLFullPerm)) {
			out.write(", ");
			fieldAccessPredicate.getPermission().accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLPredicateAccess predicateAccess) throws IOException {
		writeCall(predicateAccess.getPredicateName(), predicateAccess.getArguments());
		return null;
	}

	@Override
	public Void visit(IVLPredicateAccessPredicate predicateAccessPredicate) throws IOException {
		out.write("acc(");
		predicateAccessPredicate.getLocation().accept(this);
		if (!(predicateAccessPredicate.getPermission() instanceof IVLFullPerm)) {
			out.write(", ");
			predicateAccessPredicate.getPermission().accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLFullPerm fullPerm) throws IOException {
		out.write("write");
		return null;
	}

	@Override
	public Void visit(IVLNoPerm noPerm) throws IOException {
		out.write("none");
		return null;
	}

	@Override
	public Void visit(IVLCurrentPerm currentPerm) throws IOException {
		out.write("perm(");
		currentPerm.getResource().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLFuncApp funcApp) throws IOException {
		writeCall(funcApp.getFunctionName(), funcApp.getArguments());
		return null;
	}

	@Override
	public Void visit(IVLUnaryOp unaryOp) throws IOException {
		out.write(unaryOp.getOperator().getSymbol());
		unaryOp.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(IVLBinaryOp binaryOp) throws IOException {
		out.write("(");
		binaryOp.getLeft().accept(this);
		out.write(" ");
		out.write(binaryOp.getOperator().getSymbol());
		out.write(" ");
		binaryOp.getRight().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLCondExp condExp) throws IOException {
		out.write("(");
		condExp.getCondition().accept(this);
		out.write(" ? ");
		condExp.getThen().accept(this);
		out.write(" : ");
		condExp.getElse().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLOld ivlOld) throws IOException {
		out.write("old(");
		ivlOld.getExp().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLLabelledOld labelledOld) throws IOException {
		out.write("old[");
		out.write(labelledOld.getLabel());
		out.write("](");
		labelledOld.getExp().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLExplicitSet explicitSet) throws IOException {
		writeTyped("Set", explicitSet.getElementType(), explicitSet.getElements());
		return null;
	}

	@Override
	public Void visit(IVLExplicitSeq explicitSeq) throws IOException {
		writeTyped("Seq", explicitSeq.getElementType(), explicitSeq.getElements());
		return null;
	}

	@Override
	public Void visit(IVLSetContains setContains) throws IOException {
		out.write("(");
		setContains.getElement().accept(this);
		out.write(" in ");
		setContains.getSet().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLSeqLength seqLength) throws IOException {
		out.write("|");
		seqLength.getSeq().accept(this);
		out.write("|");
		return null;
	}

	@Override
	public Void visit(IVLSeqIndex seqIndex) throws IOException {
		seqIndex.getSeq().accept(this);
		out.write("[");
		seqIndex.getIndex().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(IVLSeqDrop seqDrop) throws IOException {
		seqDrop.getSeq().accept(this);
		out.write("[");
		seqDrop.getCount().accept(this);
		out.write("..]");
		return null;
	}

	@Override
	public Void visit(IVLUnfolding unfolding) throws IOException {
		out.write("(unfolding ");
		unfolding.getAcc().accept(this);
		out.write(" in ");
		unfolding.getBody().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLForall forall) throws IOException {
		out.write("(forall ");
		FormattingTools.writeCommaSeparated(out, forall.getVariables(), v -> {
			out.write(v.getName());
			out.write(": ");
			v.getType().accept(new IVLTypeFormattingVisitor(out));
		});
		out.write(" :: ");
		forall.getBody().accept(this);
		out.write(")");
		return null;
	}
}
