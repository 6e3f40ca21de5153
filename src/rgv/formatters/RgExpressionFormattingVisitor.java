package rgv.formatters;

import rgv.model.rg.*;

import java.io.IOException;
import java.util.List;

/**
 * Renders expressions in the surface syntax, for diagnostics.
 */
public class RgExpressionFormattingVisitor extends RgExpressionVisitor<Void, IOException> {
	private final IndentingWriter out;

	public RgExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeArguments(List<RgExpression> arguments) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, arguments, a -> a.accept(this));
		out.write(")");
	}

	@Override
	public Void visit(RgIntLit intLit) throws IOException {
		out.write(intLit.getValue().toString());
		return null;
	}

	@Override
	public Void visit(RgBoolLit boolLit) throws IOException {
		out.write(boolLit.getValue() ? "true" : "false");
		return null;
	}

	@Override
	public Void visit(RgNullLit nullLit) throws IOException {
		out.write("null");
		return null;
	}

	@Override
	public Void visit(RgRet ret) throws IOException {
		out.write("ret");
		return null;
	}

	@Override
	public Void visit(RgIdnExp idnExp) throws IOException {
		out.write(idnExp.getId().getName());
		return null;
	}

	@Override
	public Void visit(RgBinOp binOp) throws IOException {
		out.write("(");
		binOp.getLeft().accept(this);
		out.write(" ");
		out.write(binOp.getOperator().getSymbol());
		out.write(" ");
		binOp.getRight().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RgNot not) throws IOException {
		out.write("!");
		not.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(RgConditional conditional) throws IOException {
		out.write("(");
		conditional.getCondition().accept(this);
		out.write(" ? ");
		conditional.getThen().accept(this);
		out.write(" : ");
		conditional.getElse().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RgNumberSet numberSet) throws IOException {
		out.write(numberSet.getKind() == RgNumberSet.Kind.INT ? "Int" : "Nat");
		return null;
	}

	@Override
	public Void visit(RgExplicitSet explicitSet) throws IOException {
		out.write("Set");
		writeArguments(explicitSet.getElements());
		return null;
	}

	@Override
	public Void visit(RgExplicitSeq explicitSeq) throws IOException {
		out.write("Seq");
		writeArguments(explicitSeq.getElements());
		return null;
	}

	@Override
	public Void visit(RgSetComprehension setComprehension) throws IOException {
		out.write("Set(");
		setComprehension.getBinder().accept(this);
		out.write(" | ");
		setComprehension.getFilter().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RgSetContains setContains) throws IOException {
		setContains.getElement().accept(this);
		out.write(" in ");
		setContains.getSet().accept(this);
		return null;
	}

	@Override
	public Void visit(RgSeqSize seqSize) throws IOException {
		out.write("size(");
		seqSize.getSeq().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RgSeqHead seqHead) throws IOException {
		out.write("head(");
		seqHead.getSeq().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RgSeqTail seqTail) throws IOException {
		out.write("tail(");
		seqTail.getSeq().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RgUnfolding unfolding) throws IOException {
		out.write("unfolding ");
		unfolding.getPredicate().accept(this);
		out.write(" in ");
		unfolding.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(RgPointsTo pointsTo) throws IOException {
		out.write(pointsTo.getHeapLocation().toString());
		out.write(" |-> ");
		pointsTo.getValue().accept(this);
		return null;
	}

	@Override
	public Void visit(RgPredicateExp predicateExp) throws IOException {
		out.write(predicateExp.getPredicate().getName());
		writeArguments(predicateExp.getArguments());
		return null;
	}

	@Override
	public Void visit(RgGuardExp guardExp) throws IOException {
		out.write(guardExp.getGuard().getName());
		out.write("@");
		out.write(guardExp.getRegionId().getName());
		return null;
	}

	@Override
	public Void visit(RgDiamond diamond) throws IOException {
		out.write("<D>(");
		out.write(diamond.getRegionId().getName());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RgRegionUpdateWitness regionUpdateWitness) throws IOException {
		out.write(regionUpdateWitness.getRegionId().getName());
		out.write(" |=> (");
		regionUpdateWitness.getFrom().accept(this);
		out.write(", ");
		regionUpdateWitness.getTo().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RgLogicalVariableBinder logicalVariableBinder) throws IOException {
		out.write("?");
		out.write(logicalVariableBinder.getId().getName());
		return null;
	}
}
