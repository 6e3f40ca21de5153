package rgv.formatters;

import rgv.model.ivl.*;

import java.io.IOException;

public class IVLStatementFormattingVisitor extends IVLStatementVisitor<Void, IOException> {
	private final IndentingWriter out;
	private final IVLExpressionFormattingVisitor expressions;

	public IVLStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.expressions = new IVLExpressionFormattingVisitor(out);
	}

	private void writeBlock(IVLSeqn seqn) throws IOException {
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (IVLStatement statement : seqn.getStatements()) {
				out.newLine();
				statement.accept(this);
			}
		}
		out.newLine();
		out.write("}");
	}

	private void writeKeyword(String keyword, IVLExpression exp) throws IOException {
		out.write(keyword);
		out.write(" ");
		exp.accept(expressions);
	}

	@Override
	public Void visit(IVLSeqn seqn) throws IOException {
		writeBlock(seqn);
		return null;
	}

	@Override
	public Void visit(IVLInhale inhale) throws IOException {
		writeKeyword("inhale", inhale.getExp());
		return null;
	}

	@Override
	public Void visit(IVLExhale exhale) throws IOException {
		writeKeyword("exhale", exhale.getExp());
		return null;
	}

	@Override
	public Void visit(IVLAssert ivlAssert) throws IOException {
		writeKeyword("assert", ivlAssert.getExp());
		return null;
	}

	@Override
	public Void visit(IVLFold fold) throws IOException {
		writeKeyword("fold", fold.getAcc());
		return null;
	}

	@Override
	public Void visit(IVLUnfold unfold) throws IOException {
		writeKeyword("unfold", unfold.getAcc());
		return null;
	}

	@Override
	public Void visit(IVLLabel label) throws IOException {
		out.write("label ");
		out.write(label.getName());
		return null;
	}

	@Override
	public Void visit(IVLIf ivlIf) throws IOException {
		out.write("if (");
		ivlIf.getCondition().accept(expressions);
		out.write(") ");
		writeBlock(ivlIf.getThen());
		if (!ivlIf.getElse().getStatements().isEmpty()) {
			out.write(" else ");
			writeBlock(ivlIf.getElse());
		}
		return null;
	}

	@Override
	public Void visit(IVLWhile ivlWhile) throws IOException {
		out.write("while (");
		ivlWhile.getCondition().accept(expressions);
		out.write(")");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (IVLExpression invariant : ivlWhile.getInvariants()) {
				out.newLine();
				writeKeyword("invariant", invariant);
			}
		}
		out.newLine();
		writeBlock(ivlWhile.getBody());
		return null;
	}

	@Override
	public Void visit(IVLLocalAssign localAssign) throws IOException {
		localAssign.getLhs().accept(expressions);
		out.write(" := ");
		localAssign.getRhs().accept(expressions);
		return null;
	}

	@Override
	public Void visit(IVLFieldAssign fieldAssign) throws IOException {
		fieldAssign.getLhs().accept(expressions);
		out.write(" := ");
		fieldAssign.getRhs().accept(expressions);
		return null;
	}

	@Override
	public Void visit(IVLMethodCall methodCall) throws IOException {
		if (!methodCall.getTargets().isEmpty()) {
			FormattingTools.writeCommaSeparated(out, methodCall.getTargets(), t -> t.accept(expressions));
			out.write(" := ");
		}
		out.write(methodCall.getMethodName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, methodCall.getArguments(), a -> a.accept(expressions));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(IVLComment comment) throws IOException {
		out.write("// ");
		out.write(comment.getText());
		return null;
	}
}
