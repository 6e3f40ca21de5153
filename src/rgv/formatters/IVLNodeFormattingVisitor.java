package rgv.formatters;

import rgv.model.ivl.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Renders whole IVL programs and their members in Viper syntax.
 */
public class IVLNodeFormattingVisitor extends IVLNodeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IVLNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IVLProgram program) throws IOException {
		boolean first = true;
		for (List<? extends IVLMember> members : Arrays.<List<? extends IVLMember>>asList(
				program.getFields(), program.getPredicates(), program.getFunctions(), program.getMethods())) {
			for (IVLMember member : members) {
				if (!first) {
					out.newLine();
					out.newLine();
				}
				first = false;
				member.accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(IVLMember member) throws IOException {
		member.accept(new MemberFormattingVisitor());
		return null;
	}

	@Override
	public Void visit(IVLLocalVarDecl localVarDecl) throws IOException {
		out.write(localVarDecl.getName());
		out.write(": ");
		localVarDecl.getType().accept(new IVLTypeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(IVLStatement statement) throws IOException {
		statement.accept(new IVLStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(IVLExpression expression) throws IOException {
		expression.accept(new IVLExpressionFormattingVisitor(out));
		return null;
	}

	private void writeDecls(List<IVLLocalVarDecl> decls) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, decls, d -> d.accept(this));
		out.write(")");
	}

	private void writeSpecs(String keyword, List<IVLExpression> specs) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (IVLExpression spec : specs) {
				out.newLine();
				out.write(keyword);
				out.write(" ");
				spec.accept(new IVLExpressionFormattingVisitor(out));
			}
		}
	}

	private void writeBody(Optional<IVLExpression> body) throws IOException {
		if (body.isPresent()) {
			out.newLine();
			out.write("{");
			try (IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				body.get().accept(new IVLExpressionFormattingVisitor(out));
			}
			out.newLine();
			out.write("}");
		}
	}

	private class MemberFormattingVisitor extends IVLMemberVisitor<Void, IOException> {
		@Override
		public Void visit(IVLField field) throws IOException {
			out.write("field ");
			out.write(field.getName());
			out.write(": ");
			field.getType().accept(new IVLTypeFormattingVisitor(out));
			return null;
		}

		@Override
		public Void visit(IVLPredicate predicate) throws IOException {
			out.write("predicate ");
			out.write(predicate.getName());
			writeDecls(predicate.getFormalArgs());
			writeBody(predicate.getBody());
			return null;
		}

		@Override
		public Void visit(IVLFunction function) throws IOException {
			out.write("function ");
			out.write(function.getName());
			writeDecls(function.getFormalArgs());
			out.write(": ");
			function.getType().accept(new IVLTypeFormattingVisitor(out));
			writeSpecs("requires", function.getPres());
			writeSpecs("ensures", function.getPosts());
			writeBody(function.getBody());
			return null;
		}

		@Override
		public Void visit(IVLMethod method) throws IOException {
			out.write("method ");
			out.write(method.getName());
			writeDecls(method.getFormalArgs());
			if (!method.getFormalReturns().isEmpty()) {
				out.write(" returns ");
				writeDecls(method.getFormalReturns());
			}
			writeSpecs("requires", method.getPres());
			writeSpecs("ensures", method.getPosts());
			if (method.getBody().isPresent()) {
				out.newLine();
				out.write("{");
				try (IndentingWriter.Indent ignored = out.indent()) {
					for (IVLLocalVarDecl local : method.getLocals()) {
						out.newLine();
						out.write("var ");
						local.accept(IVLNodeFormattingVisitor.this);
					}
					IVLStatementFormattingVisitor statements = new IVLStatementFormattingVisitor(out);
					for (IVLStatement statement : method.getBody().get().getStatements()) {
						out.newLine();
						statement.accept(statements);
					}
				}
				out.newLine();
				out.write("}");
			}
			return null;
		}
	}
}
