package rgv.formatters;

import rgv.model.ivl.*;

import java.io.IOException;

public class IVLTypeFormattingVisitor extends IVLTypeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IVLTypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IVLIntType intType) throws IOException {
		out.write("Int");
		return null;
	}

	@Override
	public Void visit(IVLBoolType boolType) throws IOException {
		out.write("Bool");
		return null;
	}

	@Override
	public Void visit(IVLRefType refType) throws IOException {
		out.write("Ref");
		return null;
	}

	@Override
	public Void visit(IVLPermType permType) throws IOException {
		out.write("Perm");
		return null;
	}

	@Override
	public Void visit(IVLSetType setType) throws IOException {
		out.write("Set[");
		setType.getElementType().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(IVLSeqType seqType) throws IOException {
		out.write("Seq[");
		seqType.getElementType().accept(this);
		out.write("]");
		return null;
	}
}
