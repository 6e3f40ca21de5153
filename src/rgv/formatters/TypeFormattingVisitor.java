package rgv.formatters;

import rgv.model.type.*;

import java.io.IOException;

public class TypeFormattingVisitor extends TypeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public TypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IntType intType) throws IOException {
		out.write("int");
		return null;
	}

	@Override
	public Void visit(BoolType boolType) throws IOException {
		out.write("bool");
		return null;
	}

	@Override
	public Void visit(VoidType voidType) throws IOException {
		out.write("void");
		return null;
	}

	@Override
	public Void visit(NullType nullType) throws IOException {
		out.write("null");
		return null;
	}

	@Override
	public Void visit(RefType refType) throws IOException {
		out.write(refType.getStructName());
		out.write("*");
		return null;
	}

	@Override
	public Void visit(RegionIdType regionIdType) throws IOException {
		out.write("id");
		return null;
	}

	@Override
	public Void visit(SetType setType) throws IOException {
		out.write("set<");
		setType.getElementType().accept(this);
		out.write(">");
		return null;
	}

	@Override
	public Void visit(SeqType seqType) throws IOException {
		out.write("seq<");
		seqType.getElementType().accept(this);
		out.write(">");
		return null;
	}

	@Override
	public Void visit(UnknownType unknownType) throws IOException {
		out.write("<unknown>");
		return null;
	}
}
