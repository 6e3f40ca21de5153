package rgv.trans.passes.codegen.ivl;

import rgv.InternalCompilerError;
import rgv.model.ivl.IVLBuilder;
import rgv.model.ivl.IVLType;
import rgv.model.type.*;

/**
 * Maps program types onto IVL types. Struct references, region ids and null share the IVL
 * reference type.
 */
public class TypeTranslator extends TypeVisitor<IVLType, RuntimeException> {
	public static IVLType translate(Type type) {
		return type.accept(new TypeTranslator());
	}

	@Override
	public IVLType visit(IntType intType) {
		return IVLBuilder.intType();
	}

	@Override
	public IVLType visit(BoolType boolType) {
		return IVLBuilder.boolType();
	}

	@Override
	public IVLType visit(VoidType voidType) {
		throw new InternalCompilerError("void is not a value type");
	}

	@Override
	public IVLType visit(NullType nullType) {
		return IVLBuilder.refType();
	}

	@Override
	public IVLType visit(RefType refType) {
		return IVLBuilder.refType();
	}

	@Override
	public IVLType visit(RegionIdType regionIdType) {
		return IVLBuilder.refType();
	}

	@Override
	public IVLType visit(SetType setType) {
		return IVLBuilder.setType(setType.getElementType().accept(this));
	}

	@Override
	public IVLType visit(SeqType seqType) {
		return IVLBuilder.seqType(seqType.getElementType().accept(this));
	}

	@Override
	public IVLType visit(UnknownType unknownType) {
		throw new InternalCompilerError("cannot translate an untyped construct");
	}
}
