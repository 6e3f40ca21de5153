package rgv.model.ivl;

import java.util.List;
import java.util.Objects;

public class IVLProgram extends IVLNode {
	private final List<IVLField> fields;
	private final List<IVLFunction> functions;
	private final List<IVLPredicate> predicates;
	private final List<IVLMethod> methods;

	public IVLProgram(List<IVLField> fields, List<IVLFunction> functions, List<IVLPredicate> predicates, List<IVLMethod> methods) {
		this.fields = fields;
		this.functions = functions;
		this.predicates = predicates;
		this.methods = methods;
	}

	public List<IVLField> getFields() {
		return fields;
	}

	public List<IVLFunction> getFunctions() {
		return functions;
	}

	public List<IVLPredicate> getPredicates() {
		return predicates;
	}

	public List<IVLMethod> getMethods() {
		return methods;
	}

	@Override
	public <T, E extends Throwable> T accept(IVLNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IVLProgram that = (IVLProgram) o;
		return Objects.equals(fields, that.fields) &&
				Objects.equals(functions, that.functions) &&
				Objects.equals(predicates, that.predicates) &&
				Objects.equals(methods, that.methods);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fields, functions, predicates, methods);
	}
}
