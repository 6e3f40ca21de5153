package rgv.model.ivl;

import rgv.util.Origin;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class IVLBuilder {

	private IVLBuilder() {}

	/**
	 * Records origin as the construct node encodes.
	 */
	public static <N extends IVLNode> N sourced(N node, Origin origin) {
		node.addOrigin(origin);
		return node;
	}

	public static IVLIntType intType() {
		return new IVLIntType();
	}

	public static IVLBoolType boolType() {
		return new IVLBoolType();
	}

	public static IVLRefType refType() {
		return new IVLRefType();
	}

	public static IVLSetType setType(IVLType elementType) {
		return new IVLSetType(elementType);
	}

	public static IVLSeqType seqType(IVLType elementType) {
		return new IVLSeqType(elementType);
	}

	public static IVLLocalVarDecl decl(String name, IVLType type) {
		return new IVLLocalVarDecl(name, type);
	}

	public static IVLLocalVar local(IVLLocalVarDecl decl) {
		return new IVLLocalVar(decl.getName(), decl.getType());
	}

	public static IVLLocalVar local(String name, IVLType type) {
		return new IVLLocalVar(name, type);
	}

	public static IVLIntLit num(long value) {
		return new IVLIntLit(BigInteger.valueOf(value));
	}

	public static IVLBoolLit bool(boolean value) {
		return new IVLBoolLit(value);
	}

	public static IVLBoolLit trueLit() {
		return new IVLBoolLit(true);
	}

	public static IVLFieldAccess field(IVLExpression receiver, IVLField field) {
		return new IVLFieldAccess(receiver, field);
	}

	public static IVLFieldAccessPredicate acc(IVLFieldAccess location) {
		return new IVLFieldAccessPredicate(location, new IVLFullPerm());
	}

	public static IVLPredicateAccess predicate(String name, List<IVLExpression> arguments) {
		return new IVLPredicateAccess(name, arguments);
	}

	public static IVLPredicateAccessPredicate acc(IVLPredicateAccess location) {
		return new IVLPredicateAccessPredicate(location, new IVLFullPerm());
	}

	public static IVLPredicateAccessPredicate acc(String predicateName, List<IVLExpression> arguments) {
		return acc(predicate(predicateName, arguments));
	}

	public static IVLFuncApp app(String functionName, List<IVLExpression> arguments, IVLType type) {
		return new IVLFuncApp(functionName, arguments, type);
	}

	public static IVLBinaryOp binop(IVLBinaryOp.Operator operator, IVLExpression left, IVLExpression right) {
		return new IVLBinaryOp(operator, left, right);
	}

	public static IVLBinaryOp eq(IVLExpression left, IVLExpression right) {
		return binop(IVLBinaryOp.Operator.EQ, left, right);
	}

	public static IVLBinaryOp ne(IVLExpression left, IVLExpression right) {
		return binop(IVLBinaryOp.Operator.NE, left, right);
	}

	public static IVLBinaryOp implies(IVLExpression left, IVLExpression right) {
		return binop(IVLBinaryOp.Operator.IMPLIES, left, right);
	}

	/**
	 * Conjoins the given expressions, yielding {@code true} for none.
	 */
	public static IVLExpression and(List<? extends IVLExpression> conjuncts) {
		if (conjuncts.isEmpty()) {
			return trueLit();
		}
		IVLExpression result = conjuncts.get(0);
		for (int i = 1; i < conjuncts.size(); i++) {
			result = binop(IVLBinaryOp.Operator.AND, result, conjuncts.get(i));
		}
		return result;
	}

	public static IVLExpression and(IVLExpression... conjuncts) {
		return and(Arrays.asList(conjuncts));
	}

	/**
	 * Disjoins the given expressions, yielding {@code false} for none.
	 */
	public static IVLExpression or(List<? extends IVLExpression> disjuncts) {
		if (disjuncts.isEmpty()) {
			return bool(false);
		}
		IVLExpression result = disjuncts.get(0);
		for (int i = 1; i < disjuncts.size(); i++) {
			result = binop(IVLBinaryOp.Operator.OR, result, disjuncts.get(i));
		}
		return result;
	}

	public static IVLSetContains contains(IVLExpression element, IVLExpression set) {
		return new IVLSetContains(element, set);
	}

	public static IVLOld old(IVLExpression exp) {
		return new IVLOld(exp);
	}

	public static IVLLabelledOld old(IVLExpression exp, String label) {
		return new IVLLabelledOld(exp, label);
	}

	public static IVLCurrentPerm perm(IVLExpression resource) {
		return new IVLCurrentPerm(resource);
	}

	public static IVLForall forall(List<IVLLocalVarDecl> variables, IVLExpression body) {
		return new IVLForall(variables, body);
	}

	public static IVLSeqn seqn(IVLStatement... statements) {
		return seqn(Arrays.asList(statements));
	}

	public static IVLSeqn seqn(List<IVLStatement> statements) {
		return new IVLSeqn(Collections.unmodifiableList(new ArrayList<>(statements)));
	}

	public static IVLInhale inhale(IVLExpression exp) {
		return new IVLInhale(exp);
	}

	public static IVLExhale exhale(IVLExpression exp) {
		return new IVLExhale(exp);
	}

	public static IVLAssert assertS(IVLExpression exp) {
		return new IVLAssert(exp);
	}

	public static IVLLabel label(String name) {
		return new IVLLabel(name);
	}

	public static IVLComment comment(String text) {
		return new IVLComment(text);
	}

	public static IVLFold fold(IVLPredicateAccessPredicate acc) {
		return new IVLFold(acc);
	}

	public static IVLUnfold unfold(IVLPredicateAccessPredicate acc) {
		return new IVLUnfold(acc);
	}

	public static IVLPredicate abstractPredicate(String name, List<IVLLocalVarDecl> formalArgs) {
		return new IVLPredicate(name, formalArgs, Optional.empty());
	}

	public static IVLFunction abstractFunction(String name, List<IVLLocalVarDecl> formalArgs, IVLType type,
	                                           List<IVLExpression> pres, List<IVLExpression> posts) {
		return new IVLFunction(name, formalArgs, type, pres, posts, Optional.empty());
	}
}
