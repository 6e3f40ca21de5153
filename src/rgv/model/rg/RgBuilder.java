package rgv.model.rg;

import rgv.model.type.RegionIdType;
import rgv.model.type.Type;
import rgv.util.SourceLocation;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Shorthand constructors for program trees without source positions, as used by tests and
 * by callers that synthesise programs.
 */
public class RgBuilder {
	private RgBuilder() {}

	private static SourceLocation at() {
		return SourceLocation.unknown();
	}

	public static RgIdnDef def(String name) {
		return new RgIdnDef(at(), name);
	}

	public static RgIdnUse use(String name) {
		return new RgIdnUse(at(), name);
	}

	// members

	public static RgProgram program(RgMember... members) {
		return new RgProgram(at(), Arrays.asList(members));
	}

	public static RgStruct struct(String name, RgFieldDecl... fields) {
		return new RgStruct(at(), def(name), Arrays.asList(fields));
	}

	public static RgFieldDecl field(String name, Type type) {
		return new RgFieldDecl(at(), def(name), type);
	}

	public static RgPredicate predicate(String name, List<RgFormalArgumentDecl> formalArgs, RgExpression body) {
		return new RgPredicate(at(), def(name), formalArgs, body);
	}

	public static RgRegion region(String name, String regionId, List<RgFormalArgumentDecl> formalArgs,
	                              List<RgGuardDecl> guards, RgExpression interpretation, RgExpression state,
	                              List<RgAction> actions) {
		return new RgRegion(at(), def(name), arg(regionId, new RegionIdType()), formalArgs,
				guards, interpretation, state, actions);
	}

	public static RgFormalArgumentDecl arg(String name, Type type) {
		return new RgFormalArgumentDecl(at(), def(name), type);
	}

	public static RgLocalVariableDecl local(String name, Type type) {
		return new RgLocalVariableDecl(at(), def(name), type);
	}

	public static RgGuardDecl uniqueGuard(String name) {
		return new RgGuardDecl(at(), def(name), RgGuardDecl.Modifier.UNIQUE);
	}

	public static RgGuardDecl duplicableGuard(String name) {
		return new RgGuardDecl(at(), def(name), RgGuardDecl.Modifier.DUPLICABLE);
	}

	public static RgAction action(String guard, String from, RgExpression to) {
		return new RgAction(at(), use(guard), binder(from), to);
	}

	public static RgInterferenceClause interference(String binder, RgExpression set, String regionId) {
		return new RgInterferenceClause(at(), binder(binder), set, use(regionId));
	}

	public static RgPreconditionClause requires(RgExpression assertion) {
		return new RgPreconditionClause(at(), assertion);
	}

	public static RgPostconditionClause ensures(RgExpression assertion) {
		return new RgPostconditionClause(at(), assertion);
	}

	public static RgInvariantClause invariant(RgExpression assertion) {
		return new RgInvariantClause(at(), assertion);
	}

	// statements

	public static RgBlock block(RgStatement... statements) {
		return new RgBlock(at(), Arrays.asList(statements));
	}

	public static RgSkip skip() {
		return new RgSkip(at());
	}

	public static RgIf ifS(RgExpression condition, RgStatement thn, RgStatement els) {
		return new RgIf(at(), condition, thn, els);
	}

	public static RgWhile whileS(RgExpression condition, List<RgInvariantClause> invariants, RgStatement body) {
		return new RgWhile(at(), condition, invariants, body);
	}

	public static RgAssign assign(String lhs, RgExpression rhs) {
		return new RgAssign(at(), use(lhs), rhs);
	}

	public static RgLocation location(String receiver, String field) {
		return new RgLocation(at(), use(receiver), use(field));
	}

	public static RgHeapRead heapRead(String lhs, String receiver, String field) {
		return new RgHeapRead(at(), use(lhs), location(receiver, field));
	}

	public static RgHeapWrite heapWrite(String receiver, String field, RgExpression rhs) {
		return new RgHeapWrite(at(), location(receiver, field), rhs);
	}

	public static RgProcedureCall call(String procedure, RgExpression... arguments) {
		return new RgProcedureCall(at(), use(procedure), Arrays.asList(arguments), null);
	}

	public static RgProcedureCall callInto(String result, String procedure, RgExpression... arguments) {
		return new RgProcedureCall(at(), use(procedure), Arrays.asList(arguments), use(result));
	}

	public static RgFold fold(RgPredicateExp predicate) {
		return new RgFold(at(), predicate);
	}

	public static RgUnfold unfold(RgPredicateExp predicate) {
		return new RgUnfold(at(), predicate);
	}

	public static RgInhale inhale(RgExpression assertion) {
		return new RgInhale(at(), assertion);
	}

	public static RgExhale exhale(RgExpression assertion) {
		return new RgExhale(at(), assertion);
	}

	public static RgAssume assume(RgExpression assertion) {
		return new RgAssume(at(), assertion);
	}

	public static RgAssert assertS(RgExpression assertion) {
		return new RgAssert(at(), assertion);
	}

	public static RgMakeAtomic makeAtomic(RgGuardExp guard, RgPredicateExp regionPredicate, RgStatement body) {
		return new RgMakeAtomic(at(), guard, regionPredicate, body);
	}

	public static RgUpdateRegion updateRegion(RgPredicateExp regionPredicate, RgStatement body) {
		return new RgUpdateRegion(at(), regionPredicate, body);
	}

	public static RgUseAtomic useAtomic(RgGuardExp guard, RgPredicateExp regionPredicate, RgStatement body) {
		return new RgUseAtomic(at(), guard, regionPredicate, body);
	}

	public static RgOpenRegion openRegion(RgPredicateExp regionPredicate, RgStatement body) {
		return new RgOpenRegion(at(), regionPredicate, body);
	}

	// expressions

	public static RgIntLit num(long value) {
		return new RgIntLit(at(), BigInteger.valueOf(value));
	}

	public static RgBoolLit bool(boolean value) {
		return new RgBoolLit(at(), value);
	}

	public static RgNullLit nullLit() {
		return new RgNullLit(at());
	}

	public static RgRet ret() {
		return new RgRet(at());
	}

	public static RgIdnExp idexp(String name) {
		return new RgIdnExp(at(), use(name));
	}

	public static RgBinOp binop(RgBinOp.Operator operator, RgExpression left, RgExpression right) {
		return new RgBinOp(at(), operator, left, right);
	}

	public static RgBinOp eq(RgExpression left, RgExpression right) {
		return binop(RgBinOp.Operator.EQUALS, left, right);
	}

	public static RgBinOp plus(RgExpression left, RgExpression right) {
		return binop(RgBinOp.Operator.ADD, left, right);
	}

	public static RgBinOp and(RgExpression left, RgExpression right) {
		return binop(RgBinOp.Operator.AND, left, right);
	}

	public static RgNot not(RgExpression operand) {
		return new RgNot(at(), operand);
	}

	public static RgConditional conditional(RgExpression condition, RgExpression thn, RgExpression els) {
		return new RgConditional(at(), condition, thn, els);
	}

	public static RgNumberSet intSet() {
		return new RgNumberSet(at(), RgNumberSet.Kind.INT);
	}

	public static RgNumberSet natSet() {
		return new RgNumberSet(at(), RgNumberSet.Kind.NAT);
	}

	public static RgExplicitSet set(RgExpression... elements) {
		return new RgExplicitSet(at(), Arrays.asList(elements), null);
	}

	public static RgExplicitSet typedSet(Type elementType, RgExpression... elements) {
		return new RgExplicitSet(at(), Arrays.asList(elements), elementType);
	}

	public static RgExplicitSeq seq(RgExpression... elements) {
		return new RgExplicitSeq(at(), Arrays.asList(elements), null);
	}

	public static RgSetComprehension comprehension(String binder, RgExpression filter) {
		return new RgSetComprehension(at(), binder(binder), filter, null);
	}

	public static RgSetComprehension typedComprehension(String binder, Type type, RgExpression filter) {
		return new RgSetComprehension(at(), binder(binder), filter, type);
	}

	public static RgSetContains contains(RgExpression element, RgExpression set) {
		return new RgSetContains(at(), element, set);
	}

	public static RgSeqSize seqSize(RgExpression seq) {
		return new RgSeqSize(at(), seq);
	}

	public static RgSeqHead seqHead(RgExpression seq) {
		return new RgSeqHead(at(), seq);
	}

	public static RgSeqTail seqTail(RgExpression seq) {
		return new RgSeqTail(at(), seq);
	}

	public static RgUnfolding unfolding(RgPredicateExp predicate, RgExpression body) {
		return new RgUnfolding(at(), predicate, body);
	}

	public static RgPointsTo pointsTo(String receiver, String field, RgExpression value) {
		return new RgPointsTo(at(), location(receiver, field), value);
	}

	public static RgPredicateExp pred(String name, RgExpression... arguments) {
		return new RgPredicateExp(at(), use(name), Arrays.asList(arguments));
	}

	public static RgGuardExp guard(String guard, String regionId) {
		return new RgGuardExp(at(), use(guard), use(regionId));
	}

	public static RgDiamond diamond(String regionId) {
		return new RgDiamond(at(), use(regionId));
	}

	public static RgRegionUpdateWitness witness(String regionId, RgExpression from, RgExpression to) {
		return new RgRegionUpdateWitness(at(), use(regionId), from, to);
	}

	public static RgLogicalVariableBinder binder(String name) {
		return new RgLogicalVariableBinder(at(), def(name));
	}
}
