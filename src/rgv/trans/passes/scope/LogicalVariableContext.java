package rgv.trans.passes.scope;

/**
 * The kind of specification or code a logical variable is bound or used in.
 */
public enum LogicalVariableContext {
	INTERFERENCE,
	PRECONDITION,
	POSTCONDITION,
	INVARIANT,
	PROCEDURE,
	REGION,
	PREDICATE,
}
