package rgv.errors;

import rgv.trans.passes.backtranslation.*;
import rgv.trans.passes.backtranslation.AssertionError;
import rgv.trans.passes.validation.*;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(MultipleDeclarationIssue multipleDeclarationIssue) throws E;
	public abstract T visit(DanglingReferenceIssue danglingReferenceIssue) throws E;
	public abstract T visit(NoMatchingFieldIssue noMatchingFieldIssue) throws E;
	public abstract T visit(InvalidReceiverIssue invalidReceiverIssue) throws E;
	public abstract T visit(UntypableExpressionIssue untypableExpressionIssue) throws E;
	public abstract T visit(TypeMismatchIssue typeMismatchIssue) throws E;
	public abstract T visit(ArgumentCountMismatchIssue argumentCountMismatchIssue) throws E;
	public abstract T visit(InvalidAssignmentTargetIssue invalidAssignmentTargetIssue) throws E;
	public abstract T visit(InvalidReferenceIssue invalidReferenceIssue) throws E;
	public abstract T visit(AtomicityMismatchIssue atomicityMismatchIssue) throws E;
	public abstract T visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws E;
	public abstract T visit(UnresolvedRegionIssue unresolvedRegionIssue) throws E;
	public abstract T visit(AssignmentError assignmentError) throws E;
	public abstract T visit(PostconditionError postconditionError) throws E;
	public abstract T visit(PreconditionError preconditionError) throws E;
	public abstract T visit(AssertionError assertionError) throws E;
	public abstract T visit(MakeAtomicError makeAtomicError) throws E;
	public abstract T visit(UpdateRegionError updateRegionError) throws E;
	public abstract T visit(UseAtomicError useAtomicError) throws E;
	public abstract T visit(OpenRegionError openRegionError) throws E;
}
