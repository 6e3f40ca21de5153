package rgv.formatters;

import rgv.errors.IssueVisitor;
import rgv.model.rg.RgNode;
import rgv.trans.passes.backtranslation.*;
import rgv.trans.passes.backtranslation.AssertionError;
import rgv.trans.passes.validation.*;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeLocation(RgNode node) throws IOException {
		out.write(" (");
		out.write(node.getLocation().prettyString());
		out.write(")");
	}

	@Override
	public Void visit(MultipleDeclarationIssue multipleDeclarationIssue) throws IOException {
		out.write(multipleDeclarationIssue.getDeclaration().getName());
		out.write(" is declared more than once");
		writeLocation(multipleDeclarationIssue.getDeclaration());
		return null;
	}

	@Override
	public Void visit(DanglingReferenceIssue danglingReferenceIssue) throws IOException {
		out.write(danglingReferenceIssue.getUse().getName());
		out.write(" is not declared");
		writeLocation(danglingReferenceIssue.getUse());
		return null;
	}

	@Override
	public Void visit(NoMatchingFieldIssue noMatchingFieldIssue) throws IOException {
		out.write("struct ");
		out.write(noMatchingFieldIssue.getStruct().getId().getName());
		out.write(" does not have a field ");
		out.write(noMatchingFieldIssue.getField().getName());
		writeLocation(noMatchingFieldIssue.getField());
		return null;
	}

	@Override
	public Void visit(InvalidReceiverIssue invalidReceiverIssue) throws IOException {
		out.write("receiver ");
		out.write(invalidReceiverIssue.getReceiver().getName());
		switch (invalidReceiverIssue.getReason()) {
			case NOT_A_REFERENCE:
				out.write(" is not of reference type, but of type ");
				out.write(invalidReceiverIssue.getReceiverType().toString());
				break;
			case NOT_A_STRUCT:
				out.write(" is not of struct type");
				break;
		}
		writeLocation(invalidReceiverIssue.getReceiver());
		return null;
	}

	@Override
	public Void visit(UntypableExpressionIssue untypableExpressionIssue) throws IOException {
		out.write(untypableExpressionIssue.getExpression().toString());
		out.write(" could not be typed");
		writeLocation(untypableExpressionIssue.getExpression());
		return null;
	}

	@Override
	public Void visit(TypeMismatchIssue typeMismatchIssue) throws IOException {
		out.write("Type error: expected ");
		out.write(typeMismatchIssue.getExpected().toString());
		out.write(" but got ");
		out.write(typeMismatchIssue.getActual().toString());
		writeLocation(typeMismatchIssue.getNode());
		return null;
	}

	@Override
	public Void visit(ArgumentCountMismatchIssue argumentCountMismatchIssue) throws IOException {
		out.write("Wrong number of arguments for '");
		out.write(argumentCountMismatchIssue.getCallee());
		out.write("', got ");
		out.write(Integer.toString(argumentCountMismatchIssue.getActual()));
		out.write(" but expected ");
		out.write(Integer.toString(argumentCountMismatchIssue.getExpected()));
		if (argumentCountMismatchIssue.isOutArgumentAllowed()) {
			out.write(" or ");
			out.write(Integer.toString(argumentCountMismatchIssue.getExpected() + 1));
		}
		writeLocation(argumentCountMismatchIssue.getNode());
		return null;
	}

	@Override
	public Void visit(InvalidAssignmentTargetIssue invalidAssignmentTargetIssue) throws IOException {
		out.write("Cannot assign to ");
		out.write(invalidAssignmentTargetIssue.getTarget().getName());
		writeLocation(invalidAssignmentTargetIssue.getTarget());
		return null;
	}

	@Override
	public Void visit(InvalidReferenceIssue invalidReferenceIssue) throws IOException {
		switch (invalidReferenceIssue.getReason()) {
			case NOT_CALLABLE:
				out.write("Cannot call ");
				out.write(invalidReferenceIssue.getUse().getName());
				break;
			case PROCEDURE_AS_VALUE:
				out.write("Cannot refer to procedures directly");
				break;
			case NOT_INSTANTIABLE_HERE:
				out.write("Cannot call ");
				out.write(invalidReferenceIssue.getUse().getName());
				out.write(" here");
				break;
		}
		writeLocation(invalidReferenceIssue.getUse());
		return null;
	}

	@Override
	public Void visit(AtomicityMismatchIssue atomicityMismatchIssue) throws IOException {
		out.write("Atomicity error: expected ");
		out.write(atomicityMismatchIssue.getExpected().toString().toLowerCase());
		out.write(" statement but got ");
		out.write(atomicityMismatchIssue.getActual().toString().toLowerCase());
		out.write(" one");
		writeLocation(atomicityMismatchIssue.getStatement());
		return null;
	}

	@Override
	public Void visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws IOException {
		out.write("feature not supported: ");
		out.write(unsupportedFeatureIssue.getFeature());
		writeLocation(unsupportedFeatureIssue.getNode());
		return null;
	}

	@Override
	public Void visit(UnresolvedRegionIssue unresolvedRegionIssue) throws IOException {
		out.write("could not find a region that ");
		out.write(unresolvedRegionIssue.getRegionId().getName());
		out.write(" is the id of");
		writeLocation(unresolvedRegionIssue.getRegionId());
		return null;
	}

	private Void writeVerificationIssue(VerificationIssue issue) throws IOException {
		out.write(issue.getDescription());
		writeLocation(issue.getNode());
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (ErrorClarification clarification : issue.getClarifications()) {
				out.newLine();
				out.write(clarification.getMessage());
				if (clarification.getNode() != issue.getNode()) {
					writeLocation(clarification.getNode());
				}
			}
		}
		return null;
	}

	@Override
	public Void visit(AssignmentError assignmentError) throws IOException {
		return writeVerificationIssue(assignmentError);
	}

	@Override
	public Void visit(PostconditionError postconditionError) throws IOException {
		return writeVerificationIssue(postconditionError);
	}

	@Override
	public Void visit(PreconditionError preconditionError) throws IOException {
		return writeVerificationIssue(preconditionError);
	}

	@Override
	public Void visit(AssertionError assertionError) throws IOException {
		return writeVerificationIssue(assertionError);
	}

	@Override
	public Void visit(MakeAtomicError makeAtomicError) throws IOException {
		return writeVerificationIssue(makeAtomicError);
	}

	@Override
	public Void visit(UpdateRegionError updateRegionError) throws IOException {
		return writeVerificationIssue(updateRegionError);
	}

	@Override
	public Void visit(UseAtomicError useAtomicError) throws IOException {
		return writeVerificationIssue(useAtomicError);
	}

	@Override
	public Void visit(OpenRegionError openRegionError) throws IOException {
		return writeVerificationIssue(openRegionError);
	}
}
