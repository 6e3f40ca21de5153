package rgv.trans;

import rgv.errors.TopLevelIssueContext;
import rgv.model.ivl.IVLProgram;
import rgv.trans.passes.backtranslation.VerificationIssue;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of one run: all issues found, the IVL program if translation was attempted, and
 * the issues back-translated from the verifier's failures.
 */
public class TranslationResult {
	private final TopLevelIssueContext issues;
	private final IVLProgram program;
	private final List<VerificationIssue> verificationIssues;

	public TranslationResult(TopLevelIssueContext issues, IVLProgram program, List<VerificationIssue> verificationIssues) {
		this.issues = issues;
		this.program = program;
		this.verificationIssues = verificationIssues;
	}

	public TopLevelIssueContext getIssues() {
		return issues;
	}

	public Optional<IVLProgram> getProgram() {
		return Optional.ofNullable(program);
	}

	public List<VerificationIssue> getVerificationIssues() {
		return verificationIssues;
	}

	public boolean isVerified() {
		return program != null && !issues.hasErrors();
	}
}
