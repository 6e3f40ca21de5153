package rgv.trans;

import rgv.RGVOptions;
import rgv.errors.TopLevelIssueContext;
import rgv.model.ivl.IVLProgram;
import rgv.model.rg.RgProgram;
import rgv.model.rg.RgTree;
import rgv.trans.passes.atomicity.AtomicityAnalysis;
import rgv.trans.passes.backtranslation.ErrorBacktranslator;
import rgv.trans.passes.backtranslation.VerificationIssue;
import rgv.trans.passes.codegen.ivl.ProgramTranslator;
import rgv.trans.passes.codegen.ivl.TranslationContext;
import rgv.trans.passes.scope.NameAnalysis;
import rgv.trans.passes.scope.ScopingPass;
import rgv.trans.passes.type.TypeAnalysis;
import rgv.trans.passes.validation.SemanticCheckingPass;
import rgv.verifier.VerificationFailure;
import rgv.verifier.Verifier;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs a program through checking, translation, verification and back-translation.
 *
 * Translation is only attempted for a program without declaration, type or atomicity issues.
 * Each run uses a fresh translation context and error backtranslator.
 */
public class RGVTranslator {
	private static final Logger logger = Logger.getLogger("RGV.Translator");

	private final RGVOptions options;
	private final Verifier verifier;

	public RGVTranslator(RGVOptions options, Verifier verifier) {
		this.options = options;
		this.verifier = verifier;
	}

	public TranslationResult run(RgProgram program) {
		options.applyLogLevel();
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		logger.info("Resolving names");
		NameAnalysis names = ScopingPass.perform(new RgTree(program));
		TypeAnalysis types = new TypeAnalysis(names);
		AtomicityAnalysis atomicity = new AtomicityAnalysis(names);

		logger.info("Checking semantics");
		SemanticCheckingPass.perform(ctx, names, types, atomicity);
		if (ctx.hasErrors()) {
			logger.warning("Not translating: " + ctx.getIssues().size() + " issue(s) detected");
			return new TranslationResult(ctx, null, Collections.emptyList());
		}

		logger.info("Translating to IVL");
		ErrorBacktranslator backtranslator = new ErrorBacktranslator(options);
		IVLProgram ivl = ProgramTranslator.perform(new TranslationContext(options, types, backtranslator));

		logger.info("Verifying");
		List<VerificationFailure> failures = verifier.verify(ivl);

		logger.info("Back-translating " + failures.size() + " verification failure(s)");
		List<VerificationIssue> verificationIssues = backtranslator.translate(failures);
		for (VerificationIssue issue : verificationIssues) {
			ctx.error(issue);
		}
		return new TranslationResult(ctx, ivl, verificationIssues);
	}
}
