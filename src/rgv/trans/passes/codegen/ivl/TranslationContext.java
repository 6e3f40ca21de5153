package rgv.trans.passes.codegen.ivl;

import rgv.InternalCompilerError;
import rgv.RGVOptions;
import rgv.model.ivl.IVLBuilder;
import rgv.model.ivl.IVLExpression;
import rgv.model.ivl.IVLStatement;
import rgv.model.rg.RgLogicalVariableBinder;
import rgv.model.rg.RgRegion;
import rgv.scope.UID;
import rgv.trans.passes.backtranslation.ErrorBacktranslator;
import rgv.trans.passes.region.RegionModel;
import rgv.trans.passes.scope.NameAnalysis;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The mutable state of one translation run: fresh label counters, the stack of currently open
 * regions, logical variable substitutions and the error backtranslator that proof rules
 * register their transformers with. A context must not be reused across runs.
 */
public class TranslationContext {
	private final RGVOptions options;
	private final NameAnalysis names;
	private final TypeAnalysis types;
	private final RegionModel regions;
	private final ErrorBacktranslator backtranslator;

	private final Map<String, Integer> labelCounters;
	private final Deque<OpenRegion> openRegions;
	private final Map<UID, IVLExpression> substitutions;

	public TranslationContext(RGVOptions options, TypeAnalysis types, ErrorBacktranslator backtranslator) {
		this.options = options;
		this.names = types.getNames();
		this.types = types;
		this.regions = new RegionModel(types);
		this.backtranslator = backtranslator;
		this.labelCounters = new HashMap<>();
		this.openRegions = new ArrayDeque<>();
		this.substitutions = new HashMap<>();
	}

	public RGVOptions getOptions() {
		return options;
	}

	public NameAnalysis getNames() {
		return names;
	}

	public TypeAnalysis getTypes() {
		return types;
	}

	public RegionModel getRegions() {
		return regions;
	}

	public ErrorBacktranslator getBacktranslator() {
		return backtranslator;
	}

	/**
	 * @return prefix followed by the next number of that prefix's counter, starting at 0
	 */
	public String freshLabel(String prefix) {
		int n = labelCounters.getOrDefault(prefix, 0);
		labelCounters.put(prefix, n + 1);
		return prefix + "_" + n;
	}

	public void pushOpenRegion(OpenRegion region) {
		openRegions.push(region);
	}

	/**
	 * Pops the innermost open region, which must be the expected one.
	 */
	public void popOpenRegion(OpenRegion expected) {
		if (openRegions.isEmpty()) {
			throw new InternalCompilerError("no open region to close, expected " + expected);
		}
		OpenRegion actual = openRegions.pop();
		if (!actual.equals(expected)) {
			throw new InternalCompilerError("closing region " + expected + " but " + actual + " is innermost");
		}
	}

	public int openRegionDepth() {
		return openRegions.size();
	}

	/**
	 * @return the innermost open region that is this instance
	 */
	public Optional<OpenRegion> findOpenRegion(RgRegion region, List<IVLExpression> inArgs) {
		for (OpenRegion open : openRegions) {
			if (open.isInstance(region, inArgs)) {
				return Optional.of(open);
			}
		}
		return Optional.empty();
	}

	public void substitute(RgLogicalVariableBinder binder, IVLExpression replacement) {
		substitutions.put(binder.getUID(), replacement);
	}

	public void clearSubstitution(RgLogicalVariableBinder binder) {
		substitutions.remove(binder.getUID());
	}

	public Optional<IVLExpression> substitution(RgLogicalVariableBinder binder) {
		return Optional.ofNullable(substitutions.get(binder.getUID()));
	}

	/**
	 * Wraps statements in BEGIN/END comments when section comments are enabled.
	 */
	public List<IVLStatement> section(String name, List<IVLStatement> statements) {
		if (!options.sectionComments) {
			return statements;
		}
		List<IVLStatement> result = new ArrayList<>();
		result.add(IVLBuilder.comment("BEGIN " + name));
		result.addAll(statements);
		result.add(IVLBuilder.comment("END " + name));
		return result;
	}
}
