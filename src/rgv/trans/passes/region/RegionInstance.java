package rgv.trans.passes.region;

import rgv.model.rg.RgExpression;
import rgv.model.rg.RgIdnExp;
import rgv.model.rg.RgIdnUse;
import rgv.model.rg.RgPredicateExp;
import rgv.model.rg.RgRegion;

import java.util.List;
import java.util.Optional;

/**
 * A region predicate use split into its parts: the region id and formal arguments (the
 * in-arguments) and the optional trailing out-argument naming the region state.
 */
public class RegionInstance {
	private final RgPredicateExp predicate;
	private final RgRegion region;
	private final List<RgExpression> inArgs;
	private final RgExpression outArg;

	public RegionInstance(RgPredicateExp predicate, RgRegion region, List<RgExpression> inArgs, RgExpression outArg) {
		this.predicate = predicate;
		this.region = region;
		this.inArgs = inArgs;
		this.outArg = outArg;
	}

	public RgPredicateExp getPredicate() {
		return predicate;
	}

	public RgRegion getRegion() {
		return region;
	}

	public List<RgExpression> getInArgs() {
		return inArgs;
	}

	public Optional<RgExpression> getOutArg() {
		return Optional.ofNullable(outArg);
	}

	/**
	 * @return the region id variable, when the id argument is a plain variable
	 */
	public Optional<RgIdnUse> getRegionId() {
		RgExpression id = inArgs.get(0);
		if (id instanceof RgIdnExp) {
			return Optional.of(((RgIdnExp) id).getId());
		}
		return Optional.empty();
	}
}
