package rgv.trans.passes.scope;

import rgv.model.rg.RgPredicateExp;
import rgv.model.rg.RgRegion;

import java.util.Optional;

/**
 * The region a region id variable was found to be used with, together with the region
 * predicate instance that established it. Inside a region declaration the id is the region's
 * own id argument and there is no such instance.
 */
public class RegionUse {
	private final RgRegion region;
	private final RgPredicateExp predicate;

	public RegionUse(RgRegion region, RgPredicateExp predicate) {
		this.region = region;
		this.predicate = predicate;
	}

	public RgRegion getRegion() {
		return region;
	}

	public Optional<RgPredicateExp> getPredicate() {
		return Optional.ofNullable(predicate);
	}
}
