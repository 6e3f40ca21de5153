package rgv.trans.passes.codegen.ivl;

import rgv.model.ivl.IVLExpression;
import rgv.model.rg.RgRegion;

import java.util.List;
import java.util.Objects;

/**
 * A region instance whose predicate is unfolded by an enclosing use-atomic or open-region
 * block, with the label of the state before unfolding.
 */
public class OpenRegion {
	private final RgRegion region;
	private final List<IVLExpression> inArgs;
	private final String label;

	public OpenRegion(RgRegion region, List<IVLExpression> inArgs, String label) {
		this.region = region;
		this.inArgs = inArgs;
		this.label = label;
	}

	public RgRegion getRegion() {
		return region;
	}

	public List<IVLExpression> getInArgs() {
		return inArgs;
	}

	public String getLabel() {
		return label;
	}

	public boolean isInstance(RgRegion region, List<IVLExpression> inArgs) {
		return this.region == region && this.inArgs.equals(inArgs);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		OpenRegion that = (OpenRegion) o;
		return region == that.region &&
				inArgs.equals(that.inArgs) &&
				label.equals(that.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(region.getUID(), inArgs, label);
	}

	@Override
	public String toString() {
		return region.getId().getName() + inArgs + "@" + label;
	}
}
