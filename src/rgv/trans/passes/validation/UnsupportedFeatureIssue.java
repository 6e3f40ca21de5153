package rgv.trans.passes.validation;

import rgv.errors.Issue;
import rgv.errors.IssueVisitor;
import rgv.model.rg.RgNode;

public class UnsupportedFeatureIssue extends Issue {
	private final RgNode node;
	private final String feature;

	public UnsupportedFeatureIssue(RgNode node, String feature) {
		this.node = node;
		this.feature = feature;
	}

	public RgNode getNode() {
		return node;
	}

	public String getFeature() {
		return feature;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
