package rgv.model.rg;

import rgv.util.SourceLocation;

import java.util.List;
import java.util.stream.Collectors;

public class RgProgram extends RgNode {
	private final List<RgMember> members;

	public RgProgram(SourceLocation location, List<RgMember> members) {
		super(location);
		this.members = members;
	}

	public List<RgMember> getMembers() {
		return members;
	}

	public List<RgStruct> getStructs() {
		return membersOf(RgStruct.class);
	}

	public List<RgRegion> getRegions() {
		return membersOf(RgRegion.class);
	}

	public List<RgPredicate> getPredicates() {
		return membersOf(RgPredicate.class);
	}

	public List<RgProcedure> getProcedures() {
		return membersOf(RgProcedure.class);
	}

	private <M extends RgMember> List<M> membersOf(Class<M> kind) {
		return members.stream().filter(kind::isInstance).map(kind::cast).collect(Collectors.toList());
	}

	@Override
	public List<RgNode> getChildren() {
		return children(members);
	}
}
