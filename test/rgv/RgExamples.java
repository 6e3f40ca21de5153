package rgv;

import rgv.model.rg.*;
import rgv.model.type.IntType;
import rgv.model.type.RefType;
import rgv.model.type.RegionIdType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static rgv.model.rg.RgBuilder.*;

/**
 * Small programs shared between tests.
 *
 * <pre>
 * struct Box { val: Int }
 *
 * region Cell(r, x: Box) {
 *   guards { unique incr }
 *   interpretation { x.val |-&gt; ?v }
 *   state { v }
 *   actions { incr: ?n ~&gt; Set(n + 1) }
 * }
 * </pre>
 */
public final class RgExamples {

	private RgExamples() {}

	public static RgStruct box() {
		return struct("Box", field("val", new IntType()));
	}

	public static RgRegion cell() {
		return region("Cell", "r",
				Collections.singletonList(arg("x", new RefType("Box"))),
				Collections.singletonList(uniqueGuard("incr")),
				pointsTo("x", "val", binder("v")),
				idexp("v"),
				Collections.singletonList(action("incr", "n", set(plus(idexp("n"), num(1))))));
	}

	public static RgPredicateExp cellInstance() {
		return pred("Cell", idexp("r"), idexp("x"));
	}

	/**
	 * An abstract-atomic procedure over a held Cell instance whose atomicity context is
	 * {@code Set(0)}, running body.
	 */
	public static RgProcedure cellProcedure(String name, RgStatement... body) {
		return new RgProcedureBuilder(name)
				.addArgument("r", new RegionIdType())
				.addArgument("x", new RefType("Box"))
				.setAtomicity(RgProcedure.Atomicity.ABSTRACT_ATOMIC)
				.addInterference("c", set(num(0)), "r")
				.addPrecondition(and(cellInstance(), guard("incr", "r")))
				.build(body);
	}

	/**
	 * <pre>
	 * abstract_atomic procedure incr(r: Id, x: Box)
	 *   interference c in Set(0) on r
	 *   requires Cell(r, x) &amp;&amp; incr@r
	 * {
	 *   make_atomic using incr@r in Cell(r, x) {
	 *     update_region Cell(r, x) { x.val := 1 }
	 *   }
	 * }
	 * </pre>
	 */
	public static RgProgram incrementingCell() {
		return program(
				box(),
				cell(),
				cellProcedure("incr",
						makeAtomic(guard("incr", "r"), cellInstance(),
								block(updateRegion(cellInstance(), block(heapWrite("x", "val", num(1))))))));
	}

	/**
	 * The Cell region and one procedure whose body is given.
	 */
	public static RgProgram cellWith(RgStatement... body) {
		return program(box(), cell(), cellProcedure("p", body));
	}

	/**
	 * Box, Cell and the extra members.
	 */
	public static RgProgram withMembers(RgMember... extra) {
		List<RgMember> members = new ArrayList<>(Arrays.asList(box(), cell()));
		members.addAll(Arrays.asList(extra));
		return program(members.toArray(new RgMember[0]));
	}
}
