package rgv.trans.passes.codegen.ivl;

import org.junit.Before;
import org.junit.Test;
import rgv.InternalCompilerError;
import rgv.RGVOptions;
import rgv.RgExamples;
import rgv.model.ivl.IVLExpression;
import rgv.model.ivl.IVLStatement;
import rgv.model.rg.RgProgram;
import rgv.model.rg.RgRegion;
import rgv.model.rg.RgTree;
import rgv.trans.passes.backtranslation.ErrorBacktranslator;
import rgv.trans.passes.scope.ScopingPass;
import rgv.trans.passes.type.TypeAnalysis;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;
import static rgv.model.ivl.IVLBuilder.*;

public class TranslationContextTest {

	private RGVOptions options;
	private TranslationContext ctx;
	private RgRegion cell;
	private List<IVLExpression> in;

	@Before
	public void setup() {
		options = new RGVOptions();
		RgProgram program = RgExamples.incrementingCell();
		cell = program.getRegions().get(0);
		TypeAnalysis types = new TypeAnalysis(ScopingPass.perform(new RgTree(program)));
		ctx = new TranslationContext(options, types, new ErrorBacktranslator(options));
		in = Arrays.<IVLExpression>asList(local("r", refType()), local("x", refType()));
	}

	@Test
	public void labelCountersArePerPrefix() {
		assertEquals("pre_havoc_0", ctx.freshLabel("pre_havoc"));
		assertEquals("pre_havoc_1", ctx.freshLabel("pre_havoc"));
		assertEquals("pre_use_atomic_0", ctx.freshLabel("pre_use_atomic"));
		assertEquals("pre_havoc_2", ctx.freshLabel("pre_havoc"));
	}

	@Test
	public void openRegionsNest() {
		OpenRegion outer = new OpenRegion(cell, in, "pre_use_atomic_0");
		OpenRegion inner = new OpenRegion(cell, in, "pre_open_region_0");
		ctx.pushOpenRegion(outer);
		ctx.pushOpenRegion(inner);
		assertEquals(2, ctx.openRegionDepth());
		// the innermost opening wins
		assertEquals("pre_open_region_0", ctx.findOpenRegion(cell, in).get().getLabel());
		assertFalse(ctx.findOpenRegion(cell, Arrays.<IVLExpression>asList(local("s", refType()), local("x", refType()))).isPresent());

		ctx.popOpenRegion(inner);
		ctx.popOpenRegion(outer);
		assertEquals(0, ctx.openRegionDepth());
	}

	@Test(expected = InternalCompilerError.class)
	public void closingTheWrongRegion() {
		ctx.pushOpenRegion(new OpenRegion(cell, in, "pre_use_atomic_0"));
		ctx.popOpenRegion(new OpenRegion(cell, in, "pre_use_atomic_1"));
	}

	@Test(expected = InternalCompilerError.class)
	public void closingWithNothingOpen() {
		ctx.popOpenRegion(new OpenRegion(cell, in, "pre_open_region_0"));
	}

	@Test
	public void sections() {
		List<IVLStatement> body = Collections.<IVLStatement>singletonList(inhale(trueLit()));
		assertEquals(Arrays.asList(comment("BEGIN stabilise Cell"), inhale(trueLit()), comment("END stabilise Cell")),
				ctx.section("stabilise Cell", body));

		options.sectionComments = false;
		assertEquals(body, ctx.section("stabilise Cell", body));
	}
}
