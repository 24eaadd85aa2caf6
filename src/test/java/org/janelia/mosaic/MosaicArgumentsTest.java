package org.janelia.mosaic;

import org.janelia.mosaic.gap.GapFillMethod;
import org.janelia.mosaic.photometric.ColorMatchMode;
import org.janelia.mosaic.photometric.ReferenceMode;
import org.junit.Assert;
import org.junit.Test;

public class MosaicArgumentsTest
{
	@Test
	public void testOverrides()
	{
		final MosaicArguments args = new MosaicArguments( new String[] {
				"-i", "tiles.json",
				"--overlap-max", "8",
				"--color-match", "strong",
				"--reference", "neighbor",
				"--gap-fill", "inpaint",
				"--no-seam-fill",
				"--refine-rotation-scale",
				"--threads", "3" } );

		Assert.assertTrue( args.parsedSuccessfully() );
		Assert.assertEquals( "tiles.json", args.inputTileConfiguration() );
		Assert.assertNull( args.outputFolder() );
		Assert.assertFalse( args.refineOnly() );

		final MosaicParameters params = args.applyTo( new MosaicParameters() );
		Assert.assertEquals( 8, params.getOverlapMax() );
		Assert.assertEquals( ColorMatchMode.STRONG, params.getColorMatch() );
		Assert.assertEquals( ReferenceMode.NEIGHBOR, params.getReference() );
		Assert.assertEquals( GapFillMethod.INPAINT, params.getGapFill() );
		Assert.assertFalse( params.isSeamFillEnabled() );
		Assert.assertTrue( params.isRefineRotationScale() );
		Assert.assertEquals( 3, params.getNumThreads() );

		// untouched values keep their defaults
		Assert.assertEquals( new MosaicParameters().getSeamBandPx(), params.getSeamBandPx() );
	}

	@Test
	public void testMissingInput()
	{
		Assert.assertFalse( new MosaicArguments( new String[] { "--refine-only" } ).parsedSuccessfully() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testExclusiveModes()
	{
		new MosaicArguments( new String[] { "-i", "tiles.json", "--refine-only", "--blend-only" } );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidColorMatch()
	{
		new MosaicArguments( new String[] { "-i", "tiles.json", "--color-match", "extreme" } );
	}
}
