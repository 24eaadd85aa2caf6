package org.janelia.mosaic.manual;

import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.ImageType;
import org.janelia.mosaic.MosaicEngine;
import org.janelia.mosaic.MosaicJob;
import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.MosaicResult;
import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TestTiles;
import org.janelia.mosaic.TileRecord;
import org.janelia.mosaic.fusion.Canvas;
import org.janelia.mosaic.photometric.ColorMatchMode;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import net.imglib2.Interval;

public class ManualAdjustmentServiceTest
{
	private MosaicParameters params;
	private MosaicEngine engine;
	private MosaicResult result;
	private ManualAdjustmentService service;

	@Before
	public void setUp() throws Exception
	{
		params = TestTiles.createParameters();
		params.setColorMatch( ColorMatchMode.OFF );
		params.setNumBands( 3 );

		// aligned pair, nothing to refine
		final List< TileRecord > tiles = Arrays.asList(
				TestTiles.createTile( 0, 0, 0, 100, 100, 0, 0, ImageType.GRAY8, TestTiles.TEXTURE ),
				TestTiles.createTile( 1, 90, 0, 100, 100, 0, 0, ImageType.GRAY8, TestTiles.TEXTURE ) );

		engine = new MosaicEngine( params );
		result = engine.run( new MosaicJob( tiles, params ) );
		service = engine.createManualAdjustmentService( result );
	}

	@After
	public void tearDown()
	{
		engine.close();
	}

	private static double[] getValues( final Canvas canvas, final long x, final long y )
	{
		final double[] values = new double[ canvas.getNumChannels() ];
		canvas.getValue( x, y, values );
		return values;
	}

	@Test
	public void testAdjustmentMovesTile() throws Exception
	{
		Assert.assertEquals( Placement.IDENTITY, result.getPlacement( "tile-1" ) );
		final double[] farBefore = getValues( result.getCanvas(), 10, 50 );

		result.getRegistry().setManualAdjustNeeded( 1, true );
		final ManualAdjustmentResult adjustmentResult = service.apply( new ManualAdjustment( "tile-1", 2, -1, 1, false ) );

		Assert.assertFalse( adjustmentResult.isClamped() );
		Assert.assertNull( adjustmentResult.getRefinement() );
		Assert.assertEquals( Placement.IDENTITY, adjustmentResult.getPreviousPlacement() );
		Assert.assertEquals( new Placement( 2, -1 ), adjustmentResult.getPlacement() );
		Assert.assertEquals( new Placement( 2, -1 ), result.getPlacement( "tile-1" ) );
		Assert.assertFalse( result.getRegistry().isManualAdjustNeeded( 1 ) );

		// the union of the old and the new footprint within the canvas
		final Interval recomposed = adjustmentResult.getRecomposedInterval();
		Assert.assertEquals( 90, recomposed.min( 0 ) );
		Assert.assertEquals( 0, recomposed.min( 1 ) );
		Assert.assertEquals( result.getCanvas().getInterval().max( 0 ), recomposed.max( 0 ) );

		// pixels far from the tile are left as they were
		Assert.assertArrayEquals( farBefore, getValues( result.getCanvas(), 10, 50 ), 0 );

		// the misalignment shows in the score of the region
		Assert.assertTrue( result.getRegionMetrics().get( 0 ).getCorrelationScore() < 0.99 );
		Assert.assertFalse( result.getTransformRecord().getTiles().get( "tile-1" ).isManualAdjustNeeded() );
	}

	@Test
	public void testAdjustmentIsClamped() throws Exception
	{
		final ManualAdjustmentResult adjustmentResult = service.apply( new ManualAdjustment( "tile-1", 100, 0, 1.5, false ) );
		Assert.assertTrue( adjustmentResult.isClamped() );
		Assert.assertEquals( params.getOverlapMax(), adjustmentResult.getPlacement().getDx(), 1e-9 );
		Assert.assertEquals( 1 + params.maxScaleDeviation(), adjustmentResult.getPlacement().getScale(), 1e-9 );

		// the tile moved away, the crack it left is closed again
		Assert.assertTrue( adjustmentResult.getGapReport().getGapPixelsBefore() > 0 );
		Assert.assertEquals( 0, result.getGapReport().getGapPixelsAfter() );
	}

	@Test
	public void testLocalRefinementPullsTileBack() throws Exception
	{
		final ManualAdjustmentResult adjustmentResult = service.apply( new ManualAdjustment( "tile-1", 3, 0, 1, true ) );
		Assert.assertNotNull( adjustmentResult.getRefinement() );
		Assert.assertEquals( 0, adjustmentResult.getPlacement().getDx(), 0.5 );
		Assert.assertEquals( Placement.IDENTITY, result.getPlacement( "tile-0" ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testUnknownTile() throws Exception
	{
		service.apply( new ManualAdjustment( "tile-7", 1, 0, 1, false ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidScale() throws Exception
	{
		service.apply( new ManualAdjustment( "tile-1", 0, 0, 0, false ) );
	}
}
