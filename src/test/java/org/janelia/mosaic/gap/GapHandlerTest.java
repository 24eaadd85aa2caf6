package org.janelia.mosaic.gap;

import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.PipelineExecutionException;
import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TestTiles;
import org.janelia.mosaic.TileRecord;
import org.janelia.mosaic.fusion.BlendingCompositor;
import org.janelia.mosaic.fusion.Canvas;
import org.janelia.mosaic.util.concurrent.MultithreadedExecutor;
import org.junit.Assert;
import org.junit.Test;

import net.imglib2.FinalInterval;

public class GapHandlerTest
{
	private static final double EPSILON = 1e-3;

	/**
	 * Two 100x100 tiles with a 2 px wide crack between them.
	 */
	private static Canvas createCrackedCanvas( final MosaicParameters params ) throws PipelineExecutionException
	{
		final List< TileRecord > tiles = Arrays.asList(
				TestTiles.createTile( 0, 0, 0, 100, 100, TestTiles.solid( 100 ) ),
				TestTiles.createTile( 1, 102, 0, 100, 100, TestTiles.solid( 200 ) ) );
		final Placement[] placements = new Placement[] { Placement.IDENTITY, Placement.IDENTITY };

		try ( final MultithreadedExecutor executor = new MultithreadedExecutor( 2 ) )
		{
			final BlendingCompositor compositor = new BlendingCompositor( params, executor );
			final Canvas canvas = compositor.createCanvas( tiles, placements );
			compositor.composite( canvas, tiles, placements, null );
			return canvas;
		}
	}

	private static double getValue( final Canvas canvas, final long x, final long y )
	{
		final double[] values = new double[ canvas.getNumChannels() ];
		canvas.getValue( x, y, values );
		return values[ 0 ];
	}

	@Test
	public void testCrackIsFilled() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setSeamFillMaxPx( 5 );
		final Canvas canvas = createCrackedCanvas( params );

		final GapReport report = new GapHandler( params ).fill( canvas );
		Assert.assertEquals( 200, report.getGapPixelsBefore() );
		Assert.assertEquals( 0, report.getGapPixelsAfter() );
		Assert.assertEquals( 1, report.getComponentsFilled() );
		Assert.assertTrue( report.isGapBefore( 100, 50 ) );
		Assert.assertFalse( report.isGapAfter( 100, 50 ) );

		// each side of the crack is extended from its nearest tile
		Assert.assertTrue( canvas.isFilled( 100, 50 ) );
		Assert.assertEquals( 100, getValue( canvas, 100, 50 ), EPSILON );
		Assert.assertEquals( 200, getValue( canvas, 101, 50 ), EPSILON );
		Assert.assertFalse( canvas.hasContribution( 100, 50 ) );
	}

	@Test
	public void testThickGapIsKept() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setSeamFillMaxPx( 1 );
		final Canvas canvas = createCrackedCanvas( params );

		final GapReport report = new GapHandler( params ).fill( canvas );
		Assert.assertEquals( 200, report.getGapPixelsBefore() );
		Assert.assertEquals( 200, report.getGapPixelsAfter() );
		Assert.assertEquals( 1, report.getComponentsLeft() );
		Assert.assertFalse( canvas.isCovered( 100, 50 ) );
	}

	@Test
	public void testDisabledSeamFill() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setSeamFillEnabled( false );
		final Canvas canvas = createCrackedCanvas( params );
		Assert.assertEquals( 200, new GapHandler( params ).fill( canvas ).getGapPixelsAfter() );
	}

	@Test
	public void testInpaint() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setGapFill( GapFillMethod.INPAINT );
		final Canvas canvas = createCrackedCanvas( params );

		final GapReport report = new GapHandler( params ).fill( canvas );
		Assert.assertEquals( 0, report.getGapPixelsAfter() );
		for ( long y = 0; y < 100; y += 10 )
		{
			for ( long x = 100; x <= 101; ++x )
			{
				final double value = getValue( canvas, x, y );
				Assert.assertTrue( value >= 100 - EPSILON && value <= 200 + EPSILON );
			}
		}
		Assert.assertTrue( getValue( canvas, 100, 50 ) < getValue( canvas, 101, 50 ) );
	}

	@Test
	public void testLocalRerunUpdatesReport() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		final Canvas canvas = createCrackedCanvas( params );
		final GapHandler gapHandler = new GapHandler( params );
		final GapReport report = gapHandler.fill( canvas );

		// the region grows along the crack it touches
		final GapReport local = gapHandler.fill( canvas, new FinalInterval( new long[] { 90, 40 }, new long[] { 110, 60 } ) );
		Assert.assertEquals( 90, local.getInterval().min( 0 ) );
		Assert.assertEquals( 110, local.getInterval().max( 0 ) );
		Assert.assertEquals( 0, local.getInterval().min( 1 ) );
		Assert.assertEquals( 99, local.getInterval().max( 1 ) );
		Assert.assertEquals( 200, local.getGapPixelsBefore() );
		Assert.assertEquals( 0, local.getGapPixelsAfter() );
		report.update( local );
		Assert.assertEquals( 200, report.getGapPixelsBefore() );
		Assert.assertEquals( 0, report.getGapPixelsAfter() );
	}

	@Test
	public void testLocalRerunTreatsComponentAsWhole() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setSeamFillMaxPx( 5 );
		final Canvas canvas = createCrackedCanvas( params );
		final GapReport report = new GapHandler( params ).fill( canvas );
		Assert.assertTrue( canvas.isFilled( 100, 5 ) );

		// the same crack is now too thick to close, also where it lies outside of the requested region
		params.setSeamFillMaxPx( 1 );
		final GapReport local = new GapHandler( params ).fill( canvas, new FinalInterval( new long[] { 95, 45 }, new long[] { 105, 55 } ) );
		report.update( local );
		Assert.assertFalse( canvas.isFilled( 100, 50 ) );
		Assert.assertFalse( canvas.isFilled( 100, 5 ) );
		Assert.assertEquals( 200, report.getGapPixelsAfter() );
	}

	@Test
	public void testLargestSquares()
	{
		// 4x3 grid, gaps marked with 1
		final int[] layout = new int[] {
				1, 1, 1, 0,
				1, 1, 1, 0,
				1, 1, 1, 1 };
		final boolean[] gaps = new boolean[ layout.length ];
		for ( int i = 0; i < layout.length; ++i )
			gaps[ i ] = layout[ i ] == 1;

		final int[] squares = GapHandler.computeLargestSquares( gaps, 4, 3 );
		Assert.assertArrayEquals( new int[] {
				1, 1, 1, 0,
				1, 2, 2, 0,
				1, 2, 3, 1 }, squares );
	}
}
