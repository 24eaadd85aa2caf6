package org.janelia.mosaic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.photometric.ColorMatchMode;
import org.junit.Assert;
import org.junit.Test;

public class MosaicEngineTest
{
	/**
	 * 2x2 grid of 60x60 tiles with 10 px overlaps whose content is slightly off the nominal grid.
	 */
	private static List< TileRecord > createGrid()
	{
		return new ArrayList<>( Arrays.asList(
				TestTiles.createTile( 0, 0, 0, 60, 60, 0, 0, ImageType.GRAY8, TestTiles.TEXTURE ),
				TestTiles.createTile( 1, 50, 0, 60, 60, 2, 1, ImageType.GRAY8, TestTiles.TEXTURE ),
				TestTiles.createTile( 2, 0, 50, 60, 60, -1, 2, ImageType.GRAY8, TestTiles.TEXTURE ),
				TestTiles.createTile( 3, 50, 50, 60, 60, 1, -1, ImageType.GRAY8, TestTiles.TEXTURE ) ) );
	}

	private static MosaicParameters createParameters( final int numThreads )
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setNumThreads( numThreads );
		params.setNumBands( 3 );
		return params;
	}

	@Test
	public void testFullRun() throws Exception
	{
		final MosaicParameters params = createParameters( 2 );
		try ( final MosaicEngine engine = new MosaicEngine( params ) )
		{
			final MosaicResult result = engine.run( new MosaicJob( createGrid(), params ) );

			Assert.assertEquals( 4, result.getTiles().size() );
			Assert.assertEquals( 6, result.getRegions().size() );
			Assert.assertNotNull( result.getCanvas() );
			Assert.assertNotNull( result.getGapReport() );
			Assert.assertEquals( Placement.IDENTITY, result.getPlacement( "tile-0" ) );
			Assert.assertEquals( 2, result.getPlacement( "tile-1" ).getDx(), 0.5 );
			Assert.assertEquals( 1, result.getPlacement( "tile-1" ).getDy(), 0.5 );

			final MetricsRecord metrics = result.getMetricsRecord();
			Assert.assertEquals( 2, metrics.getDegenerateRegions() );
			Assert.assertEquals( 0, metrics.getManualAdjustNeededCount() );
			Assert.assertEquals( 0, metrics.getGapPixelsAfter() );
			Assert.assertTrue( metrics.getMeanCorrelationScore() > 0.9 );
			Assert.assertTrue( metrics.getWorstCorrelationScore() <= metrics.getMeanCorrelationScore() );
			Assert.assertTrue( metrics.isConverged() );

			final TransformRecord transforms = result.getTransformRecord();
			Assert.assertEquals( Arrays.asList( "tile-0", "tile-1", "tile-2", "tile-3" ), new ArrayList<>( transforms.getTiles().keySet() ) );
			Assert.assertEquals( 6, transforms.getRegions().size() );
			Assert.assertNull( transforms.getRegions().get( 2 ).getCorrelationScore() );
		}
	}

	@Test
	public void testInvalidTileIsExcluded() throws Exception
	{
		final MosaicParameters params = createParameters( 2 );
		final List< TileRecord > tiles = createGrid();
		final TileRecord missing = new TileRecord( "missing", new double[] { 100, 0 }, new long[] { 60, 60 } );
		missing.setIndex( 4 );
		tiles.add( missing );

		try ( final MosaicEngine engine = new MosaicEngine( params ) )
		{
			final MosaicResult result = engine.run( new MosaicJob( tiles, params, true, false ) );
			Assert.assertEquals( 4, result.getTiles().size() );
			Assert.assertEquals( Arrays.asList( "missing" ), result.getExcludedTiles() );
			Assert.assertEquals( Arrays.asList( "missing" ), result.getMetricsRecord().getExcludedTiles() );
			Assert.assertNull( result.findTile( "missing" ) );

			// refine-only run has no canvas
			Assert.assertNull( result.getCanvas() );
			Assert.assertEquals( 0, result.getMetricsRecord().getGapPixelsBefore() );
		}
	}

	@Test( expected = PipelineExecutionException.class )
	public void testNoValidTiles() throws Exception
	{
		final MosaicParameters params = createParameters( 1 );
		final TileRecord missing = new TileRecord( "missing", new double[] { 0, 0 }, new long[] { 60, 60 } );
		try ( final MosaicEngine engine = new MosaicEngine( params ) )
		{
			engine.run( new MosaicJob( Arrays.asList( missing ), params ) );
		}
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidParameters()
	{
		final MosaicParameters params = createParameters( 1 );
		params.setOverlapMax( MosaicParameters.OVERLAP_MAX_LIMIT + 1 );
		new MosaicEngine( params ).close();
	}

	@Test
	public void testBlendOnlyKeepsInitialPlacements() throws Exception
	{
		final MosaicParameters params = createParameters( 2 );
		params.setColorMatch( ColorMatchMode.OFF );
		try ( final MosaicEngine engine = new MosaicEngine( params ) )
		{
			final MosaicResult result = engine.run( new MosaicJob( createGrid(), params, false, true ) );
			for ( final TileRecord tile : result.getTiles() )
				Assert.assertEquals( Placement.IDENTITY, result.getPlacement( tile.getId() ) );
			Assert.assertEquals( 0, result.getIterations() );
			Assert.assertNotNull( result.getCanvas() );
			Assert.assertEquals( 0, result.getMetricsRecord().getIterations() );
		}
	}

	@Test
	public void testSameTransformsForAnyNumberOfThreads() throws Exception
	{
		final List< Placement > placements = new ArrayList<>();
		for ( final int numThreads : new int[] { 1, 3 } )
		{
			final MosaicParameters params = createParameters( numThreads );
			try ( final MosaicEngine engine = new MosaicEngine( params ) )
			{
				final MosaicResult result = engine.run( new MosaicJob( createGrid(), params, true, false ) );
				for ( final TransformRecord.TileTransform transform : result.getTransformRecord().getTiles().values() )
					placements.add( transform.toPlacement() );
			}
		}
		Assert.assertEquals( placements.subList( 0, 4 ), placements.subList( 4, 8 ) );
	}

	@Test
	public void testInitialRotationAndScaleAreClamped() throws Exception
	{
		final MosaicParameters params = createParameters( 2 );
		params.setRefineRotationScale( true );
		final List< TileRecord > tiles = createGrid();
		tiles.get( 1 ).setInitialPlacement( new Placement( 0, 0, 3.0, 1.02 ) );

		try ( final MosaicEngine engine = new MosaicEngine( params ) )
		{
			final MosaicResult result = engine.run( new MosaicJob( tiles, params, true, false ) );
			for ( final TransformRecord.TileTransform transform : result.getTransformRecord().getTiles().values() )
			{
				final Placement placement = transform.toPlacement();
				Assert.assertTrue( placement.toString(), Math.abs( placement.getScale() - 1 ) <= params.maxScaleDeviation() + 1e-9 );
				Assert.assertTrue( placement.toString(), Math.abs( placement.getRotation() ) <= params.getMaxRotationDeg() + 1e-9 );
			}
		}

		// the loaded record is left as configured
		Assert.assertEquals( 1.02, tiles.get( 1 ).getInitialPlacement().getScale(), 0 );
	}

	@Test
	public void testFlaggedTileStaysInPlace() throws Exception
	{
		final MosaicParameters params = createParameters( 2 );
		final List< TileRecord > tiles = createGrid();
		tiles.get( 1 ).setManualAdjustNeeded( true );

		try ( final MosaicEngine engine = new MosaicEngine( params ) )
		{
			final MosaicResult result = engine.run( new MosaicJob( tiles, params, true, false ) );
			Assert.assertEquals( Placement.IDENTITY, result.getPlacement( "tile-1" ) );
			Assert.assertTrue( result.getTransformRecord().getTiles().get( "tile-1" ).isManualAdjustNeeded() );
			Assert.assertEquals( 1, result.getMetricsRecord().getManualAdjustNeededCount() );

			// the other tiles are still refined
			Assert.assertNotEquals( Placement.IDENTITY, result.getPlacement( "tile-2" ) );
		}
	}
}
