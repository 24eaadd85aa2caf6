package org.janelia.mosaic.alignment;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;

import org.janelia.mosaic.ImageType;
import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.OverlapRegion;
import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TestTiles;
import org.janelia.mosaic.TileOperations;
import org.janelia.mosaic.TileRecord;
import org.janelia.mosaic.util.concurrent.MultithreadedExecutor;
import org.junit.Assert;
import org.junit.Test;

public class AlignmentRefinerTest
{
	/**
	 * Two 100x100 tiles with a nominal overlap of 10 px where the content of the second tile is actually shifted by {@code shift} px.
	 */
	private static List< TileRecord > createPair( final double shift )
	{
		return Arrays.asList(
				TestTiles.createTile( 0, 0, 0, 100, 100, 0, 0, ImageType.GRAY8, TestTiles.TEXTURE ),
				TestTiles.createTile( 1, 90, 0, 100, 100, shift, 0, ImageType.GRAY8, TestTiles.TEXTURE ) );
	}

	private static RefinementResult refine( final List< TileRecord > tiles, final MosaicParameters params ) throws InterruptedException, ExecutionException
	{
		final List< OverlapRegion > regions = TileOperations.findOverlapRegions( tiles, new PlacementRegistry( tiles ).getPlacements(), params );
		return refine( tiles, regions, params );
	}

	private static RefinementResult refine( final List< TileRecord > tiles, final List< OverlapRegion > regions, final MosaicParameters params ) throws InterruptedException, ExecutionException
	{
		final PlacementRegistry registry = new PlacementRegistry( tiles );
		try ( final MultithreadedExecutor executor = new MultithreadedExecutor( params.getNumThreads() ) )
		{
			return new AlignmentRefiner( params, executor ).refine( tiles, registry, regions );
		}
	}

	@Test
	public void testRecoversShift() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		final RefinementResult result = refine( createPair( 3 ), params );

		Assert.assertTrue( result.isConverged() );
		Assert.assertTrue( result.getAcceptedUpdates() > 0 );
		Assert.assertTrue( result.getManualAdjustNeeded().isEmpty() );

		// the lowest index stays in place
		Assert.assertEquals( Placement.IDENTITY, result.getPlacements()[ 0 ] );
		Assert.assertEquals( 3, result.getPlacements()[ 1 ].getDx(), 0.5 );
		Assert.assertEquals( 0, result.getPlacements()[ 1 ].getDy(), 0.5 );

		final RegionMetrics metrics = result.getRegionMetrics().get( 0 );
		Assert.assertEquals( 3, metrics.getDisplacement()[ 0 ], 0.5 );
		Assert.assertTrue( metrics.getCorrelationScore() > 0.99 );
	}

	@Test
	public void testRefiningRefinedPlacementsChangesNothing() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		final List< TileRecord > tiles = createPair( 3 );
		final List< OverlapRegion > regions = TileOperations.findOverlapRegions( tiles, new PlacementRegistry( tiles ).getPlacements(), params );
		final RefinementResult first = refine( tiles, regions, params );

		for ( final TileRecord tile : tiles )
			tile.setInitialPlacement( first.getPlacements()[ tile.getIndex() ] );

		final RefinementResult second = refine( tiles, regions, params );
		Assert.assertEquals( 0, second.getAcceptedUpdates() );
		Assert.assertArrayEquals( first.getPlacements(), second.getPlacements() );
	}

	@Test
	public void testSameResultForAnyNumberOfThreads() throws Exception
	{
		final List< TileRecord > tiles = Arrays.asList(
				TestTiles.createTile( 0, 0, 0, 60, 60, 0, 0, ImageType.GRAY8, TestTiles.TEXTURE ),
				TestTiles.createTile( 1, 50, 0, 60, 60, 2, 1, ImageType.GRAY8, TestTiles.TEXTURE ),
				TestTiles.createTile( 2, 0, 50, 60, 60, -1, 2, ImageType.GRAY8, TestTiles.TEXTURE ),
				TestTiles.createTile( 3, 50, 50, 60, 60, 1, -2, ImageType.GRAY8, TestTiles.TEXTURE ) );

		final MosaicParameters params = TestTiles.createParameters();
		params.setNumThreads( 1 );
		final RefinementResult sequential = refine( tiles, params );

		params.setNumThreads( 4 );
		final RefinementResult parallel = refine( tiles, params );

		Assert.assertArrayEquals( sequential.getPlacements(), parallel.getPlacements() );
		Assert.assertEquals( sequential.getAcceptedUpdates(), parallel.getAcceptedUpdates() );
		Assert.assertEquals( sequential.getIterations(), parallel.getIterations() );
		Assert.assertEquals( 2, sequential.getDegenerateRegions() );
	}

	@Test
	public void testDivergingTileIsFlagged() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setOverlapMax( 4 );
		final RefinementResult result = refine( createPair( 6 ), params );

		Assert.assertEquals( Arrays.asList( 1 ), result.getManualAdjustNeeded() );
		Assert.assertTrue( Math.abs( result.getPlacements()[ 1 ].getDx() ) <= 4 );
		Assert.assertTrue( Math.abs( result.getPlacements()[ 1 ].getDy() ) <= 4 );
	}

	@Test
	public void testRotationAndScaleStayWithinBounds() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setRefineRotationScale( true );
		params.setRotationScaleInterval( 2 );
		final List< TileRecord > tiles = createPair( 3 );
		final RefinementResult result = refine( tiles, params );

		for ( final TileRecord tile : tiles )
			Assert.assertTrue( params.isWithinBounds( result.getPlacements()[ tile.getIndex() ], tile.getInitialPlacement() ) );
		Assert.assertEquals( 3, result.getPlacements()[ 1 ].getDx(), 1 );
	}

	@Test
	public void testEvaluateDoesNotMoveTiles() throws Exception
	{
		final MosaicParameters params = TestTiles.createParameters();
		final List< TileRecord > tiles = createPair( 0 );
		final PlacementRegistry registry = new PlacementRegistry( tiles );
		final List< OverlapRegion > regions = TileOperations.findOverlapRegions( tiles, registry.getPlacements(), params );
		try ( final MultithreadedExecutor executor = new MultithreadedExecutor( 2 ) )
		{
			final List< RegionMetrics > metrics = new AlignmentRefiner( params, executor ).evaluate( tiles, registry, regions );
			Assert.assertEquals( 1, metrics.size() );
			Assert.assertEquals( 1, metrics.get( 0 ).getCorrelationScore(), 1e-3 );
			Assert.assertEquals( 0, metrics.get( 0 ).getUpdates() );
		}
		Assert.assertEquals( 0, registry.getVersion( 1 ) );
	}
}
