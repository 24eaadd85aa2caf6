package org.janelia.mosaic.alignment;

import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.ImageType;
import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.OverlapRegion;
import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TestTiles;
import org.janelia.mosaic.TileOperations;
import org.janelia.mosaic.TileRecord;
import org.junit.Assert;
import org.junit.Test;

public class SeamCorrelatorTest
{
	private static final double EPSILON = 1e-9;

	@Test
	public void testParabolicFit()
	{
		Assert.assertArrayEquals( new double[] { 0, 1 }, SeamCorrelator.parabolicFit( 0.5, 1, 0.5 ), EPSILON );
		Assert.assertEquals( 1 / 6.0, SeamCorrelator.parabolicFit( 0, 1, 0.5 )[ 0 ], EPSILON );
		Assert.assertTrue( SeamCorrelator.parabolicFit( 0, 1, 0.5 )[ 1 ] > 1 );

		// vertex is clamped to half a pixel
		Assert.assertEquals( 0.5, SeamCorrelator.parabolicFit( -1, 1, 1.5 )[ 0 ], EPSILON );

		// missing neighbor or no maximum
		Assert.assertArrayEquals( new double[] { 0, 1 }, SeamCorrelator.parabolicFit( Double.NaN, 1, 0.5 ), EPSILON );
		Assert.assertArrayEquals( new double[] { 0, 1 }, SeamCorrelator.parabolicFit( 2, 1, 2 ), EPSILON );
	}

	@Test
	public void testFindsOffset()
	{
		final MosaicParameters params = TestTiles.createParameters();
		final TileRecord tileA = TestTiles.createTile( 0, 0, 0, 100, 100, 0, 0, ImageType.GRAY8, TestTiles.TEXTURE );
		final TileRecord tileB = TestTiles.createTile( 1, 90, 0, 100, 100, 3, -2, ImageType.GRAY8, TestTiles.TEXTURE );
		final List< TileRecord > tiles = Arrays.asList( tileA, tileB );
		final Placement[] placements = new Placement[] { Placement.IDENTITY, Placement.IDENTITY };

		final List< OverlapRegion > regions = TileOperations.findOverlapRegions( tiles, placements, params );
		Assert.assertEquals( 1, regions.size() );
		Assert.assertEquals( 0, regions.get( 0 ).getNormalAxis() );

		final SeamCorrelator correlator = new SeamCorrelator( params );
		final TileSampler samplerA = new TileSampler( tileA ), samplerB = new TileSampler( tileB );
		final CorrelationResult result = correlator.correlate( samplerA, placements[ 0 ], samplerB, placements[ 1 ], regions.get( 0 ) );

		Assert.assertTrue( result.isDefined() );
		Assert.assertEquals( 3, result.getOffset()[ 0 ], 0.5 );
		Assert.assertEquals( -2, result.getOffset()[ 1 ], 0.5 );
		Assert.assertTrue( result.getImprovement() > 0 );

		// moving b by the offset aligns the seam
		final double aligned = correlator.score( samplerA, placements[ 0 ], samplerB, new Placement( 3, -2 ), regions.get( 0 ) );
		Assert.assertEquals( 1, aligned, 1e-3 );
		Assert.assertTrue( aligned > result.getCurrentScore() );
	}

	@Test
	public void testSearchRadiusIsBoundedByOverlapMax()
	{
		final MosaicParameters params = TestTiles.createParameters();
		params.setSearchRadiusPx( 8 );
		params.setOverlapMax( 4 );
		Assert.assertEquals( 4, new SeamCorrelator( params ).getSearchRadius() );
	}

	@Test
	public void testFlatContentIsUndefined()
	{
		final MosaicParameters params = TestTiles.createParameters();
		final TileRecord tileA = TestTiles.createTile( 0, 0, 0, 50, 50, TestTiles.solid( 100 ) );
		final TileRecord tileB = TestTiles.createTile( 1, 40, 0, 50, 50, TestTiles.solid( 100 ) );
		final Placement[] placements = new Placement[] { Placement.IDENTITY, Placement.IDENTITY };
		final OverlapRegion region = TileOperations.findOverlapRegions( Arrays.asList( tileA, tileB ), placements, params ).get( 0 );

		final SeamCorrelator correlator = new SeamCorrelator( params );
		final CorrelationResult result = correlator.correlate( new TileSampler( tileA ), placements[ 0 ], new TileSampler( tileB ), placements[ 1 ], region );
		Assert.assertFalse( result.isDefined() );
		Assert.assertTrue( Double.isNaN( correlator.score( new TileSampler( tileA ), placements[ 0 ], new TileSampler( tileB ), placements[ 1 ], region ) ) );
	}
}
