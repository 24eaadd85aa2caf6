package org.janelia.mosaic;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.util.Intervals;

public class TileOperationsTest
{
	private static TileRecord tile( final int index, final double x, final double y, final long w, final long h )
	{
		final TileRecord tile = new TileRecord( "t" + index, new double[] { x, y }, new long[] { w, h } );
		tile.setIndex( index );
		return tile;
	}

	@Test
	public void testCollectionBoundaries()
	{
		final List< TileRecord > tiles = Arrays.asList( tile( 0, -5.7, 4.1, 8, 6 ), tile( 1, 1.2, 1.8, 9, 4 ) );
		final Placement[] placements = new Placement[] { Placement.IDENTITY, Placement.IDENTITY };
		Assert.assertTrue( Intervals.equals(
				new FinalInterval( new long[] { -6, 2 }, new long[] { 9, 9 } ),
				TileOperations.getCollectionBoundaries( tiles, placements ) ) );

		placements[ 1 ] = new Placement( 3, 0 );
		Assert.assertEquals( 12, TileOperations.getCollectionBoundaries( tiles, placements ).max( 0 ) );
	}

	@Test
	public void testOverlapRegions()
	{
		final MosaicParameters params = new MosaicParameters();
		final List< TileRecord > tiles = Arrays.asList(
				tile( 0, 0, 0, 100, 100 ),
				tile( 1, 90, 0, 100, 100 ),
				tile( 2, 0, 90, 100, 100 ),
				tile( 3, 90, 90, 100, 100 ) );
		final Placement[] placements = new Placement[ 4 ];
		Arrays.fill( placements, Placement.IDENTITY );

		final List< OverlapRegion > regions = TileOperations.findOverlapRegions( tiles, placements, params );
		Assert.assertEquals( 6, regions.size() );

		final OverlapRegion horizontal = regions.get( 0 );
		Assert.assertEquals( 0, horizontal.getIndexA() );
		Assert.assertEquals( 1, horizontal.getIndexB() );
		Assert.assertEquals( 0, horizontal.getNormalAxis() );
		Assert.assertFalse( horizontal.isDegenerate() );
		Assert.assertTrue( Intervals.equals( new FinalInterval( new long[] { 90, 0 }, new long[] { 99, 99 } ), horizontal.getInterval() ) );

		final OverlapRegion vertical = regions.get( 1 );
		Assert.assertEquals( 2, vertical.getIndexB() );
		Assert.assertEquals( 1, vertical.getNormalAxis() );

		// diagonal neighbors only touch at a corner
		final OverlapRegion diagonal = regions.get( 2 );
		Assert.assertEquals( 0, diagonal.getIndexA() );
		Assert.assertEquals( 3, diagonal.getIndexB() );
		Assert.assertTrue( diagonal.isDegenerate() );
	}

	@Test
	public void testWideOverlapIsClipped()
	{
		final MosaicParameters params = new MosaicParameters();
		params.setOverlapMax( 10 );
		final Interval intersection = new FinalInterval( new long[] { 60, 0 }, new long[] { 99, 99 } );
		final OverlapRegion region = TileOperations.createOverlapRegion( 0, 1, intersection, params );
		Assert.assertEquals( 10, region.getInterval().dimension( 0 ) );
		Assert.assertEquals( 100, region.getInterval().dimension( 1 ) );
		Assert.assertEquals( 75, region.getInterval().min( 0 ) );
		Assert.assertFalse( region.isDegenerate() );
	}

	@Test
	public void testThinOverlapIsDegenerate()
	{
		final MosaicParameters params = new MosaicParameters();
		params.setMinOverlapPx( 3 );
		final OverlapRegion region = TileOperations.createOverlapRegion( 0, 1, new FinalInterval( new long[] { 98, 0 }, new long[] { 99, 99 } ), params );
		Assert.assertTrue( region.isDegenerate() );
	}

	@Test
	public void testSeamBand()
	{
		final OverlapRegion region = new OverlapRegion( 0, 1, new FinalInterval( new long[] { 90, 0 }, new long[] { 99, 99 } ), 0, false );
		final SeamBand band = region.getSeamBand( 4 );
		Assert.assertEquals( 4, band.width() );
		Assert.assertEquals( 100, band.length() );
		Assert.assertEquals( 93, band.getInterval().min( 0 ) );
		Assert.assertEquals( 96, band.getInterval().max( 0 ) );
	}
}
