package org.janelia.mosaic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.imglib2.FinalRealInterval;
import net.imglib2.Interval;
import net.imglib2.RealInterval;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;

public class TileOperations
{
	private static final Logger LOG = LoggerFactory.getLogger( TileOperations.class );

	public static Interval roundRealInterval( final RealInterval realInterval )
	{
		final long[] min = new long[ realInterval.numDimensions() ], max = new long[ realInterval.numDimensions() ];
		for ( int d = 0; d < realInterval.numDimensions(); ++d )
		{
			min[ d ] = Math.round( realInterval.realMin( d ) );
			max[ d ] = Math.round( realInterval.realMax( d ) );
		}
		return new FinalInterval( min, max );
	}

	/**
	 * @return the largest integer interval contained in {@code realInterval}, possibly empty
	 */
	public static Interval innerInterval( final RealInterval realInterval )
	{
		final long[] min = new long[ realInterval.numDimensions() ], max = new long[ realInterval.numDimensions() ];
		for ( int d = 0; d < realInterval.numDimensions(); ++d )
		{
			min[ d ] = ( long ) Math.ceil( realInterval.realMin( d ) - 1e-9 );
			max[ d ] = ( long ) Math.floor( realInterval.realMax( d ) + 1e-9 );
		}
		return new FinalInterval( min, max );
	}

	/**
	 * @return true if two boxes overlap, false otherwise
	 */
	public static boolean overlap( final RealInterval t1, final RealInterval t2 )
	{
		for ( int d = 0; d < t1.numDimensions(); d++ )
		{
			final double min1 = t1.realMin( d ), min2 = t2.realMin( d ), max1 = t1.realMax( d ), max2 = t2.realMax( d );
			if ( !( ( min2 >= min1 && min2 <= max1 ) || ( min1 >= min2 && min1 <= max2 ) ) )
				return false;
		}
		return true;
	}

	/**
	 * @return intersection of two boxes, or {@code null} if they do not overlap
	 */
	public static RealInterval intersectReal( final RealInterval t1, final RealInterval t2 )
	{
		if ( !overlap( t1, t2 ) )
			return null;

		final double[] min = new double[ t1.numDimensions() ], max = new double[ t1.numDimensions() ];
		for ( int d = 0; d < t1.numDimensions(); d++ )
		{
			min[ d ] = Math.max( t1.realMin( d ), t2.realMin( d ) );
			max[ d ] = Math.min( t1.realMax( d ), t2.realMax( d ) );
		}
		return new FinalRealInterval( min, max );
	}

	/**
	 * @return intersection of two integer intervals, or {@code null} if it is empty
	 */
	public static Interval intersect( final Interval t1, final Interval t2 )
	{
		final Interval intersection = Intervals.intersect( t1, t2 );
		return Intervals.isEmpty( intersection ) ? null : intersection;
	}

	/**
	 * @return an integer bounding box of a collection of tiles under the given placements
	 */
	public static Interval getCollectionBoundaries( final List< TileRecord > tiles, final Placement[] placements )
	{
		if ( tiles.isEmpty() )
			return null;

		final long[] min = new long[ 2 ], max = new long[ 2 ];
		Arrays.fill( min, Long.MAX_VALUE );
		Arrays.fill( max, Long.MIN_VALUE );

		for ( final TileRecord tile : tiles )
		{
			final Interval tileBoundaries = roundRealInterval( tile.getFootprint( placements[ tile.getIndex() ] ) );
			for ( int d = 0; d < 2; d++ )
			{
				min[ d ] = Math.min( min[ d ], tileBoundaries.min( d ) );
				max[ d ] = Math.max( max[ d ], tileBoundaries.max( d ) );
			}
		}

		return new FinalInterval( min, max );
	}

	/**
	 * @return indexes of the tiles whose footprints under the given placements intersect {@code subregion}
	 */
	public static List< Integer > findTilesWithinSubregion( final List< TileRecord > tiles, final Placement[] placements, final RealInterval subregion )
	{
		final List< Integer > tilesWithinSubregion = new ArrayList<>();
		for ( final TileRecord tile : tiles )
			if ( overlap( tile.getFootprint( placements[ tile.getIndex() ] ), subregion ) )
				tilesWithinSubregion.add( tile.getIndex() );
		return tilesWithinSubregion;
	}

	/**
	 * Finds all pairs of tiles whose placed footprints intersect.
	 * Intersections that are thicker than {@code overlap_max} along the seam normal are clipped symmetrically
	 * around their center line. Pairs that touch only at a line or a corner, or whose overlap is too small
	 * to be matched, are returned as degenerate.
	 *
	 * @return a list of overlap regions ordered by (indexA, indexB)
	 */
	public static List< OverlapRegion > findOverlapRegions( final List< TileRecord > tiles, final Placement[] placements, final MosaicParameters params )
	{
		final List< OverlapRegion > regions = new ArrayList<>();
		for ( int i = 0; i < tiles.size(); ++i )
		{
			final TileRecord t1 = tiles.get( i );
			final RealInterval f1 = t1.getFootprint( placements[ t1.getIndex() ] );
			for ( int j = i + 1; j < tiles.size(); ++j )
			{
				final TileRecord t2 = tiles.get( j );
				final RealInterval intersection = intersectReal( f1, t2.getFootprint( placements[ t2.getIndex() ] ) );
				if ( intersection == null )
					continue;

				final OverlapRegion region = createOverlapRegion(
						Math.min( t1.getIndex(), t2.getIndex() ),
						Math.max( t1.getIndex(), t2.getIndex() ),
						innerInterval( intersection ),
						params );
				if ( region.isDegenerate() )
					LOG.debug( "overlap {} between tiles {} and {} is degenerate", Util.printInterval( region.getInterval() ), t1, t2 );
				regions.add( region );
			}
		}
		regions.sort( ( r1, r2 ) -> r1.getIndexA() != r2.getIndexA() ? Integer.compare( r1.getIndexA(), r2.getIndexA() ) : Integer.compare( r1.getIndexB(), r2.getIndexB() ) );
		return regions;
	}

	static OverlapRegion createOverlapRegion( final int indexA, final int indexB, final Interval intersection, final MosaicParameters params )
	{
		final long[] min = Intervals.minAsLongArray( intersection ), max = Intervals.maxAsLongArray( intersection );
		final long[] extent = new long[] { Math.max( 0, max[ 0 ] - min[ 0 ] + 1 ), Math.max( 0, max[ 1 ] - min[ 1 ] + 1 ) };
		final int normalAxis = extent[ 0 ] <= extent[ 1 ] ? 0 : 1;

		if ( extent[ normalAxis ] > params.getOverlapMax() && params.getOverlapMax() > 0 )
		{
			min[ normalAxis ] += ( extent[ normalAxis ] - params.getOverlapMax() ) / 2;
			max[ normalAxis ] = min[ normalAxis ] + params.getOverlapMax() - 1;
			extent[ normalAxis ] = params.getOverlapMax();
		}

		final long thickness = extent[ normalAxis ], length = extent[ 1 - normalAxis ];
		final boolean degenerate =
				thickness < params.getMinOverlapPx()
				|| thickness * length < ( long ) params.getMinOverlapPx() * params.getMinOverlapPx()
				|| length < 2 * thickness; // corner contact between diagonal neighbors

		return new OverlapRegion( indexA, indexB, new FinalInterval( min, max ), normalAxis, degenerate );
	}
}
