package org.janelia.mosaic.fusion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;

import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.PipelineExecutionException;
import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TileOperations;
import org.janelia.mosaic.TileRecord;
import org.janelia.mosaic.util.concurrent.MultithreadedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RealInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.realtransform.AffineTransform2D;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * Composites placed tiles into a {@link Canvas} with multi-band feathering.
 * <p>
 * Every tile is cropped by {@code border_crop_px} on each edge, resampled into canvas space and split into
 * {@code num_bands} frequency bands. Coarse bands are blended over wide ramps and fine bands over narrow ones,
 * which hides exposure differences without ghosting fine detail. Tile contributions are computed in parallel
 * and added to the canvas in tile index order.
 */
public class BlendingCompositor
{
	private static final Logger LOG = LoggerFactory.getLogger( BlendingCompositor.class );

	private static final double EPSILON = 1e-6;

	private final MosaicParameters params;
	private final MultithreadedExecutor executor;

	public BlendingCompositor( final MosaicParameters params, final MultithreadedExecutor executor )
	{
		this.params = params;
		this.executor = executor;
	}

	/**
	 * Allocates a canvas that spans the placed footprints of all tiles.
	 */
	public Canvas createCanvas( final List< TileRecord > tiles, final Placement[] placements ) throws PipelineExecutionException
	{
		if ( tiles.isEmpty() )
			throw new PipelineExecutionException( "No tiles to composite" );

		final Interval extent = TileOperations.getCollectionBoundaries( tiles, placements );
		int numChannels = 1;
		double maxValue = 0;
		for ( final TileRecord tile : tiles )
		{
			numChannels = Math.max( numChannels, tile.getNumChannels() );
			maxValue = Math.max( maxValue, tile.getMaxValue() );
		}

		LOG.info( "Allocating canvas {} with {} channel(s) and {} band(s)", Util.printInterval( extent ), numChannels, params.getNumBands() );
		return Canvas.allocate( extent, numChannels, params.getNumBands(), maxValue );
	}

	/**
	 * Accumulates all tiles over the whole canvas.
	 */
	public void composite(
			final Canvas canvas,
			final List< TileRecord > tiles,
			final Placement[] placements,
			final ProtectLinesMask protectLines ) throws PipelineExecutionException
	{
		composite( canvas, tiles, placements, protectLines, canvas.getInterval() );
	}

	/**
	 * Clears {@code region} and accumulates it again from every tile whose placed footprint intersects it.
	 * Pixels outside of {@code region} are not touched.
	 */
	public void composite(
			final Canvas canvas,
			final List< TileRecord > tiles,
			final Placement[] placements,
			final ProtectLinesMask protectLines,
			final Interval region ) throws PipelineExecutionException
	{
		canvas.clear( region );

		final List< TileRecord > affectedTiles = new ArrayList<>();
		for ( final TileRecord tile : tiles )
			if ( TileOperations.overlap( tile.getFootprint( placements[ tile.getIndex() ] ), region ) )
				affectedTiles.add( tile );
		affectedTiles.sort( Comparator.comparingInt( TileRecord::getIndex ) );

		LOG.info( "Compositing {} tiles into {}", affectedTiles.size(), Util.printInterval( region ) );

		// bounded batches keep only a few resampled tiles in memory at a time
		final int batchSize = Math.max( 1, executor.getNumThreads() );
		for ( int start = 0; start < affectedTiles.size(); start += batchSize )
		{
			final List< TileRecord > batch = affectedTiles.subList( start, Math.min( start + batchSize, affectedTiles.size() ) );
			final List< TileContribution > contributions;
			try
			{
				contributions = executor.map( i -> computeContribution( batch.get( i ), placements[ batch.get( i ).getIndex() ], canvas.getInterval() ), batch.size() );
			}
			catch ( final InterruptedException | ExecutionException e )
			{
				throw new PipelineExecutionException( "Failed to resample tiles", e );
			}

			for ( final TileContribution contribution : contributions )
				if ( contribution != null )
					canvas.accumulate( contribution, region, protectLines );
		}
	}

	/**
	 * Resamples a tile into canvas space and decomposes it into bands.
	 *
	 * @return the contribution, or {@code null} if the tile has no pixels left after cropping or lies outside of {@code bounds}
	 */
	public TileContribution computeContribution( final TileRecord tile, final Placement placement, final Interval bounds )
	{
		final double[] cropMin = new double[ 2 ], cropMax = new double[ 2 ];
		if ( !getCroppedBounds( tile, cropMin, cropMax ) )
		{
			LOG.warn( "tile {} has no pixels left after cropping {} px from its borders", tile, params.getBorderCropPx() );
			return null;
		}

		final Interval interval = getResampledInterval( tile.getFootprint( placement ), bounds );
		if ( interval == null )
			return null;

		final int width = ( int ) interval.dimension( 0 ), height = ( int ) interval.dimension( 1 );
		final int numPixels = width * height, numChannels = tile.getNumChannels(), numBands = params.getNumBands();

		final boolean[] coverage = new boolean[ numPixels ];
		final float[][] values = new float[ numChannels ][ numPixels ];
		final float[] baseWeights = new float[ numPixels ];
		final float[][] bandWeights = new float[ numBands ][ numPixels ];

		final AffineTransform2D transform = tile.getTransform( placement );
		final RealRandomAccess< FloatType > interpolated = Views.interpolate(
				Views.extendBorder( tile.getPixels() ),
				new NLinearInterpolatorFactory< FloatType >() ).realRandomAccess();
		final RandomAccess< BitType > maskRandomAccess = tile.getContentMask().randomAccess();

		final double[] canvasPosition = new double[ 2 ], tilePosition = new double[ 2 ];
		int i = 0;
		for ( long y = interval.min( 1 ); y <= interval.max( 1 ); ++y )
		{
			for ( long x = interval.min( 0 ); x <= interval.max( 0 ); ++x, ++i )
			{
				canvasPosition[ 0 ] = x;
				canvasPosition[ 1 ] = y;
				transform.applyInverse( tilePosition, canvasPosition );
				if ( !isInside( tilePosition, cropMin, cropMax ) )
					continue;

				maskRandomAccess.setPosition( Math.round( tilePosition[ 0 ] ), 0 );
				maskRandomAccess.setPosition( Math.round( tilePosition[ 1 ] ), 1 );
				if ( !maskRandomAccess.get().get() )
					continue;

				coverage[ i ] = true;
				interpolated.setPosition( tilePosition[ 0 ], 0 );
				interpolated.setPosition( tilePosition[ 1 ], 1 );
				for ( int c = 0; c < numChannels; ++c )
				{
					interpolated.setPosition( c, 2 );
					values[ c ][ i ] = interpolated.get().get();
				}

				baseWeights[ i ] = ( float ) FeatherWeights.getWeight( tilePosition, cropMin, cropMax, Math.max( 1, params.getFeatherPx() ) );
				for ( int k = 0; k < numBands; ++k )
					bandWeights[ k ][ i ] = ( float ) FeatherWeights.getWeight( tilePosition, cropMin, cropMax, FeatherWeights.getBandRamp( k, numBands, params.getFeatherPx() ) );
			}
		}

		final float[][][] bands = BandDecomposition.decompose( values, coverage, width, height, numBands );

		return new TileContribution( tile.getIndex(), interval, coverage, values, baseWeights, bandWeights, bands );
	}

	/**
	 * Share of every tile in the final value of a canvas pixel: the tile's band weight divided by the total weight,
	 * averaged over the bands. On protected pixels the authoritative tile has weight 1.
	 *
	 * @return weights in the order of {@code tiles}, all zero for a gap pixel
	 */
	public double[] getEffectiveWeights(
			final Canvas canvas,
			final List< TileRecord > tiles,
			final Placement[] placements,
			final long x,
			final long y )
	{
		final double[] effectiveWeights = new double[ tiles.size() ];
		final int authority = canvas.getAuthority( x, y );
		for ( int t = 0; t < tiles.size(); ++t )
		{
			final TileRecord tile = tiles.get( t );
			if ( authority >= 0 )
			{
				effectiveWeights[ t ] = tile.getIndex() == authority ? 1 : 0;
				continue;
			}

			final double[] bandWeights = getBandWeights( tile, placements[ tile.getIndex() ], x, y );
			if ( bandWeights == null )
				continue;

			double sum = 0;
			for ( int k = 0; k < bandWeights.length; ++k )
			{
				final double total = canvas.getWeight( k, x, y );
				if ( total > 0 )
					sum += bandWeights[ k ] / total;
			}
			effectiveWeights[ t ] = sum / bandWeights.length;
		}
		return effectiveWeights;
	}

	/**
	 * @return band weights of the tile at a canvas pixel, or {@code null} if the tile does not cover it
	 */
	double[] getBandWeights( final TileRecord tile, final Placement placement, final long x, final long y )
	{
		final double[] cropMin = new double[ 2 ], cropMax = new double[ 2 ];
		if ( !getCroppedBounds( tile, cropMin, cropMax ) )
			return null;

		final double[] tilePosition = new double[ 2 ];
		tile.getTransform( placement ).applyInverse( tilePosition, new double[] { x, y } );
		if ( !isInside( tilePosition, cropMin, cropMax ) )
			return null;

		final RandomAccess< BitType > maskRandomAccess = tile.getContentMask().randomAccess();
		maskRandomAccess.setPosition( Math.round( tilePosition[ 0 ] ), 0 );
		maskRandomAccess.setPosition( Math.round( tilePosition[ 1 ] ), 1 );
		if ( !maskRandomAccess.get().get() )
			return null;

		final double[] bandWeights = new double[ params.getNumBands() ];
		for ( int k = 0; k < bandWeights.length; ++k )
			bandWeights[ k ] = ( float ) FeatherWeights.getWeight( tilePosition, cropMin, cropMax, FeatherWeights.getBandRamp( k, bandWeights.length, params.getFeatherPx() ) );
		return bandWeights;
	}

	private boolean getCroppedBounds( final TileRecord tile, final double[] cropMin, final double[] cropMax )
	{
		for ( int d = 0; d < 2; ++d )
		{
			cropMin[ d ] = params.getBorderCropPx();
			cropMax[ d ] = tile.getSize( d ) - 1 - params.getBorderCropPx();
			if ( cropMax[ d ] < cropMin[ d ] )
				return false;
		}
		return true;
	}

	private static boolean isInside( final double[] position, final double[] min, final double[] max )
	{
		for ( int d = 0; d < position.length; ++d )
			if ( position[ d ] < min[ d ] - EPSILON || position[ d ] > max[ d ] + EPSILON )
				return false;
		return true;
	}

	private static Interval getResampledInterval( final RealInterval footprint, final Interval bounds )
	{
		final long[] min = new long[ 2 ], max = new long[ 2 ];
		for ( int d = 0; d < 2; ++d )
		{
			min[ d ] = ( long ) Math.floor( footprint.realMin( d ) );
			max[ d ] = ( long ) Math.ceil( footprint.realMax( d ) );
		}
		final Interval interval = Intervals.intersect( new FinalInterval( min, max ), bounds );
		return Intervals.isEmpty( interval ) ? null : interval;
	}
}
