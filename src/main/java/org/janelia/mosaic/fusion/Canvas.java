package org.janelia.mosaic.fusion;

import java.util.Arrays;

import org.janelia.mosaic.PipelineExecutionException;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;

/**
 * Accumulation buffers of the composite image.
 * <p>
 * For every frequency band the canvas keeps the weighted sum of tile values per channel and the sum of weights.
 * The final value of a pixel is the sum over the bands of the weighted mean of that band.
 * Protected pixels hold the value of their authoritative tile instead, and gap pixels may be filled explicitly.
 * All coordinates are canvas coordinates within {@link #getInterval()}.
 */
public class Canvas
{
	private final Interval interval;
	private final int width, height;
	private final int numChannels, numBands;
	private final double maxValue;

	private final float[][][] sums;
	private final float[][] weights;

	private final int[] authorityTile;
	private final float[] authorityWeight;
	private final float[][] authorityValues;

	private final boolean[] filled;
	private final float[][] filledValues;

	private Canvas( final Interval interval, final int numChannels, final int numBands, final double maxValue )
	{
		this.interval = new FinalInterval( interval );
		this.width = ( int ) interval.dimension( 0 );
		this.height = ( int ) interval.dimension( 1 );
		this.numChannels = numChannels;
		this.numBands = numBands;
		this.maxValue = maxValue;

		final int numPixels = width * height;
		sums = new float[ numBands ][ numChannels ][ numPixels ];
		weights = new float[ numBands ][ numPixels ];
		authorityTile = new int[ numPixels ];
		Arrays.fill( authorityTile, ProtectLinesMask.NO_AUTHORITY );
		authorityWeight = new float[ numPixels ];
		authorityValues = new float[ numChannels ][ numPixels ];
		filled = new boolean[ numPixels ];
		filledValues = new float[ numChannels ][ numPixels ];
	}

	/**
	 * @throws PipelineExecutionException if the buffers cannot be allocated
	 */
	public static Canvas allocate( final Interval interval, final int numChannels, final int numBands, final double maxValue ) throws PipelineExecutionException
	{
		final long numPixels = Intervals.numElements( interval );
		if ( numPixels <= 0 || numPixels > Integer.MAX_VALUE )
			throw new PipelineExecutionException( "Cannot allocate canvas of size " + Arrays.toString( Intervals.dimensionsAsLongArray( interval ) ) );

		try
		{
			return new Canvas( interval, numChannels, numBands, maxValue );
		}
		catch ( final OutOfMemoryError e )
		{
			throw new PipelineExecutionException( "Not enough memory for canvas of size " + Arrays.toString( Intervals.dimensionsAsLongArray( interval ) ) + " with " + numBands + " bands", e );
		}
	}

	public Interval getInterval() { return interval; }
	public int getNumChannels() { return numChannels; }
	public int getNumBands() { return numBands; }
	public double getMaxValue() { return maxValue; }

	public boolean contains( final long x, final long y )
	{
		return x >= interval.min( 0 ) && y >= interval.min( 1 ) && x <= interval.max( 0 ) && y <= interval.max( 1 );
	}

	int index( final long x, final long y )
	{
		return ( int ) ( ( y - interval.min( 1 ) ) * width + ( x - interval.min( 0 ) ) );
	}

	/**
	 * Adds the part of the contribution that lies within {@code region}.
	 * Pixels under the protect lines mask are not blended: the contribution replaces the stored value
	 * if it comes from the designated tile or, when there is none, if it has a higher base weight than the current one.
	 */
	public synchronized void accumulate( final TileContribution contribution, final Interval region, final ProtectLinesMask protectLines )
	{
		final Interval target = Intervals.intersect( Intervals.intersect( contribution.getInterval(), region ), interval );
		if ( Intervals.isEmpty( target ) )
			return;

		final Interval source = contribution.getInterval();
		final int sourceWidth = ( int ) source.dimension( 0 );
		final int tileIndex = contribution.getTileIndex();

		for ( long y = target.min( 1 ); y <= target.max( 1 ); ++y )
		{
			for ( long x = target.min( 0 ); x <= target.max( 0 ); ++x )
			{
				final int i = ( int ) ( ( y - source.min( 1 ) ) * sourceWidth + ( x - source.min( 0 ) ) );
				if ( !contribution.isCovered( i ) )
					continue;

				final int j = index( x, y );
				if ( protectLines != null && protectLines.isProtected( x, y ) )
				{
					if ( isAuthoritative( tileIndex, contribution.getBaseWeight( i ), j, protectLines.getAuthority( x, y ) ) )
					{
						authorityTile[ j ] = tileIndex;
						authorityWeight[ j ] = contribution.getBaseWeight( i );
						for ( int c = 0; c < numChannels; ++c )
							authorityValues[ c ][ j ] = contribution.getValue( Math.min( c, contribution.getNumChannels() - 1 ), i );
					}
					continue;
				}

				for ( int k = 0; k < numBands; ++k )
				{
					final float weight = contribution.getBandWeight( k, i );
					weights[ k ][ j ] += weight;
					for ( int c = 0; c < numChannels; ++c )
						sums[ k ][ c ][ j ] += weight * contribution.getBandValue( k, Math.min( c, contribution.getNumChannels() - 1 ), i );
				}
			}
		}
	}

	private boolean isAuthoritative( final int tileIndex, final float baseWeight, final int j, final int designated )
	{
		if ( designated == tileIndex )
			return true;

		final int current = authorityTile[ j ];
		if ( current == ProtectLinesMask.NO_AUTHORITY )
			return true;
		if ( current == designated )
			return false;

		// tiles are accumulated in index order, so ties stay with the lower index
		return baseWeight > authorityWeight[ j ];
	}

	/**
	 * Resets all buffers within {@code region}.
	 */
	public synchronized void clear( final Interval region )
	{
		final Interval target = Intervals.intersect( region, interval );
		if ( Intervals.isEmpty( target ) )
			return;

		for ( long y = target.min( 1 ); y <= target.max( 1 ); ++y )
		{
			for ( long x = target.min( 0 ); x <= target.max( 0 ); ++x )
			{
				final int j = index( x, y );
				for ( int k = 0; k < numBands; ++k )
				{
					weights[ k ][ j ] = 0;
					for ( int c = 0; c < numChannels; ++c )
						sums[ k ][ c ][ j ] = 0;
				}
				authorityTile[ j ] = ProtectLinesMask.NO_AUTHORITY;
				authorityWeight[ j ] = 0;
				filled[ j ] = false;
				for ( int c = 0; c < numChannels; ++c )
				{
					authorityValues[ c ][ j ] = 0;
					filledValues[ c ][ j ] = 0;
				}
			}
		}
	}

	/**
	 * @return {@code true} if any tile contributes to the pixel
	 */
	public synchronized boolean hasContribution( final long x, final long y )
	{
		final int j = index( x, y );
		return weights[ 0 ][ j ] > 0 || authorityTile[ j ] != ProtectLinesMask.NO_AUTHORITY;
	}

	/**
	 * @return {@code true} if the pixel has a value, either from the tiles or from gap filling
	 */
	public synchronized boolean isCovered( final long x, final long y )
	{
		return hasContribution( x, y ) || filled[ index( x, y ) ];
	}

	public synchronized boolean isFilled( final long x, final long y )
	{
		return filled[ index( x, y ) ];
	}

	public synchronized float getWeight( final int band, final long x, final long y )
	{
		return weights[ band ][ index( x, y ) ];
	}

	/**
	 * @return the tile that holds a protected pixel, or {@link ProtectLinesMask#NO_AUTHORITY}
	 */
	public synchronized int getAuthority( final long x, final long y )
	{
		return authorityTile[ index( x, y ) ];
	}

	/**
	 * Sets the value of a gap pixel and marks it as covered.
	 */
	public synchronized void fill( final long x, final long y, final double[] values )
	{
		final int j = index( x, y );
		filled[ j ] = true;
		for ( int c = 0; c < numChannels; ++c )
			filledValues[ c ][ j ] = ( float ) values[ c ];
	}

	/**
	 * Reverts a pixel to a gap if it was filled.
	 */
	public synchronized void unfill( final long x, final long y )
	{
		final int j = index( x, y );
		filled[ j ] = false;
		for ( int c = 0; c < numChannels; ++c )
			filledValues[ c ][ j ] = 0;
	}

	/**
	 * Computes the final value of a pixel.
	 *
	 * @return {@code false} if the pixel is a gap, in which case {@code values} are set to 0
	 */
	public synchronized boolean getValue( final long x, final long y, final double[] values )
	{
		final int j = index( x, y );
		if ( authorityTile[ j ] != ProtectLinesMask.NO_AUTHORITY )
		{
			for ( int c = 0; c < numChannels; ++c )
				values[ c ] = authorityValues[ c ][ j ];
			return true;
		}

		if ( weights[ 0 ][ j ] > 0 )
		{
			for ( int c = 0; c < numChannels; ++c )
			{
				double value = 0;
				for ( int k = 0; k < numBands; ++k )
					value += sums[ k ][ c ][ j ] / weights[ k ][ j ];
				values[ c ] = Math.max( 0, Math.min( maxValue, value ) );
			}
			return true;
		}

		if ( filled[ j ] )
		{
			for ( int c = 0; c < numChannels; ++c )
				values[ c ] = filledValues[ c ][ j ];
			return true;
		}

		Arrays.fill( values, 0, numChannels, 0 );
		return false;
	}

	/**
	 * @return composite image (x, y, channel) with origin at the canvas min, gaps are 0
	 */
	public RandomAccessibleInterval< FloatType > getImage()
	{
		final ArrayImg< FloatType, FloatArray > image = ArrayImgs.floats( width, height, numChannels );
		final RandomAccess< FloatType > imageRandomAccess = image.randomAccess();
		final double[] values = new double[ numChannels ];
		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				getValue( interval.min( 0 ) + x, interval.min( 1 ) + y, values );
				imageRandomAccess.setPosition( x, 0 );
				imageRandomAccess.setPosition( y, 1 );
				for ( int c = 0; c < numChannels; ++c )
				{
					imageRandomAccess.setPosition( c, 2 );
					imageRandomAccess.get().setReal( values[ c ] );
				}
			}
		}
		return image;
	}

	/**
	 * @return coverage map with origin at the canvas min
	 */
	public RandomAccessibleInterval< BitType > getCoverage()
	{
		final ArrayImg< BitType, LongArray > coverage = ArrayImgs.bits( width, height );
		final Cursor< BitType > cursor = coverage.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			cursor.get().set( isCovered( interval.min( 0 ) + cursor.getLongPosition( 0 ), interval.min( 1 ) + cursor.getLongPosition( 1 ) ) );
		}
		return coverage;
	}
}
