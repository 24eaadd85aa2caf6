package org.janelia.mosaic.photometric;

import java.util.List;

import org.janelia.mosaic.histogram.Histogram;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Mean, standard deviation and histogram of the luminance of the content pixels of a tile.
 */
public class LuminanceStatistics
{
	public static final int NUM_BINS = 256;

	private final Histogram histogram;
	private long count;
	// running mean and sum of squared deviations, a constant tile yields exactly zero variance
	private double mean, m2;

	public LuminanceStatistics( final double maxValue )
	{
		histogram = new Histogram( 0, maxValue + 1, NUM_BINS );
	}

	/**
	 * Collects the luminance of every pixel where {@code mask} is set.
	 *
	 * @param pixels (x, y, channel) buffer with 1 or 3 channels
	 */
	public static LuminanceStatistics compute(
			final RandomAccessibleInterval< FloatType > pixels,
			final RandomAccessibleInterval< BitType > mask,
			final double maxValue )
	{
		final LuminanceStatistics stats = new LuminanceStatistics( maxValue );
		final long width = pixels.dimension( 0 ), height = pixels.dimension( 1 );
		final boolean color = pixels.dimension( 2 ) >= 3;

		final RandomAccess< FloatType > pixelsRandomAccess = pixels.randomAccess();
		final RandomAccess< BitType > maskRandomAccess = mask.randomAccess();
		for ( long y = 0; y < height; ++y )
		{
			for ( long x = 0; x < width; ++x )
			{
				maskRandomAccess.setPosition( x, 0 );
				maskRandomAccess.setPosition( y, 1 );
				if ( !maskRandomAccess.get().get() )
					continue;

				stats.put( luminance( pixelsRandomAccess, x, y, color ) );
			}
		}
		return stats;
	}

	static double luminance( final RandomAccess< FloatType > pixelsRandomAccess, final long x, final long y, final boolean color )
	{
		pixelsRandomAccess.setPosition( x, 0 );
		pixelsRandomAccess.setPosition( y, 1 );
		pixelsRandomAccess.setPosition( 0, 2 );
		final double r = pixelsRandomAccess.get().getRealDouble();
		if ( !color )
			return r;
		pixelsRandomAccess.fwd( 2 );
		final double g = pixelsRandomAccess.get().getRealDouble();
		pixelsRandomAccess.fwd( 2 );
		final double b = pixelsRandomAccess.get().getRealDouble();
		return ColorSpace.luminance( r, g, b );
	}

	/**
	 * @return statistics of the union of all pixels collected by {@code statistics}
	 */
	public static LuminanceStatistics pool( final List< LuminanceStatistics > statistics, final double maxValue )
	{
		final LuminanceStatistics pooled = new LuminanceStatistics( maxValue );
		for ( final LuminanceStatistics stats : statistics )
		{
			pooled.histogram.add( stats.histogram );
			if ( stats.count == 0 )
				continue;
			final long total = pooled.count + stats.count;
			final double delta = stats.mean - pooled.mean;
			pooled.mean += delta * stats.count / total;
			pooled.m2 += stats.m2 + delta * delta * ( ( double ) pooled.count * stats.count / total );
			pooled.count = total;
		}
		return pooled;
	}

	public void put( final double luminance )
	{
		histogram.put( luminance );
		++count;
		final double delta = luminance - mean;
		mean += delta / count;
		m2 += delta * ( luminance - mean );
	}

	public long getCount() { return count; }
	public Histogram getHistogram() { return histogram; }

	public boolean isEmpty()
	{
		return count == 0;
	}

	public double getMean()
	{
		return mean;
	}

	public double getStandardDeviation()
	{
		if ( count == 0 )
			return 0;
		return Math.sqrt( Math.max( 0, m2 / count ) );
	}

	@Override
	public String toString()
	{
		return String.format( "(n=%d, mean=%.3f, std=%.3f)", count, getMean(), getStandardDeviation() );
	}
}
