package org.janelia.mosaic.gap;

import java.util.Arrays;
import java.util.PriorityQueue;

import org.janelia.mosaic.fusion.Canvas;

import net.imglib2.Interval;
import net.imglib2.util.Intervals;

/**
 * Fast marching inpainting (A. Telea, 2004).
 * <p>
 * Pixels are filled in the order of their distance from the known boundary. Each pixel takes a weighted average of the
 * known pixels within {@code radius}, weighted by inverse squared distance, by alignment with the marching direction
 * and by the difference of arrival times. Pixels that were filled earlier are known to the pixels filled later.
 */
public class TeleaInpainter implements GapFiller
{
	private static final byte KNOWN = 0, BAND = 1, INSIDE = 2, OUTSIDE = 3;
	private static final double INF = 1e6;

	private final int radius;

	public TeleaInpainter( final int radius )
	{
		this.radius = radius;
	}

	@Override
	public long fill( final Canvas canvas, final Interval region, final boolean[] toFill )
	{
		// known pixels up to the radius around the region take part in the averaging
		final Interval work = Intervals.intersect( Intervals.expand( region, radius + 1 ), canvas.getInterval() );
		final int width = ( int ) work.dimension( 0 ), height = ( int ) work.dimension( 1 );
		final long minX = work.min( 0 ), minY = work.min( 1 );
		final int numPixels = width * height;

		final byte[] flags = new byte[ numPixels ];
		final double[] times = new double[ numPixels ];
		final int regionWidth = ( int ) region.dimension( 0 );

		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				final int i = y * width + x;
				final long cx = minX + x, cy = minY + y;
				if ( cx >= region.min( 0 ) && cy >= region.min( 1 ) && cx <= region.max( 0 ) && cy <= region.max( 1 )
						&& toFill[ ( int ) ( ( cy - region.min( 1 ) ) * regionWidth + ( cx - region.min( 0 ) ) ) ] )
				{
					flags[ i ] = INSIDE;
					times[ i ] = INF;
				}
				else
				{
					flags[ i ] = canvas.hasContribution( cx, cy ) ? KNOWN : OUTSIDE;
				}
			}
		}

		// ordered by arrival time, then by index, so the marching order is deterministic
		final PriorityQueue< long[] > band = new PriorityQueue<>( ( a, b ) -> {
			final int cmp = Double.compare( Double.longBitsToDouble( a[ 0 ] ), Double.longBitsToDouble( b[ 0 ] ) );
			return cmp != 0 ? cmp : Long.compare( a[ 1 ], b[ 1 ] );
		} );

		for ( int i = 0; i < numPixels; ++i )
		{
			if ( flags[ i ] != KNOWN )
				continue;
			final int x = i % width, y = i / width;
			if ( hasNeighbor( flags, width, height, x, y, INSIDE ) )
			{
				flags[ i ] = BAND;
				band.add( new long[] { Double.doubleToLongBits( 0 ), i } );
			}
		}

		final int numChannels = canvas.getNumChannels();
		final double[] values = new double[ numChannels ], sums = new double[ numChannels ];
		final int[] dx = { -1, 1, 0, 0 }, dy = { 0, 0, -1, 1 };

		while ( !band.isEmpty() )
		{
			final int p = ( int ) band.poll()[ 1 ];
			if ( flags[ p ] == KNOWN )
				continue;
			flags[ p ] = KNOWN;

			final int px = p % width, py = p / width;
			for ( int n = 0; n < 4; ++n )
			{
				final int qx = px + dx[ n ], qy = py + dy[ n ];
				if ( qx < 0 || qy < 0 || qx >= width || qy >= height )
					continue;
				final int q = qy * width + qx;
				if ( flags[ q ] != INSIDE )
					continue;

				times[ q ] = Math.min(
						Math.min( solve( flags, times, width, height, qx - 1, qy, qx, qy - 1 ), solve( flags, times, width, height, qx + 1, qy, qx, qy - 1 ) ),
						Math.min( solve( flags, times, width, height, qx - 1, qy, qx, qy + 1 ), solve( flags, times, width, height, qx + 1, qy, qx, qy + 1 ) ) );

				inpaint( canvas, flags, times, width, height, minX, minY, qx, qy, values, sums );
				flags[ q ] = BAND;
				band.add( new long[] { Double.doubleToLongBits( times[ q ] ), q } );
			}
		}

		long unfilled = 0;
		for ( int i = 0; i < numPixels; ++i )
			if ( flags[ i ] == INSIDE )
				++unfilled;
		return unfilled;
	}

	private void inpaint(
			final Canvas canvas,
			final byte[] flags,
			final double[] times,
			final int width,
			final int height,
			final long minX,
			final long minY,
			final int qx,
			final int qy,
			final double[] values,
			final double[] sums )
	{
		final int q = qy * width + qx;
		final double gradX = gradient( flags, times, width, qx, qy, 1, 0, qx > 0, qx < width - 1 );
		final double gradY = gradient( flags, times, width, qx, qy, 0, 1, qy > 0, qy < height - 1 );
		final double gradNorm = Math.sqrt( gradX * gradX + gradY * gradY );

		double weightSum = 0;
		Arrays.fill( sums, 0 );
		for ( int ky = Math.max( 0, qy - radius ); ky <= Math.min( height - 1, qy + radius ); ++ky )
		{
			for ( int kx = Math.max( 0, qx - radius ); kx <= Math.min( width - 1, qx + radius ); ++kx )
			{
				final int k = ky * width + kx;
				if ( k == q || ( flags[ k ] != KNOWN && flags[ k ] != BAND ) )
					continue;

				final double rx = qx - kx, ry = qy - ky;
				final double distanceSquared = rx * rx + ry * ry;
				if ( distanceSquared > radius * radius )
					continue;

				final double distance = Math.sqrt( distanceSquared );
				final double dir = gradNorm > 0 ? Math.max( 1e-6, Math.abs( rx * gradX + ry * gradY ) / ( distance * gradNorm ) ) : 1;
				final double lev = 1.0 / ( 1 + Math.abs( times[ k ] - times[ q ] ) );
				final double weight = dir * lev / distanceSquared;

				canvas.getValue( minX + kx, minY + ky, values );
				for ( int c = 0; c < values.length; ++c )
					sums[ c ] += weight * values[ c ];
				weightSum += weight;
			}
		}

		if ( weightSum > 0 )
		{
			for ( int c = 0; c < sums.length; ++c )
				sums[ c ] /= weightSum;
			canvas.fill( minX + qx, minY + qy, sums );
		}
	}

	private static double gradient(
			final byte[] flags,
			final double[] times,
			final int width,
			final int x,
			final int y,
			final int stepX,
			final int stepY,
			final boolean hasPrev,
			final boolean hasNext )
	{
		final int i = y * width + x;
		final int prev = ( y - stepY ) * width + ( x - stepX ), next = ( y + stepY ) * width + ( x + stepX );
		final boolean prevKnown = hasPrev && flags[ prev ] != INSIDE && flags[ prev ] != OUTSIDE;
		final boolean nextKnown = hasNext && flags[ next ] != INSIDE && flags[ next ] != OUTSIDE;
		if ( prevKnown && nextKnown )
			return ( times[ next ] - times[ prev ] ) / 2;
		if ( nextKnown )
			return times[ next ] - times[ i ];
		if ( prevKnown )
			return times[ i ] - times[ prev ];
		return 0;
	}

	/**
	 * Solves the eikonal equation |grad T| = 1 at a pixel from one horizontal and one vertical neighbor.
	 */
	private static double solve( final byte[] flags, final double[] times, final int width, final int height, final int x1, final int y1, final int x2, final int y2 )
	{
		final boolean known1 = isKnown( flags, width, height, x1, y1 ), known2 = isKnown( flags, width, height, x2, y2 );
		final double t1 = known1 ? times[ y1 * width + x1 ] : INF, t2 = known2 ? times[ y2 * width + x2 ] : INF;

		if ( known1 && known2 )
		{
			final double r = Math.sqrt( Math.max( 0, 2 - ( t1 - t2 ) * ( t1 - t2 ) ) );
			double s = ( t1 + t2 - r ) / 2;
			if ( s >= t1 && s >= t2 )
				return s;
			s += r;
			if ( s >= t1 && s >= t2 )
				return s;
			return 1 + Math.min( t1, t2 );
		}
		if ( known1 )
			return 1 + t1;
		if ( known2 )
			return 1 + t2;
		return INF;
	}

	private static boolean isKnown( final byte[] flags, final int width, final int height, final int x, final int y )
	{
		return x >= 0 && y >= 0 && x < width && y < height && flags[ y * width + x ] == KNOWN;
	}

	private static boolean hasNeighbor( final byte[] flags, final int width, final int height, final int x, final int y, final byte flag )
	{
		return ( x > 0 && flags[ y * width + x - 1 ] == flag )
				|| ( x < width - 1 && flags[ y * width + x + 1 ] == flag )
				|| ( y > 0 && flags[ ( y - 1 ) * width + x ] == flag )
				|| ( y < height - 1 && flags[ ( y + 1 ) * width + x ] == flag );
	}
}
