package org.janelia.mosaic.gap;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedByteType;

/**
 * Gap masks of a canvas region before and after gap filling, 255 marking a gap.
 */
public class GapReport
{
	public static final byte GAP = ( byte ) 255;

	private final Interval interval;
	private final byte[] before, after;
	private final int componentsFilled, componentsLeft;

	public GapReport( final Interval interval, final byte[] before, final byte[] after, final int componentsFilled, final int componentsLeft )
	{
		this.interval = new FinalInterval( interval );
		this.before = before;
		this.after = after;
		this.componentsFilled = componentsFilled;
		this.componentsLeft = componentsLeft;
	}

	/**
	 * @return canvas region the masks describe
	 */
	public Interval getInterval() { return interval; }

	public int getComponentsFilled() { return componentsFilled; }
	public int getComponentsLeft() { return componentsLeft; }

	public long getGapPixelsBefore()
	{
		return count( before );
	}

	public long getGapPixelsAfter()
	{
		return count( after );
	}

	public boolean isGapBefore( final long x, final long y )
	{
		return before[ index( x, y ) ] == GAP;
	}

	public boolean isGapAfter( final long x, final long y )
	{
		return after[ index( x, y ) ] == GAP;
	}

	/**
	 * @return mask with origin at the region min
	 */
	public RandomAccessibleInterval< UnsignedByteType > getGapMaskBefore()
	{
		return ArrayImgs.unsignedBytes( before, interval.dimension( 0 ), interval.dimension( 1 ) );
	}

	public RandomAccessibleInterval< UnsignedByteType > getGapMaskAfter()
	{
		return ArrayImgs.unsignedBytes( after, interval.dimension( 0 ), interval.dimension( 1 ) );
	}

	/**
	 * Copies the masks of a local rerun into this report. {@code local} must lie within this report's region.
	 */
	public void update( final GapReport local )
	{
		final Interval region = local.getInterval();
		for ( long y = region.min( 1 ); y <= region.max( 1 ); ++y )
		{
			for ( long x = region.min( 0 ); x <= region.max( 0 ); ++x )
			{
				final int i = index( x, y ), j = local.index( x, y );
				before[ i ] = local.before[ j ];
				after[ i ] = local.after[ j ];
			}
		}
	}

	private int index( final long x, final long y )
	{
		return ( int ) ( ( y - interval.min( 1 ) ) * interval.dimension( 0 ) + ( x - interval.min( 0 ) ) );
	}

	private static long count( final byte[] mask )
	{
		long count = 0;
		for ( final byte value : mask )
			if ( value == GAP )
				++count;
		return count;
	}
}
