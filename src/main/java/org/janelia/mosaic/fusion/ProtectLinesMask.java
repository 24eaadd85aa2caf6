package org.janelia.mosaic.fusion;

import java.util.Arrays;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.util.Intervals;

/**
 * Canvas pixels that must not be blended across tiles, e.g. map neatlines or grid lines.
 * Each protected pixel may name the tile that is authoritative for it.
 */
public class ProtectLinesMask
{
	public static final int NO_AUTHORITY = -1;

	private final Interval interval;
	private final int width;
	private final boolean[] mask;
	private final int[] authority;
	private long numProtected;

	public ProtectLinesMask( final Interval interval )
	{
		this.interval = new FinalInterval( interval );
		final long size = Intervals.numElements( interval );
		if ( size > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "protect lines mask is too large: " + size );
		this.width = ( int ) interval.dimension( 0 );
		this.mask = new boolean[ ( int ) size ];
		this.authority = new int[ ( int ) size ];
		Arrays.fill( authority, NO_AUTHORITY );
	}

	public Interval getInterval()
	{
		return interval;
	}

	public long getNumProtected()
	{
		return numProtected;
	}

	public void setProtected( final long x, final long y )
	{
		setProtected( x, y, NO_AUTHORITY );
	}

	/**
	 * @param tileIndex authoritative tile, or {@link #NO_AUTHORITY} to let the strongest covering tile win
	 */
	public void setProtected( final long x, final long y, final int tileIndex )
	{
		final int i = index( x, y );
		if ( i < 0 )
			throw new IllegalArgumentException( "(" + x + ", " + y + ") is outside of the mask" );
		if ( !mask[ i ] )
			++numProtected;
		mask[ i ] = true;
		authority[ i ] = tileIndex;
	}

	public boolean isProtected( final long x, final long y )
	{
		final int i = index( x, y );
		return i >= 0 && mask[ i ];
	}

	public int getAuthority( final long x, final long y )
	{
		final int i = index( x, y );
		return i >= 0 ? authority[ i ] : NO_AUTHORITY;
	}

	private int index( final long x, final long y )
	{
		if ( x < interval.min( 0 ) || y < interval.min( 1 ) || x > interval.max( 0 ) || y > interval.max( 1 ) )
			return -1;
		return ( int ) ( ( y - interval.min( 1 ) ) * width + ( x - interval.min( 0 ) ) );
	}
}
