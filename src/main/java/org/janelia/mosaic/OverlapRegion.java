package org.janelia.mosaic;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;

/**
 * Ordered pair of tiles (by index) together with the intersection of their placed footprints in canvas coordinates.
 * The seam normal is the axis along which the intersection is thinner.
 */
public class OverlapRegion
{
	private final int indexA, indexB;
	private final Interval interval;
	private final int normalAxis;
	private final boolean degenerate;

	public OverlapRegion( final int indexA, final int indexB, final Interval interval, final int normalAxis, final boolean degenerate )
	{
		if ( indexA >= indexB )
			throw new IllegalArgumentException( "overlap regions are ordered pairs, got (" + indexA + "," + indexB + ")" );
		this.indexA = indexA;
		this.indexB = indexB;
		this.interval = interval;
		this.normalAxis = normalAxis;
		this.degenerate = degenerate;
	}

	public int getIndexA() { return indexA; }
	public int getIndexB() { return indexB; }
	public Interval getInterval() { return interval; }
	public int getNormalAxis() { return normalAxis; }

	/**
	 * @return {@code true} if the overlap is too small or malformed to be matched
	 */
	public boolean isDegenerate() { return degenerate; }

	public boolean involves( final int index )
	{
		return indexA == index || indexB == index;
	}

	public boolean sharesTileWith( final OverlapRegion other )
	{
		return involves( other.indexA ) || involves( other.indexB );
	}

	public int other( final int index )
	{
		if ( index == indexA )
			return indexB;
		if ( index == indexB )
			return indexA;
		throw new IllegalArgumentException( "tile " + index + " is not part of " + this );
	}

	/**
	 * Seam band of the given width along the seam normal, centered on the seam line of this overlap
	 * and spanning the overlap along the seam.
	 */
	public SeamBand getSeamBand( final int seamBandPx )
	{
		final long[] min = new long[ 2 ], max = new long[ 2 ];
		interval.min( min );
		interval.max( max );

		final double center = ( interval.min( normalAxis ) + interval.max( normalAxis ) ) / 2.0;
		min[ normalAxis ] = ( long ) Math.ceil( center - seamBandPx / 2.0 );
		max[ normalAxis ] = min[ normalAxis ] + Math.max( seamBandPx, 1 ) - 1;

		return new SeamBand( new FinalInterval( min, max ), normalAxis );
	}

	@Override
	public String toString()
	{
		return "(" + indexA + "," + indexB + ")";
	}
}
