package org.janelia.mosaic;

import net.imglib2.Interval;

/**
 * Correlation window of an {@link OverlapRegion}: a strip around the nominal seam line in canvas coordinates.
 */
public class SeamBand
{
	private final Interval interval;
	private final int normalAxis;

	public SeamBand( final Interval interval, final int normalAxis )
	{
		this.interval = interval;
		this.normalAxis = normalAxis;
	}

	public Interval getInterval() { return interval; }
	public int getNormalAxis() { return normalAxis; }

	public long width()
	{
		return interval.dimension( normalAxis );
	}

	public long length()
	{
		return interval.dimension( 1 - normalAxis );
	}
}
