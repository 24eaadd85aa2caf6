package org.janelia.mosaic.alignment;

import org.janelia.mosaic.OverlapRegion;

/**
 * Outcome of correlating the seam band of an {@link OverlapRegion}:
 * the best offset of tile b relative to tile a, the estimated score at that offset and the score at the current placement.
 */
public class CorrelationResult
{
	private final OverlapRegion region;
	private final double[] offset;
	private final double peakScore;
	private final double currentScore;

	public CorrelationResult( final OverlapRegion region, final double[] offset, final double peakScore, final double currentScore )
	{
		this.region = region;
		this.offset = offset;
		this.peakScore = peakScore;
		this.currentScore = currentScore;
	}

	/**
	 * @return result for a region that has no usable signal
	 */
	public static CorrelationResult undefined( final OverlapRegion region )
	{
		return new CorrelationResult( region, new double[ 2 ], Double.NaN, Double.NaN );
	}

	public OverlapRegion getRegion() { return region; }
	public double[] getOffset() { return offset; }
	public double getPeakScore() { return peakScore; }
	public double getCurrentScore() { return currentScore; }

	public boolean isDefined()
	{
		return !Double.isNaN( peakScore );
	}

	public double getOffsetMagnitude()
	{
		return Math.sqrt( offset[ 0 ] * offset[ 0 ] + offset[ 1 ] * offset[ 1 ] );
	}

	/**
	 * @return estimated gain of moving to the peak, a missing current score counts as no correlation
	 */
	public double getImprovement()
	{
		if ( !isDefined() )
			return 0;
		return peakScore - ( Double.isNaN( currentScore ) ? -1 : currentScore );
	}

	@Override
	public String toString()
	{
		return String.format( "%s: offset=(%.3f, %.3f), peak=%.5f, current=%.5f", region, offset[ 0 ], offset[ 1 ], peakScore, currentScore );
	}
}
