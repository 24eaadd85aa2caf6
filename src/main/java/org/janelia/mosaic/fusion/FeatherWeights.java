package org.janelia.mosaic.fusion;

/**
 * Blending weight of a tile pixel based on its distance to the edges of the cropped tile.
 * <p>
 * The normalized distances along both axes are multiplied and shaped by a cosine falloff, so the weight
 * is 1 in the interior and smoothly decreases towards the edges without ever reaching zero.
 */
public class FeatherWeights
{
	public static final double MIN_WEIGHT = 1e-7;

	/**
	 * @param position pixel position in tile coordinates
	 * @param min first pixel of the cropped tile along each axis
	 * @param max last pixel of the cropped tile along each axis
	 * @param ramp width of the transition zone in pixels
	 */
	public static double getWeight( final double[] position, final double[] min, final double[] max, final double ramp )
	{
		// compute multiplicative distance to the respective borders [0...1]
		double minDistance = 1;

		for ( int d = 0; d < position.length; ++d )
		{
			// the distance to the border that is closer
			final double value = Math.max( 0, Math.min( position[ d ] - min[ d ], max[ d ] - position[ d ] ) ) + 1;
			if ( value < ramp )
				minDistance *= value / ramp;
		}

		if ( minDistance >= 1 )
			return 1;
		else if ( minDistance <= 0 )
			return MIN_WEIGHT;
		else
			return Math.max( MIN_WEIGHT, ( Math.cos( ( 1 - minDistance ) * Math.PI ) + 1 ) / 2 );
	}

	/**
	 * @return ramp width of the given band, coarse bands blending over wider ramps than fine ones
	 */
	public static double getBandRamp( final int band, final int numBands, final double featherPx )
	{
		return Math.max( 1, featherPx * Math.pow( 2, band - ( numBands - 1 ) ) );
	}
}
