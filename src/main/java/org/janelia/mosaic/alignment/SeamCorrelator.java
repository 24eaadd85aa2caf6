package org.janelia.mosaic.alignment;

import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.OverlapRegion;
import org.janelia.mosaic.Placement;

import net.imglib2.Interval;
import net.imglib2.util.Intervals;

/**
 * Finds the offset of tile b relative to tile a that maximizes the normalized cross-correlation of their luminance
 * within the seam band of an overlap region.
 * <p>
 * Integer offsets are searched exhaustively within {@code min(search_radius_px, overlap_max)}. Among equal scores the
 * smallest displacement wins, then the lexicographically smallest (dy, dx). The winner is refined with a separable
 * parabolic fit that also estimates the score at the sub-pixel peak.
 */
public class SeamCorrelator
{
	private static final double TIE_EPSILON = 1e-12;
	private static final double VARIANCE_EPSILON = 1e-9;

	private final int seamBandPx;
	private final int searchRadius;
	private final int minOverlapPx;

	public SeamCorrelator( final MosaicParameters params )
	{
		this( params.getSeamBandPx(), Math.min( params.getSearchRadiusPx(), params.getOverlapMax() ), params.getMinOverlapPx() );
	}

	public SeamCorrelator( final int seamBandPx, final int searchRadius, final int minOverlapPx )
	{
		this.seamBandPx = seamBandPx;
		this.searchRadius = searchRadius;
		this.minOverlapPx = minOverlapPx;
	}

	public int getSearchRadius()
	{
		return searchRadius;
	}

	public CorrelationResult correlate(
			final TileSampler samplerA, final Placement placementA,
			final TileSampler samplerB, final Placement placementB,
			final OverlapRegion region )
	{
		final Interval band = region.getSeamBand( seamBandPx ).getInterval();
		final int r = searchRadius;
		final Interval grownBand = Intervals.expand( band, r );

		final float[] valuesA = samplerA.sample( placementA, band );
		final float[] valuesB = samplerB.sample( placementB, grownBand );

		final int side = 2 * r + 1;
		final double[] scores = new double[ side * side ];
		for ( int oy = -r; oy <= r; ++oy )
			for ( int ox = -r; ox <= r; ++ox )
				scores[ ( oy + r ) * side + ox + r ] = ncc( valuesA, valuesB, band, r, ox, oy, region.getNormalAxis() );

		final double currentScore = scores[ r * side + r ];

		int bestX = 0, bestY = 0;
		double bestScore = Double.NaN;
		for ( int oy = -r; oy <= r; ++oy )
		{
			for ( int ox = -r; ox <= r; ++ox )
			{
				final double score = scores[ ( oy + r ) * side + ox + r ];
				if ( Double.isNaN( score ) )
					continue;
				if ( Double.isNaN( bestScore ) || isBetter( score, ox, oy, bestScore, bestX, bestY ) )
				{
					bestScore = score;
					bestX = ox;
					bestY = oy;
				}
			}
		}

		if ( Double.isNaN( bestScore ) )
			return CorrelationResult.undefined( region );

		final double[] fitX = parabolicFit(
				bestX > -r ? scores[ ( bestY + r ) * side + bestX - 1 + r ] : Double.NaN,
				bestScore,
				bestX < r ? scores[ ( bestY + r ) * side + bestX + 1 + r ] : Double.NaN );
		final double[] fitY = parabolicFit(
				bestY > -r ? scores[ ( bestY - 1 + r ) * side + bestX + r ] : Double.NaN,
				bestScore,
				bestY < r ? scores[ ( bestY + 1 + r ) * side + bestX + r ] : Double.NaN );

		final double peakScore = bestScore + ( fitX[ 1 ] - bestScore ) + ( fitY[ 1 ] - bestScore );
		return new CorrelationResult( region, new double[] { bestX + fitX[ 0 ], bestY + fitY[ 0 ] }, peakScore, currentScore );
	}

	/**
	 * @return correlation score of the region at the current placements, {@code NaN} if it is undefined
	 */
	public double score(
			final TileSampler samplerA, final Placement placementA,
			final TileSampler samplerB, final Placement placementB,
			final OverlapRegion region )
	{
		final Interval band = region.getSeamBand( seamBandPx ).getInterval();
		return ncc( samplerA.sample( placementA, band ), samplerB.sample( placementB, band ), band, 0, 0, 0, region.getNormalAxis() );
	}

	private static boolean isBetter( final double score, final int ox, final int oy, final double bestScore, final int bestX, final int bestY )
	{
		if ( score > bestScore + TIE_EPSILON )
			return true;
		if ( score < bestScore - TIE_EPSILON )
			return false;

		final int magnitude = ox * ox + oy * oy, bestMagnitude = bestX * bestX + bestY * bestY;
		if ( magnitude != bestMagnitude )
			return magnitude < bestMagnitude;
		return oy != bestY ? oy < bestY : ox < bestX;
	}

	/**
	 * Fits a parabola through three equidistant samples.
	 *
	 * @return vertex offset clamped to [-0.5, 0.5] and the estimated value at the vertex;
	 * 		(0, center) if a neighbor is missing or the samples are not concave
	 */
	static double[] parabolicFit( final double minus, final double center, final double plus )
	{
		if ( Double.isNaN( minus ) || Double.isNaN( plus ) )
			return new double[] { 0, center };

		final double a = ( minus + plus - 2 * center ) / 2;
		final double b = ( plus - minus ) / 2;
		if ( a >= 0 )
			return new double[] { 0, center };

		final double vertex = Math.max( -0.5, Math.min( 0.5, -b / ( 2 * a ) ) );
		return new double[] { vertex, a * vertex * vertex + b * vertex + center };
	}

	/**
	 * Normalized cross-correlation between tile a and tile b moved by (ox, oy), computed over the band pixels
	 * where both tiles have content.
	 *
	 * @param valuesB samples of tile b over the band expanded by {@code r} on every side
	 */
	private double ncc( final float[] valuesA, final float[] valuesB, final Interval band, final int r, final int ox, final int oy, final int normalAxis )
	{
		final int width = ( int ) band.dimension( 0 ), height = ( int ) band.dimension( 1 );
		final int grownWidth = width + 2 * r;
		final boolean[] normalCoverage = new boolean[ normalAxis == 0 ? width : height ];

		long n = 0;
		double sumA = 0, sumB = 0, sumAA = 0, sumBB = 0, sumAB = 0;
		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				final double a = valuesA[ y * width + x ];
				if ( Double.isNaN( a ) )
					continue;
				final double b = valuesB[ ( y - oy + r ) * grownWidth + x - ox + r ];
				if ( Double.isNaN( b ) )
					continue;

				++n;
				sumA += a;
				sumB += b;
				sumAA += a * a;
				sumBB += b * b;
				sumAB += a * b;
				normalCoverage[ normalAxis == 0 ? x : y ] = true;
			}
		}

		int thickness = 0;
		for ( final boolean covered : normalCoverage )
			if ( covered )
				++thickness;

		if ( thickness < minOverlapPx || n < ( long ) minOverlapPx * minOverlapPx )
			return Double.NaN;

		final double varA = sumAA / n - ( sumA / n ) * ( sumA / n );
		final double varB = sumBB / n - ( sumB / n ) * ( sumB / n );
		if ( varA < VARIANCE_EPSILON || varB < VARIANCE_EPSILON )
			return Double.NaN;

		final double cov = sumAB / n - ( sumA / n ) * ( sumB / n );
		return cov / Math.sqrt( varA * varB );
	}
}
