package org.janelia.mosaic;

import java.util.ArrayList;
import java.util.List;

import org.janelia.mosaic.alignment.RegionMetrics;

/**
 * Aggregate quality figures of a run, as written to the metrics JSON file.
 */
public class MetricsRecord
{
	private Double meanCorrelationScore;
	private Double worstCorrelationScore;
	private int manualAdjustNeededCount;
	private long gapPixelsBefore;
	private long gapPixelsAfter;
	private int degenerateRegions;
	private List< String > excludedTiles = new ArrayList<>();
	private int iterations;
	private boolean converged;

	public static MetricsRecord create(
			final List< RegionMetrics > regionMetrics,
			final int manualAdjustNeededCount,
			final long gapPixelsBefore,
			final long gapPixelsAfter,
			final List< String > excludedTiles,
			final int iterations,
			final boolean converged )
	{
		final MetricsRecord record = new MetricsRecord();
		double sum = 0, worst = Double.POSITIVE_INFINITY;
		int count = 0;
		for ( final RegionMetrics metrics : regionMetrics )
		{
			if ( metrics.isDegenerate() )
				++record.degenerateRegions;
			if ( Double.isNaN( metrics.getCorrelationScore() ) )
				continue;
			sum += metrics.getCorrelationScore();
			worst = Math.min( worst, metrics.getCorrelationScore() );
			++count;
		}
		if ( count > 0 )
		{
			record.meanCorrelationScore = sum / count;
			record.worstCorrelationScore = worst;
		}
		record.manualAdjustNeededCount = manualAdjustNeededCount;
		record.gapPixelsBefore = gapPixelsBefore;
		record.gapPixelsAfter = gapPixelsAfter;
		record.excludedTiles.addAll( excludedTiles );
		record.iterations = iterations;
		record.converged = converged;
		return record;
	}

	/**
	 * @return mean score over the regions with a correlation signal, {@code null} if there are none
	 */
	public Double getMeanCorrelationScore() { return meanCorrelationScore; }
	public Double getWorstCorrelationScore() { return worstCorrelationScore; }
	public int getManualAdjustNeededCount() { return manualAdjustNeededCount; }
	public long getGapPixelsBefore() { return gapPixelsBefore; }
	public long getGapPixelsAfter() { return gapPixelsAfter; }
	public int getDegenerateRegions() { return degenerateRegions; }
	public List< String > getExcludedTiles() { return excludedTiles; }
	public int getIterations() { return iterations; }
	public boolean isConverged() { return converged; }
}
