package org.janelia.mosaic.alignment;

import org.janelia.mosaic.OverlapRegion;

/**
 * Per-region outcome of a refinement run.
 */
public class RegionMetrics
{
	private final OverlapRegion region;
	private final double[] displacement;
	private final double correlationScore;
	private final int updates;

	public RegionMetrics( final OverlapRegion region, final double[] displacement, final double correlationScore, final int updates )
	{
		this.region = region;
		this.displacement = displacement;
		this.correlationScore = correlationScore;
		this.updates = updates;
	}

	public OverlapRegion getRegion() { return region; }

	/**
	 * @return cumulative displacement of tile b relative to tile a applied by the refiner
	 */
	public double[] getDisplacement() { return displacement; }

	/**
	 * @return correlation score at the final placements, {@code NaN} for degenerate or textureless regions
	 */
	public double getCorrelationScore() { return correlationScore; }

	public int getUpdates() { return updates; }

	public boolean isDegenerate()
	{
		return region.isDegenerate();
	}
}
