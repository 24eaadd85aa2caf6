package org.janelia.mosaic.alignment;

import java.util.List;

import org.janelia.mosaic.Placement;

public class RefinementResult
{
	private final Placement[] placements;
	private final List< Integer > manualAdjustNeeded;
	private final List< RegionMetrics > regionMetrics;
	private final int degenerateRegions;
	private final int iterations;
	private final boolean converged;
	private final int acceptedUpdates;

	public RefinementResult(
			final Placement[] placements,
			final List< Integer > manualAdjustNeeded,
			final List< RegionMetrics > regionMetrics,
			final int degenerateRegions,
			final int iterations,
			final boolean converged,
			final int acceptedUpdates )
	{
		this.placements = placements;
		this.manualAdjustNeeded = manualAdjustNeeded;
		this.regionMetrics = regionMetrics;
		this.degenerateRegions = degenerateRegions;
		this.iterations = iterations;
		this.converged = converged;
		this.acceptedUpdates = acceptedUpdates;
	}

	/**
	 * @return final placements indexed by tile index
	 */
	public Placement[] getPlacements() { return placements; }
	public List< Integer > getManualAdjustNeeded() { return manualAdjustNeeded; }
	public List< RegionMetrics > getRegionMetrics() { return regionMetrics; }
	public int getDegenerateRegions() { return degenerateRegions; }
	public int getIterations() { return iterations; }
	public boolean isConverged() { return converged; }
	public int getAcceptedUpdates() { return acceptedUpdates; }
}
