package org.janelia.mosaic.manual;

import org.janelia.mosaic.Placement;
import org.janelia.mosaic.alignment.RefinementResult;
import org.janelia.mosaic.gap.GapReport;

import net.imglib2.Interval;

public class ManualAdjustmentResult
{
	private final ManualAdjustment adjustment;
	private final Placement previousPlacement;
	private final Placement placement;
	private final boolean clamped;
	private final RefinementResult refinement;
	private final Interval recomposedInterval;
	private final GapReport gapReport;

	public ManualAdjustmentResult(
			final ManualAdjustment adjustment,
			final Placement previousPlacement,
			final Placement placement,
			final boolean clamped,
			final RefinementResult refinement,
			final Interval recomposedInterval,
			final GapReport gapReport )
	{
		this.adjustment = adjustment;
		this.previousPlacement = previousPlacement;
		this.placement = placement;
		this.clamped = clamped;
		this.refinement = refinement;
		this.recomposedInterval = recomposedInterval;
		this.gapReport = gapReport;
	}

	public ManualAdjustment getAdjustment() { return adjustment; }
	public Placement getPreviousPlacement() { return previousPlacement; }

	/**
	 * @return placement of the tile after the adjustment and the optional local refinement
	 */
	public Placement getPlacement() { return placement; }

	/**
	 * @return {@code true} if the requested placement exceeded the bounds and was clamped
	 */
	public boolean isClamped() { return clamped; }

	/**
	 * @return outcome of the local refinement, or {@code null} if it was not requested
	 */
	public RefinementResult getRefinement() { return refinement; }

	/**
	 * @return canvas interval that was cleared and accumulated again, or {@code null} if the adjusted tile lies outside of the canvas
	 */
	public Interval getRecomposedInterval() { return recomposedInterval; }

	public GapReport getGapReport() { return gapReport; }
}
