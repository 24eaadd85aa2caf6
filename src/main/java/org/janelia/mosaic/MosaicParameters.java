package org.janelia.mosaic;

import java.io.Serializable;

import org.janelia.mosaic.gap.GapFillMethod;
import org.janelia.mosaic.photometric.ColorMatchMode;
import org.janelia.mosaic.photometric.ReferenceMode;

/**
 * Configuration values honored by the refinement and blending engine.
 * Field names map to snake_case keys in the JSON parameters file.
 */
public class MosaicParameters implements Serializable
{
	private static final long serialVersionUID = -1873410975512630342L;

	/** hard upper limit for {@link #overlapMax} */
	public static final int OVERLAP_MAX_LIMIT = 15;

	/** hard upper limit for {@link #maxScalePercent} */
	public static final double MAX_SCALE_PERCENT_LIMIT = 0.5;

	// placement bounds
	private int overlapMax = 15;
	private double maxScalePercent = 0.5;
	private double maxRotationDeg = 0.5;

	// alignment refinement
	private int seamBandPx = 30;
	private int searchRadiusPx = 8;
	private int maxIterations = 25;
	private double damping = 0.5;
	private double minCorrectionPx = 0.05;
	private double scoreImprovementThreshold = 1e-4;
	private int minOverlapPx = 3;
	private boolean refineRotationScale = false;
	private int rotationScaleInterval = 3;
	private double rotationStepDeg = 0.05;
	private double scaleStep = 0.001;

	// photometric normalization
	private ColorMatchMode colorMatch = ColorMatchMode.NORMAL;
	private ReferenceMode reference = ReferenceMode.GLOBAL;

	// blending
	private int featherPx = 10;
	private int numBands = 5;
	private int borderCropPx = 10;

	// gap handling
	private boolean seamFillEnabled = true;
	private int seamFillMaxPx = 15;
	private GapFillMethod gapFill = GapFillMethod.EDGE_EXTEND;
	private int inpaintRadius = 3;

	private int numThreads = Math.max( 1, Runtime.getRuntime().availableProcessors() - 1 );

	/**
	 * @throws IllegalArgumentException if a value is outside of its admissible range
	 */
	public void validate() throws IllegalArgumentException
	{
		if ( overlapMax < 0 || overlapMax > OVERLAP_MAX_LIMIT )
			throw new IllegalArgumentException( "overlap_max must be within [0, " + OVERLAP_MAX_LIMIT + "], got " + overlapMax );
		if ( maxScalePercent < 0 || maxScalePercent > MAX_SCALE_PERCENT_LIMIT )
			throw new IllegalArgumentException( "max_scale_percent must be within [0, " + MAX_SCALE_PERCENT_LIMIT + "], got " + maxScalePercent );
		if ( maxRotationDeg < 0 )
			throw new IllegalArgumentException( "max_rotation_deg must be non-negative" );
		if ( seamBandPx < 1 )
			throw new IllegalArgumentException( "seam_band_px must be positive" );
		if ( searchRadiusPx < 1 )
			throw new IllegalArgumentException( "search_radius_px must be positive" );
		if ( maxIterations < 0 )
			throw new IllegalArgumentException( "max_iterations must be non-negative" );
		if ( damping <= 0 || damping > 1 )
			throw new IllegalArgumentException( "damping must be within (0, 1], got " + damping );
		if ( minCorrectionPx < 0 || scoreImprovementThreshold < 0 )
			throw new IllegalArgumentException( "convergence thresholds must be non-negative" );
		if ( minOverlapPx < 1 )
			throw new IllegalArgumentException( "min_overlap_px must be positive" );
		// every other pass at most, translation passes run in between
		if ( rotationScaleInterval < 2 )
			throw new IllegalArgumentException( "rotation_scale_interval must be at least 2, got " + rotationScaleInterval );
		if ( featherPx < 0 || borderCropPx < 0 || seamFillMaxPx < 0 || inpaintRadius < 1 )
			throw new IllegalArgumentException( "feather_px, border_crop_px and seam_fill_max_px must be non-negative, inpaint_radius positive" );
		if ( numBands < 1 )
			throw new IllegalArgumentException( "num_bands must be at least 1" );
		if ( numThreads < 1 )
			throw new IllegalArgumentException( "num_threads must be at least 1" );
		if ( colorMatch == null || reference == null || gapFill == null )
			throw new IllegalArgumentException( "color_match, reference and gap_fill must be set" );
	}

	/**
	 * @return max allowed deviation of the scale from 1
	 */
	public double maxScaleDeviation()
	{
		return maxScalePercent / 100.0;
	}

	public double clampScale( final double scale )
	{
		return Math.max( 1 - maxScaleDeviation(), Math.min( 1 + maxScaleDeviation(), scale ) );
	}

	public double clampRotation( final double rotation )
	{
		return Math.max( -maxRotationDeg, Math.min( maxRotationDeg, rotation ) );
	}

	/**
	 * @return {@code true} if {@code placement} stays within the translation, rotation and scale bounds around {@code initial}
	 */
	public boolean isWithinBounds( final Placement placement, final Placement initial )
	{
		return placement.maxTranslationDistance( initial ) <= overlapMax
				&& Math.abs( placement.getScale() - 1 ) <= maxScaleDeviation() + 1e-12
				&& Math.abs( placement.getRotation() ) <= maxRotationDeg + 1e-12;
	}

	/**
	 * Clamps the placement into the bounds around {@code initial}.
	 */
	public Placement clamp( final Placement placement, final Placement initial )
	{
		final double dx = Math.max( initial.getDx() - overlapMax, Math.min( initial.getDx() + overlapMax, placement.getDx() ) );
		final double dy = Math.max( initial.getDy() - overlapMax, Math.min( initial.getDy() + overlapMax, placement.getDy() ) );
		return new Placement( dx, dy, clampRotation( placement.getRotation() ), clampScale( placement.getScale() ) );
	}

	public int getOverlapMax() { return overlapMax; }
	public void setOverlapMax( final int overlapMax ) { this.overlapMax = overlapMax; }

	public double getMaxScalePercent() { return maxScalePercent; }
	public void setMaxScalePercent( final double maxScalePercent ) { this.maxScalePercent = maxScalePercent; }

	public double getMaxRotationDeg() { return maxRotationDeg; }
	public void setMaxRotationDeg( final double maxRotationDeg ) { this.maxRotationDeg = maxRotationDeg; }

	public int getSeamBandPx() { return seamBandPx; }
	public void setSeamBandPx( final int seamBandPx ) { this.seamBandPx = seamBandPx; }

	public int getSearchRadiusPx() { return searchRadiusPx; }
	public void setSearchRadiusPx( final int searchRadiusPx ) { this.searchRadiusPx = searchRadiusPx; }

	public int getMaxIterations() { return maxIterations; }
	public void setMaxIterations( final int maxIterations ) { this.maxIterations = maxIterations; }

	public double getDamping() { return damping; }
	public void setDamping( final double damping ) { this.damping = damping; }

	public double getMinCorrectionPx() { return minCorrectionPx; }
	public void setMinCorrectionPx( final double minCorrectionPx ) { this.minCorrectionPx = minCorrectionPx; }

	public double getScoreImprovementThreshold() { return scoreImprovementThreshold; }
	public void setScoreImprovementThreshold( final double scoreImprovementThreshold ) { this.scoreImprovementThreshold = scoreImprovementThreshold; }

	public int getMinOverlapPx() { return minOverlapPx; }
	public void setMinOverlapPx( final int minOverlapPx ) { this.minOverlapPx = minOverlapPx; }

	public boolean isRefineRotationScale() { return refineRotationScale; }
	public void setRefineRotationScale( final boolean refineRotationScale ) { this.refineRotationScale = refineRotationScale; }

	public int getRotationScaleInterval() { return rotationScaleInterval; }
	public void setRotationScaleInterval( final int rotationScaleInterval ) { this.rotationScaleInterval = rotationScaleInterval; }

	public double getRotationStepDeg() { return rotationStepDeg; }
	public void setRotationStepDeg( final double rotationStepDeg ) { this.rotationStepDeg = rotationStepDeg; }

	public double getScaleStep() { return scaleStep; }
	public void setScaleStep( final double scaleStep ) { this.scaleStep = scaleStep; }

	public ColorMatchMode getColorMatch() { return colorMatch; }
	public void setColorMatch( final ColorMatchMode colorMatch ) { this.colorMatch = colorMatch; }

	public ReferenceMode getReference() { return reference; }
	public void setReference( final ReferenceMode reference ) { this.reference = reference; }

	public int getFeatherPx() { return featherPx; }
	public void setFeatherPx( final int featherPx ) { this.featherPx = featherPx; }

	public int getNumBands() { return numBands; }
	public void setNumBands( final int numBands ) { this.numBands = numBands; }

	public int getBorderCropPx() { return borderCropPx; }
	public void setBorderCropPx( final int borderCropPx ) { this.borderCropPx = borderCropPx; }

	public boolean isSeamFillEnabled() { return seamFillEnabled; }
	public void setSeamFillEnabled( final boolean seamFillEnabled ) { this.seamFillEnabled = seamFillEnabled; }

	public int getSeamFillMaxPx() { return seamFillMaxPx; }
	public void setSeamFillMaxPx( final int seamFillMaxPx ) { this.seamFillMaxPx = seamFillMaxPx; }

	public GapFillMethod getGapFill() { return gapFill; }
	public void setGapFill( final GapFillMethod gapFill ) { this.gapFill = gapFill; }

	public int getInpaintRadius() { return inpaintRadius; }
	public void setInpaintRadius( final int inpaintRadius ) { this.inpaintRadius = inpaintRadius; }

	public int getNumThreads() { return numThreads; }
	public void setNumThreads( final int numThreads ) { this.numThreads = numThreads; }
}
