package org.janelia.mosaic;

import org.janelia.mosaic.gap.GapFillMethod;
import org.janelia.mosaic.photometric.ColorMatchMode;
import org.janelia.mosaic.photometric.ReferenceMode;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for a mosaic run.
 * Parameter options override the values read from the parameters file.
 */
public class MosaicArguments
{
	@Option(name = "-i", aliases = { "--input" }, required = true,
			usage = "Path to a tile configuration JSON file")
	private String inputTileConfiguration;

	@Option(name = "-p", aliases = { "--params" }, required = false,
			usage = "Path to a parameters JSON file. Missing keys keep their defaults")
	private String parametersPath;

	@Option(name = "-o", aliases = { "--output" }, required = false,
			usage = "Output folder. Defaults to the folder of the tile configuration")
	private String outputFolder;

	@Option(name = "-a", aliases = { "--adjustments" }, required = false,
			usage = "Path to a JSON file with manual adjustments that are applied after the run")
	private String adjustmentsPath;

	@Option(name = "--protect", required = false,
			usage = "Path to a protect lines mask image (non-zero = protected), pixel (0,0) is the canvas origin")
	private String protectLinesPath;

	@Option(name = "--protect-authority", required = false,
			usage = "Path to an image naming the authoritative tile of protected pixels (value = tile index + 1, 0 = none)")
	private String protectAuthorityPath;

	/**
	 * Toggle pipeline stages. By default all stages are executed.
	 */
	@Option(name = "--refine-only", required = false, usage = "Only refine the placements, do not blend")
	private boolean refineOnly = false;

	@Option(name = "--blend-only", required = false, usage = "Only blend the tiles at their initial placements")
	private boolean blendOnly = false;

	@Option(name = "--overlap-max", required = false, usage = "Max cumulative translation of a tile in pixels (at most 15)")
	private Integer overlapMax;

	@Option(name = "--max-scale-percent", required = false, usage = "Max deviation of the scale in percent (at most 0.5)")
	private Double maxScalePercent;

	@Option(name = "--max-rotation-deg", required = false, usage = "Max rotation of a tile in degrees")
	private Double maxRotationDeg;

	@Option(name = "--seam-band", required = false, usage = "Width of the correlation window across a seam in pixels")
	private Integer seamBandPx;

	@Option(name = "--search-radius", required = false, usage = "Search radius of the seam correlation in pixels")
	private Integer searchRadiusPx;

	@Option(name = "--max-iterations", required = false, usage = "Max number of refinement passes")
	private Integer maxIterations;

	@Option(name = "--damping", required = false, usage = "Fraction of a correction that is applied per update, within (0, 1]")
	private Double damping;

	@Option(name = "--min-correction", required = false, usage = "Corrections smaller than this many pixels are ignored")
	private Double minCorrectionPx;

	@Option(name = "--score-threshold", required = false, usage = "Min correlation improvement of an accepted correction")
	private Double scoreImprovementThreshold;

	@Option(name = "--min-overlap", required = false, usage = "Overlaps thinner than this many pixels are skipped")
	private Integer minOverlapPx;

	@Option(name = "--refine-rotation-scale", required = false, usage = "Also refine rotation and scale")
	private boolean refineRotationScale = false;

	@Option(name = "--rotation-scale-interval", required = false, usage = "Every n-th refinement pass refines rotation and scale (at least 2)")
	private Integer rotationScaleInterval;

	@Option(name = "--color-match", required = false, usage = "Photometric normalization strength ('off', 'normal' or 'strong')")
	private String colorMatch;

	@Option(name = "--reference", required = false, usage = "Photometric reference ('global' or 'neighbor')")
	private String reference;

	@Option(name = "--feather", required = false, usage = "Feathering ramp width in pixels")
	private Integer featherPx;

	@Option(name = "--bands", required = false, usage = "Number of frequency bands")
	private Integer numBands;

	@Option(name = "--border-crop", required = false, usage = "Pixels cropped from every tile edge before blending")
	private Integer borderCropPx;

	@Option(name = "--no-seam-fill", required = false, usage = "Leave gaps unfilled")
	private boolean noSeamFill = false;

	@Option(name = "--seam-fill-max", required = false, usage = "Max thickness of a gap that is closed, in pixels")
	private Integer seamFillMaxPx;

	@Option(name = "--gap-fill", required = false, usage = "Gap fill method ('edge-extend' or 'inpaint')")
	private String gapFill;

	@Option(name = "--inpaint-radius", required = false, usage = "Neighborhood radius of inpainting in pixels")
	private Integer inpaintRadius;

	@Option(name = "--threads", required = false, usage = "Number of worker threads")
	private Integer numThreads;

	private boolean parsedSuccessfully = false;

	public MosaicArguments( final String[] args ) throws IllegalArgumentException
	{
		final CmdLineParser parser = new CmdLineParser( this );
		try {
			parser.parseArgument( args );
			parsedSuccessfully = true;
		} catch ( final CmdLineException e ) {
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
		}

		if ( refineOnly && blendOnly )
			throw new IllegalArgumentException( "Please specify one mode at a time: --refine-only / --blend-only" );

		// fail early on invalid enum values
		if ( colorMatch != null )
			ColorMatchMode.fromString( colorMatch );
		if ( reference != null )
			ReferenceMode.fromString( reference );
		if ( gapFill != null )
			GapFillMethod.fromString( gapFill );
	}

	public boolean parsedSuccessfully() { return parsedSuccessfully; }

	public String inputTileConfiguration() { return inputTileConfiguration; }
	public String parametersPath() { return parametersPath; }
	public String outputFolder() { return outputFolder; }
	public String adjustmentsPath() { return adjustmentsPath; }
	public String protectLinesPath() { return protectLinesPath; }
	public String protectAuthorityPath() { return protectAuthorityPath; }
	public boolean refineOnly() { return refineOnly; }
	public boolean blendOnly() { return blendOnly; }

	/**
	 * Overrides the given parameters with the values passed on the command line.
	 */
	public MosaicParameters applyTo( final MosaicParameters params )
	{
		if ( overlapMax != null ) params.setOverlapMax( overlapMax );
		if ( maxScalePercent != null ) params.setMaxScalePercent( maxScalePercent );
		if ( maxRotationDeg != null ) params.setMaxRotationDeg( maxRotationDeg );
		if ( seamBandPx != null ) params.setSeamBandPx( seamBandPx );
		if ( searchRadiusPx != null ) params.setSearchRadiusPx( searchRadiusPx );
		if ( maxIterations != null ) params.setMaxIterations( maxIterations );
		if ( damping != null ) params.setDamping( damping );
		if ( minCorrectionPx != null ) params.setMinCorrectionPx( minCorrectionPx );
		if ( scoreImprovementThreshold != null ) params.setScoreImprovementThreshold( scoreImprovementThreshold );
		if ( minOverlapPx != null ) params.setMinOverlapPx( minOverlapPx );
		if ( refineRotationScale ) params.setRefineRotationScale( true );
		if ( rotationScaleInterval != null ) params.setRotationScaleInterval( rotationScaleInterval );
		if ( colorMatch != null ) params.setColorMatch( ColorMatchMode.fromString( colorMatch ) );
		if ( reference != null ) params.setReference( ReferenceMode.fromString( reference ) );
		if ( featherPx != null ) params.setFeatherPx( featherPx );
		if ( numBands != null ) params.setNumBands( numBands );
		if ( borderCropPx != null ) params.setBorderCropPx( borderCropPx );
		if ( noSeamFill ) params.setSeamFillEnabled( false );
		if ( seamFillMaxPx != null ) params.setSeamFillMaxPx( seamFillMaxPx );
		if ( gapFill != null ) params.setGapFill( GapFillMethod.fromString( gapFill ) );
		if ( inpaintRadius != null ) params.setInpaintRadius( inpaintRadius );
		if ( numThreads != null ) params.setNumThreads( numThreads );
		return params;
	}
}
