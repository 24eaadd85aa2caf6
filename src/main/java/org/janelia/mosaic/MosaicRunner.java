package org.janelia.mosaic;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.fusion.Canvas;
import org.janelia.mosaic.manual.ManualAdjustment;
import org.janelia.mosaic.manual.ManualAdjustmentResult;
import org.janelia.mosaic.manual.ManualAdjustmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line driver: loads a tile configuration, runs the mosaic engine, applies manual adjustments
 * and writes the composite, the gap masks and the transform and metrics records.
 */
public class MosaicRunner implements AutoCloseable
{
	private static final Logger LOG = LoggerFactory.getLogger( MosaicRunner.class );

	public static final String COMPOSITE_FILENAME = "mosaic.tif";
	public static final String COVERAGE_FILENAME = "coverage.tif";
	public static final String GAP_MASK_BEFORE_FILENAME = "gap-mask-before.tif";
	public static final String GAP_MASK_AFTER_FILENAME = "gap-mask-after.tif";
	public static final String TRANSFORMS_FILENAME = "transforms.json";
	public static final String METRICS_FILENAME = "metrics.json";

	public static void main( final String[] args )
	{
		final MosaicArguments mosaicArgs = new MosaicArguments( args );
		if ( !mosaicArgs.parsedSuccessfully() )
			System.exit( 1 );

		try ( final MosaicRunner driver = new MosaicRunner( mosaicArgs ) )
		{
			driver.run();
		}
		catch ( final PipelineExecutionException e )
		{
			LOG.error( "Pipeline execution exception: {}", e.getMessage(), e );
			System.exit( 3 );
		}
	}

	private final MosaicArguments args;
	private MosaicEngine engine;

	public MosaicRunner( final MosaicArguments args )
	{
		this.args = args;
	}

	/**
	 * @throws PipelineExecutionException if the pipeline fails or its results cannot be written
	 */
	public void run() throws PipelineExecutionException
	{
		final MosaicParameters params;
		final List< TileRecord > tiles;
		final MosaicJob job;
		try
		{
			params = args.applyTo( args.parametersPath() != null
					? TileConfigurationJSONProvider.loadParameters( openReader( args.parametersPath() ) )
					: new MosaicParameters() );
			params.validate();

			tiles = new ArrayList<>( Arrays.asList( TileConfigurationJSONProvider.loadTilesConfiguration( openReader( args.inputTileConfiguration() ) ) ) );
			job = new MosaicJob( tiles, params, args.refineOnly(), args.blendOnly() );
			TileLoader.loadTiles( job.getTiles() );
			if ( args.protectLinesPath() != null )
				job.setProtectLines( TileLoader.loadProtectLines( args.protectLinesPath(), args.protectAuthorityPath() ) );
		}
		catch ( final Exception e )
		{
			LOG.error( "Aborted: {}", e.getMessage(), e );
			System.exit( 2 );
			return;
		}

		final String outputFolder = args.outputFolder() != null
				? args.outputFolder()
				: new File( args.inputTileConfiguration() ).getAbsoluteFile().getParent();
		new File( outputFolder ).mkdirs();

		engine = new MosaicEngine( params );
		try
		{
			final MosaicResult result = engine.run( job );

			if ( args.adjustmentsPath() != null )
			{
				final List< ManualAdjustment > adjustments = TileConfigurationJSONProvider.loadManualAdjustments( openReader( args.adjustmentsPath() ) );
				final ManualAdjustmentService service = engine.createManualAdjustmentService( result );
				for ( final ManualAdjustmentResult adjustmentResult : service.applyAll( adjustments ) )
					if ( adjustmentResult.isClamped() )
						LOG.warn( "manual adjustment {} was clamped to {}", adjustmentResult.getAdjustment(), adjustmentResult.getPlacement() );
			}

			saveResult( result, outputFolder );
		}
		catch ( final IOException e )
		{
			throw new PipelineExecutionException( "Cannot read the adjustments or write the results", e );
		}

		LOG.info( "Done" );
	}

	private static Reader openReader( final String path ) throws IOException
	{
		return Files.newBufferedReader( Paths.get( path ), StandardCharsets.UTF_8 );
	}

	private static Writer openWriter( final String outputFolder, final String filename ) throws IOException
	{
		return Files.newBufferedWriter( Paths.get( outputFolder, filename ), StandardCharsets.UTF_8 );
	}

	private static void saveResult( final MosaicResult result, final String outputFolder ) throws PipelineExecutionException, IOException
	{
		TileConfigurationJSONProvider.saveTransformRecord( result.getTransformRecord(), openWriter( outputFolder, TRANSFORMS_FILENAME ) );
		TileConfigurationJSONProvider.saveMetricsRecord( result.getMetricsRecord(), openWriter( outputFolder, METRICS_FILENAME ) );

		final Canvas canvas = result.getCanvas();
		if ( canvas == null )
			return;

		TileLoader.saveImage( canvas.getImage(), getOutputType( result.getTiles(), canvas ), new File( outputFolder, COMPOSITE_FILENAME ).getPath() );
		TileLoader.saveMask( canvas.getCoverage(), new File( outputFolder, COVERAGE_FILENAME ).getPath() );
		TileLoader.saveMask( result.getGapReport().getGapMaskBefore(), new File( outputFolder, GAP_MASK_BEFORE_FILENAME ).getPath() );
		TileLoader.saveMask( result.getGapReport().getGapMaskAfter(), new File( outputFolder, GAP_MASK_AFTER_FILENAME ).getPath() );
	}

	static ImageType getOutputType( final List< TileRecord > tiles, final Canvas canvas )
	{
		if ( canvas.getNumChannels() > 1 )
			return ImageType.COLOR_RGB;
		for ( final TileRecord tile : tiles )
			if ( tile.getType() == ImageType.GRAY16 )
				return ImageType.GRAY16;
		return ImageType.GRAY8;
	}

	@Override
	public void close()
	{
		if ( engine != null )
		{
			engine.close();
			engine = null;
		}
	}
}
