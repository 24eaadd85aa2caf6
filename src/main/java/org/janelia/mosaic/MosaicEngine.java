package org.janelia.mosaic;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import org.janelia.mosaic.MosaicJob.PipelineStep;
import org.janelia.mosaic.alignment.AlignmentRefiner;
import org.janelia.mosaic.alignment.PlacementRegistry;
import org.janelia.mosaic.alignment.RefinementResult;
import org.janelia.mosaic.alignment.RegionMetrics;
import org.janelia.mosaic.fusion.BlendingCompositor;
import org.janelia.mosaic.fusion.Canvas;
import org.janelia.mosaic.gap.GapHandler;
import org.janelia.mosaic.gap.GapReport;
import org.janelia.mosaic.manual.ManualAdjustmentService;
import org.janelia.mosaic.photometric.PhotometricNormalizer;
import org.janelia.mosaic.util.concurrent.MultithreadedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Runs the stages of a mosaic job in order: photometric normalization, alignment refinement,
 * blending and gap handling. Owns the thread pool shared by the stages.
 */
public class MosaicEngine implements AutoCloseable
{
	private static final Logger LOG = LoggerFactory.getLogger( MosaicEngine.class );

	private final MosaicParameters params;
	private final MultithreadedExecutor executor;

	/**
	 * @throws IllegalArgumentException if the parameters are invalid
	 */
	public MosaicEngine( final MosaicParameters params ) throws IllegalArgumentException
	{
		params.validate();
		this.params = params;
		this.executor = new MultithreadedExecutor( params.getNumThreads() );
	}

	@Override
	public void close()
	{
		executor.close();
	}

	public MosaicParameters getParams() { return params; }

	public MosaicResult run( final MosaicJob job ) throws PipelineExecutionException
	{
		final List< TileRecord > validTiles = new ArrayList<>();
		final List< String > excludedTiles = new ArrayList<>();
		for ( final TileRecord tile : job.getTiles() )
		{
			final String problem = tile.validate();
			if ( problem == null )
			{
				validTiles.add( tile );
			}
			else
			{
				LOG.warn( "tile {} is excluded: {}", tile, problem );
				excludedTiles.add( tile.getId() );
			}
		}
		if ( validTiles.isEmpty() )
			throw new PipelineExecutionException( "No valid tiles to process" );

		LOG.info( "Processing {} tiles ({} excluded), pipeline: {}", validTiles.size(), excludedTiles.size(), job.getPipeline() );

		// normalization works on copies, the loaded buffers stay intact
		final PhotometricNormalizer normalizer = new PhotometricNormalizer( params.getColorMatch(), params.getReference() );
		final List< RandomAccessibleInterval< FloatType > > normalized = normalizer.normalizeAll( validTiles );
		final List< TileRecord > tiles = new ArrayList<>();
		for ( int i = 0; i < validTiles.size(); ++i )
		{
			final TileRecord tile = validTiles.get( i ).withPixels( normalized.get( i ) );
			final Placement initial = tile.getInitialPlacement();
			final Placement bounded = initial.withRotationAndScale( params.clampRotation( initial.getRotation() ), params.clampScale( initial.getScale() ) );
			if ( !bounded.equals( initial ) )
			{
				LOG.warn( "initial placement of tile {} exceeds the rotation/scale bounds, clamped from {} to {}", tile, initial, bounded );
				tile.setInitialPlacement( bounded );
			}
			tiles.add( tile );
		}

		final PlacementRegistry registry = new PlacementRegistry( tiles );
		final List< OverlapRegion > regions = TileOperations.findOverlapRegions( tiles, registry.getPlacements(), params );
		LOG.info( "Found {} overlap regions", regions.size() );

		final AlignmentRefiner refiner = new AlignmentRefiner( params, executor );
		final List< RegionMetrics > regionMetrics;
		int iterations = 0;
		boolean converged = true;
		try
		{
			if ( job.getPipeline().contains( PipelineStep.Refinement ) )
			{
				final RefinementResult refinement = refiner.refine( tiles, registry, regions );
				regionMetrics = refinement.getRegionMetrics();
				iterations = refinement.getIterations();
				converged = refinement.isConverged();
				LOG.info( "Refinement finished after {} passes with {} accepted updates, {} tiles need manual adjustment",
						iterations, refinement.getAcceptedUpdates(), refinement.getManualAdjustNeeded().size() );
			}
			else
			{
				regionMetrics = refiner.evaluate( tiles, registry, regions );
			}
		}
		catch ( final InterruptedException | ExecutionException e )
		{
			throw new PipelineExecutionException( "Alignment refinement failed", e );
		}

		final MosaicResult result = new MosaicResult( tiles, excludedTiles, registry, regions, regionMetrics, job.getProtectLines(), iterations, converged );

		if ( job.getPipeline().contains( PipelineStep.Blending ) )
		{
			final BlendingCompositor compositor = new BlendingCompositor( params, executor );
			final Canvas canvas = compositor.createCanvas( tiles, registry.getPlacements() );
			compositor.composite( canvas, tiles, registry.getPlacements(), job.getProtectLines() );
			final GapReport gapReport = new GapHandler( params ).fill( canvas );
			result.setCanvas( canvas, gapReport );
		}

		return result;
	}

	/**
	 * @return a service that applies operator corrections to the outcome of {@link #run(MosaicJob)}
	 */
	public ManualAdjustmentService createManualAdjustmentService( final MosaicResult result )
	{
		return new ManualAdjustmentService( params, executor, result );
	}
}
