package org.janelia.mosaic.manual;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;

import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.MosaicResult;
import org.janelia.mosaic.OverlapRegion;
import org.janelia.mosaic.PipelineExecutionException;
import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TileOperations;
import org.janelia.mosaic.TileRecord;
import org.janelia.mosaic.alignment.AlignmentRefiner;
import org.janelia.mosaic.alignment.PlacementRegistry;
import org.janelia.mosaic.alignment.PlacementRegistry.TileLocks;
import org.janelia.mosaic.alignment.RefinementResult;
import org.janelia.mosaic.fusion.BlendingCompositor;
import org.janelia.mosaic.fusion.Canvas;
import org.janelia.mosaic.gap.GapHandler;
import org.janelia.mosaic.gap.GapReport;
import org.janelia.mosaic.util.concurrent.MultithreadedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalRealInterval;
import net.imglib2.Interval;
import net.imglib2.RealInterval;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;

/**
 * Applies operator corrections to single tiles and reruns the affected part of the pipeline.
 * <p>
 * Only the regions of the adjusted tile are refined again, with every other tile pinned.
 * Only the canvas area under the old and the new footprint of the tile is composited again,
 * and gaps are closed again on that area grown by {@code seam_fill_max_px + 1}.
 * The rerun holds the locks of all tiles it may touch, so it never interleaves with another update of those tiles.
 */
public class ManualAdjustmentService
{
	private static final Logger LOG = LoggerFactory.getLogger( ManualAdjustmentService.class );

	private final MosaicParameters params;
	private final MosaicResult result;
	private final AlignmentRefiner refiner;
	private final BlendingCompositor compositor;
	private final GapHandler gapHandler;

	public ManualAdjustmentService( final MosaicParameters params, final MultithreadedExecutor executor, final MosaicResult result )
	{
		this.params = params;
		this.result = result;
		this.refiner = new AlignmentRefiner( params, executor );
		this.compositor = new BlendingCompositor( params, executor );
		this.gapHandler = new GapHandler( params );
	}

	public List< ManualAdjustmentResult > applyAll( final List< ManualAdjustment > adjustments ) throws PipelineExecutionException
	{
		final List< ManualAdjustmentResult > results = new ArrayList<>();
		for ( final ManualAdjustment adjustment : adjustments )
			results.add( apply( adjustment ) );
		return results;
	}

	/**
	 * @throws IllegalArgumentException if the tile is unknown or was excluded from the run, or the scale factor is not positive
	 */
	public ManualAdjustmentResult apply( final ManualAdjustment adjustment ) throws PipelineExecutionException
	{
		final TileRecord tile = result.findTile( adjustment.getTileId() );
		if ( tile == null )
			throw new IllegalArgumentException( "Tile " + adjustment.getTileId() + " is not part of the mosaic" );
		if ( !( adjustment.getScale() > 0 ) )
			throw new IllegalArgumentException( "Scale factor must be positive, got " + adjustment.getScale() );

		final int index = tile.getIndex();
		final PlacementRegistry registry = result.getRegistry();

		try ( final TileLocks locks = registry.lock( getAffectedTiles( tile ) ) )
		{
			final Placement previous = registry.get( index );
			final Placement requested = new Placement(
					previous.getDx() + adjustment.getDx(),
					previous.getDy() + adjustment.getDy(),
					previous.getRotation(),
					previous.getScale() * adjustment.getScale() );
			final Placement clampedPlacement = params.clamp( requested, registry.getInitial( index ) );
			final boolean clamped = !clampedPlacement.equals( requested );
			if ( clamped )
				LOG.warn( "adjustment {} exceeds the bounds, clamped to {}", adjustment, clampedPlacement );

			registry.set( index, clampedPlacement );
			registry.setManualAdjustNeeded( index, false );

			final List< OverlapRegion > tileRegions = new ArrayList<>();
			for ( final OverlapRegion region : result.getRegions() )
				if ( region.involves( index ) )
					tileRegions.add( region );

			RefinementResult refinement = null;
			try
			{
				if ( adjustment.isRefine() )
				{
					final Set< Integer > pinned = new TreeSet<>();
					for ( final TileRecord other : result.getTiles() )
						if ( other.getIndex() != index )
							pinned.add( other.getIndex() );
					refinement = refiner.refine( result.getTiles(), registry, tileRegions, pinned );
					result.mergeRegionMetrics( refinement.getRegionMetrics() );
				}
				else
				{
					result.mergeRegionMetrics( refiner.evaluate( result.getTiles(), registry, tileRegions ) );
				}
			}
			catch ( final InterruptedException | ExecutionException e )
			{
				throw new PipelineExecutionException( "Local refinement of tile " + tile + " failed", e );
			}

			final Placement placement = registry.get( index );
			LOG.info( "tile {}: {} -> {}", tile, previous, placement );

			final Canvas canvas = result.getCanvas();
			if ( canvas == null )
				return new ManualAdjustmentResult( adjustment, previous, placement, clamped, refinement, null, null );

			final Interval dirty = getDirtyInterval( tile, previous, placement, canvas );
			if ( dirty == null )
			{
				LOG.warn( "tile {} lies outside of the canvas, nothing to composite", tile );
				return new ManualAdjustmentResult( adjustment, previous, placement, clamped, refinement, null, null );
			}

			compositor.composite( canvas, result.getTiles(), registry.getPlacements(), result.getProtectLines(), dirty );

			final Interval gapInterval = Intervals.intersect( Intervals.expand( dirty, params.getSeamFillMaxPx() + 1 ), canvas.getInterval() );
			final GapReport localReport = gapHandler.fill( canvas, gapInterval );
			if ( result.getGapReport() != null )
				result.getGapReport().update( localReport );

			LOG.info( "tile {}: recomposited {}", tile, Util.printInterval( dirty ) );
			return new ManualAdjustmentResult( adjustment, previous, placement, clamped, refinement, dirty, localReport );
		}
	}

	/**
	 * Tiles whose current footprint may overlap anything the adjusted tile can cover within the bounds,
	 * together with the tiles that share a region with it.
	 */
	private Set< Integer > getAffectedTiles( final TileRecord tile )
	{
		final PlacementRegistry registry = result.getRegistry();
		final RealInterval initialFootprint = tile.getFootprint( registry.getInitial( tile.getIndex() ) );
		final double margin = params.getOverlapMax()
				+ params.maxScaleDeviation() * Math.max( tile.getSize( 0 ), tile.getSize( 1 ) )
				+ Math.toRadians( params.getMaxRotationDeg() ) * ( tile.getSize( 0 ) + tile.getSize( 1 ) ) + 1;
		final RealInterval reach = new FinalRealInterval(
				new double[] { initialFootprint.realMin( 0 ) - margin, initialFootprint.realMin( 1 ) - margin },
				new double[] { initialFootprint.realMax( 0 ) + margin, initialFootprint.realMax( 1 ) + margin } );

		final Set< Integer > affected = new TreeSet<>();
		affected.add( tile.getIndex() );
		affected.addAll( TileOperations.findTilesWithinSubregion( result.getTiles(), registry.getPlacements(), reach ) );
		for ( final OverlapRegion region : result.getRegions() )
			if ( region.involves( tile.getIndex() ) )
				affected.add( region.other( tile.getIndex() ) );
		return affected;
	}

	/**
	 * @return union of the old and the new footprint within the canvas, or {@code null} if it lies outside
	 */
	private static Interval getDirtyInterval( final TileRecord tile, final Placement previous, final Placement placement, final Canvas canvas )
	{
		final Interval union = Intervals.union(
				Intervals.smallestContainingInterval( tile.getFootprint( previous ) ),
				Intervals.smallestContainingInterval( tile.getFootprint( placement ) ) );
		return TileOperations.intersect( union, canvas.getInterval() );
	}
}
