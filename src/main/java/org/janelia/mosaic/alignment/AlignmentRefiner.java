package org.janelia.mosaic.alignment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.OverlapRegion;
import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TileRecord;
import org.janelia.mosaic.alignment.PlacementRegistry.TileLocks;
import org.janelia.mosaic.util.concurrent.MultithreadedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Iteratively nudges tile placements so that their seams line up.
 * <p>
 * Each pass drains a versioned queue of overlap regions. Regions that do not share a tile are correlated in parallel,
 * the resulting corrections are applied one by one in queue order. Every accepted correction moves the free tile(s)
 * by a damped amount and schedules all regions of the moved tiles for the next pass. The run stops after a pass
 * without accepted corrections or after {@code max_iterations} passes.
 * <p>
 * A tile whose cumulative displacement would exceed {@code overlap_max} keeps its last accepted placement,
 * is flagged for manual adjustment and frozen for the rest of the run.
 */
public class AlignmentRefiner
{
	private static final Logger LOG = LoggerFactory.getLogger( AlignmentRefiner.class );

	private final MosaicParameters params;
	private final MultithreadedExecutor executor;
	private final SeamCorrelator correlator;
	private final Map< Integer, TileSampler > samplersCache = new ConcurrentHashMap<>();

	public AlignmentRefiner( final MosaicParameters params, final MultithreadedExecutor executor )
	{
		this.params = params;
		this.executor = executor;
		this.correlator = new SeamCorrelator( params );
	}

	/**
	 * Refines all tiles keeping the tile with the lowest index in place.
	 */
	public RefinementResult refine( final List< TileRecord > tiles, final PlacementRegistry registry, final List< OverlapRegion > regions ) throws InterruptedException, ExecutionException
	{
		final Set< Integer > pinned = new TreeSet<>();
		tiles.stream().mapToInt( TileRecord::getIndex ).min().ifPresent( pinned::add );
		return refine( tiles, registry, regions, pinned );
	}

	/**
	 * @param pinned indexes of the tiles that must not move
	 */
	public RefinementResult refine(
			final List< TileRecord > tiles,
			final PlacementRegistry registry,
			final List< OverlapRegion > regions,
			final Set< Integer > pinned ) throws InterruptedException, ExecutionException
	{
		final Map< Integer, TileSampler > samplers = getSamplers( tiles );
		final RefinementState state = new RefinementState( registry, pinned );
		// flagged tiles wait for the operator
		for ( final TileRecord tile : tiles )
			if ( registry.isManualAdjustNeeded( tile.getIndex() ) )
				state.frozen.add( tile.getIndex() );
		final int degenerateRegions = initialize( state, regions, samplers );

		RegionWorkQueue queue = new RegionWorkQueue();
		for ( final OverlapRegion region : state.activeRegions )
			queue.enqueue( region, registry );

		LOG.info( "Refining {} tiles over {} regions ({} degenerate), pinned tiles: {}, frozen tiles: {}", tiles.size(), state.activeRegions.size(), degenerateRegions, pinned, state.frozen );

		boolean rotationScaleQuiet = !params.isRefineRotationScale();
		boolean converged = queue.isEmpty() && rotationScaleQuiet;
		int pass = 0;
		while ( !converged && pass < params.getMaxIterations() )
		{
			++pass;
			if ( params.isRefineRotationScale() && pass % params.getRotationScaleInterval() == 0 )
			{
				rotationScaleQuiet = !rotationScalePass( samplers, state, queue );
				LOG.info( "Pass {}: rotation/scale {}", pass, rotationScaleQuiet ? "unchanged" : "updated" );
			}
			else if ( !queue.isEmpty() )
			{
				queue = translationPass( samplers, state, queue, pass );
			}
			converged = queue.isEmpty() && rotationScaleQuiet;
		}

		if ( !converged )
			LOG.warn( "Refinement stopped after {} passes without converging", pass );

		final List< RegionMetrics > regionMetrics = computeRegionMetrics( samplers, registry, regions, state );
		final List< Integer > flagged = new ArrayList<>();
		for ( final TileRecord tile : tiles )
			if ( registry.isManualAdjustNeeded( tile.getIndex() ) )
				flagged.add( tile.getIndex() );
		Collections.sort( flagged );

		return new RefinementResult( registry.getPlacements(), flagged, regionMetrics, degenerateRegions, pass, converged, state.acceptedUpdates );
	}

	/**
	 * Scores the regions at the current placements without moving any tile.
	 */
	public List< RegionMetrics > evaluate( final List< TileRecord > tiles, final PlacementRegistry registry, final List< OverlapRegion > regions ) throws InterruptedException, ExecutionException
	{
		final Map< Integer, TileSampler > samplers = getSamplers( tiles );
		final RefinementState state = new RefinementState( registry, Collections.emptySet() );
		initialize( state, regions, samplers );
		return computeRegionMetrics( samplers, registry, regions, state );
	}

	/**
	 * @return number of degenerate regions
	 */
	private static int initialize( final RefinementState state, final List< OverlapRegion > regions, final Map< Integer, TileSampler > samplers )
	{
		int degenerateRegions = 0;
		for ( final OverlapRegion region : regions )
		{
			state.displacements.put( region, new double[ 2 ] );
			state.updates.put( region, 0 );
			if ( region.isDegenerate() )
			{
				++degenerateRegions;
				LOG.debug( "skipping degenerate region {}", region );
			}
			else if ( samplers.containsKey( region.getIndexA() ) && samplers.containsKey( region.getIndexB() ) )
			{
				state.activeRegions.add( region );
			}
		}
		return degenerateRegions;
	}

	private RegionWorkQueue translationPass(
			final Map< Integer, TileSampler > samplers,
			final RefinementState state,
			final RegionWorkQueue queue,
			final int pass ) throws InterruptedException, ExecutionException
	{
		final RegionWorkQueue nextQueue = new RegionWorkQueue();
		int processed = 0, accepted = 0;

		List< RegionWorkQueue.Entry > batch;
		while ( !( batch = queue.pollBatch( state.registry ) ).isEmpty() )
		{
			final Placement[] snapshot = state.registry.getPlacements();
			final List< RegionWorkQueue.Entry > entries = batch;
			final List< CorrelationResult > results = executor.map( i ->
				{
					final OverlapRegion region = entries.get( i ).getRegion();
					return correlator.correlate(
							samplers.get( region.getIndexA() ), snapshot[ region.getIndexA() ],
							samplers.get( region.getIndexB() ), snapshot[ region.getIndexB() ],
							region );
				},
				batch.size() );

			for ( final CorrelationResult result : results )
			{
				++processed;
				final List< Integer > moved = applyCorrection( result, state );
				if ( moved.isEmpty() )
					continue;

				++accepted;
				for ( final OverlapRegion region : state.activeRegions )
					if ( moved.contains( region.getIndexA() ) || moved.contains( region.getIndexB() ) )
						nextQueue.enqueue( region, state.registry );
			}
		}

		state.acceptedUpdates += accepted;
		LOG.info( "Pass {}: {} regions correlated, {} corrections accepted, {} stale entries dropped", pass, processed, accepted, queue.getStaleCount() );
		return nextQueue;
	}

	/**
	 * @return indexes of the tiles that were moved, empty if the correction was rejected
	 */
	private List< Integer > applyCorrection( final CorrelationResult result, final RefinementState state )
	{
		final OverlapRegion region = result.getRegion();
		if ( !result.isDefined() )
		{
			LOG.debug( "region {} has no correlation signal", region );
			return Collections.emptyList();
		}

		if ( result.getOffsetMagnitude() < params.getMinCorrectionPx() || result.getImprovement() <= params.getScoreImprovementThreshold() )
		{
			LOG.debug( "region {} is aligned: {}", region, result );
			return Collections.emptyList();
		}

		final int a = region.getIndexA(), b = region.getIndexB();
		final boolean fixedA = state.isFixed( a ), fixedB = state.isFixed( b );
		if ( fixedA && fixedB )
			return Collections.emptyList();

		final double shareA = fixedA ? 0 : ( fixedB ? 1 : 0.5 );
		final double shareB = 1 - shareA;
		final double stepX = params.getDamping() * result.getOffset()[ 0 ];
		final double stepY = params.getDamping() * result.getOffset()[ 1 ];

		final PlacementRegistry registry = state.registry;
		final List< Integer > moved = new ArrayList<>();
		try ( final TileLocks locks = registry.lock( Arrays.asList( a, b ) ) )
		{
			final Placement newA = registry.get( a ).translate( -shareA * stepX, -shareA * stepY );
			final Placement newB = registry.get( b ).translate( shareB * stepX, shareB * stepY );

			final boolean divergedA = shareA > 0 && newA.maxTranslationDistance( registry.getInitial( a ) ) > params.getOverlapMax();
			final boolean divergedB = shareB > 0 && newB.maxTranslationDistance( registry.getInitial( b ) ) > params.getOverlapMax();
			if ( divergedA || divergedB )
			{
				for ( final int index : divergedA && divergedB ? Arrays.asList( a, b ) : Collections.singletonList( divergedA ? a : b ) )
				{
					LOG.warn( "tile {} would move beyond overlap_max={} from its initial placement, rolled back and frozen", index, params.getOverlapMax() );
					registry.setManualAdjustNeeded( index, true );
					state.frozen.add( index );
				}
				return Collections.emptyList();
			}

			if ( shareA > 0 )
			{
				registry.set( a, newA );
				moved.add( a );
			}
			if ( shareB > 0 )
			{
				registry.set( b, newB );
				moved.add( b );
			}
		}

		final double[] displacement = state.displacements.get( region );
		displacement[ 0 ] += stepX;
		displacement[ 1 ] += stepY;
		state.updates.merge( region, 1, Integer::sum );

		LOG.debug( "region {} accepted, step=({}, {})", result, stepX, stepY );
		return moved;
	}

	/**
	 * Tries small rotation and scale changes for every free tile, keeping the best one that improves the mean
	 * correlation of the tile's regions. Regions of updated tiles are scheduled for translation refinement.
	 *
	 * @return {@code true} if any tile was updated
	 */
	private boolean rotationScalePass(
			final Map< Integer, TileSampler > samplers,
			final RefinementState state,
			final RegionWorkQueue queue ) throws InterruptedException, ExecutionException
	{
		final PlacementRegistry registry = state.registry;
		final Set< Integer > candidateTiles = new TreeSet<>();
		for ( final OverlapRegion region : state.activeRegions )
		{
			candidateTiles.add( region.getIndexA() );
			candidateTiles.add( region.getIndexB() );
		}

		boolean updated = false;
		for ( final int index : candidateTiles )
		{
			if ( state.isFixed( index ) )
				continue;

			final List< OverlapRegion > tileRegions = new ArrayList<>();
			for ( final OverlapRegion region : state.activeRegions )
				if ( region.involves( index ) )
					tileRegions.add( region );

			final Placement current = registry.get( index );
			final double currentScore = meanScore( samplers, registry, tileRegions, index, current );
			if ( Double.isNaN( currentScore ) )
				continue;

			final List< Placement > candidates = new ArrayList<>();
			for ( final Placement candidate : Arrays.asList(
					current.withRotationAndScale( current.getRotation() - params.getRotationStepDeg(), current.getScale() ),
					current.withRotationAndScale( current.getRotation() + params.getRotationStepDeg(), current.getScale() ),
					current.withRotationAndScale( current.getRotation(), current.getScale() - params.getScaleStep() ),
					current.withRotationAndScale( current.getRotation(), current.getScale() + params.getScaleStep() ) ) )
				if ( params.isWithinBounds( candidate, registry.getInitial( index ) ) )
					candidates.add( candidate );

			final List< Double > scores = executor.map( i -> meanScore( samplers, registry, tileRegions, index, candidates.get( i ) ), candidates.size() );

			int best = -1;
			for ( int i = 0; i < candidates.size(); ++i )
				if ( !Double.isNaN( scores.get( i ) ) && ( best < 0 || scores.get( i ) > scores.get( best ) ) )
					best = i;

			if ( best < 0 || scores.get( best ) - currentScore <= params.getScoreImprovementThreshold() )
				continue;

			try ( final TileLocks locks = registry.lock( Collections.singletonList( index ) ) )
			{
				registry.set( index, candidates.get( best ) );
			}
			LOG.debug( "tile {}: rotation/scale changed to {}, mean score {} -> {}", index, candidates.get( best ), currentScore, scores.get( best ) );

			for ( final OverlapRegion region : tileRegions )
				queue.enqueue( region, registry );
			++state.acceptedUpdates;
			updated = true;
		}
		return updated;
	}

	private double meanScore(
			final Map< Integer, TileSampler > samplers,
			final PlacementRegistry registry,
			final List< OverlapRegion > tileRegions,
			final int index,
			final Placement placement )
	{
		double sum = 0;
		int count = 0;
		for ( final OverlapRegion region : tileRegions )
		{
			final int a = region.getIndexA(), b = region.getIndexB();
			final double score = correlator.score(
					samplers.get( a ), a == index ? placement : registry.get( a ),
					samplers.get( b ), b == index ? placement : registry.get( b ),
					region );
			if ( !Double.isNaN( score ) )
			{
				sum += score;
				++count;
			}
		}
		return count == 0 ? Double.NaN : sum / count;
	}

	private List< RegionMetrics > computeRegionMetrics(
			final Map< Integer, TileSampler > samplers,
			final PlacementRegistry registry,
			final List< OverlapRegion > regions,
			final RefinementState state ) throws InterruptedException, ExecutionException
	{
		final Placement[] placements = registry.getPlacements();
		return executor.map( i ->
			{
				final OverlapRegion region = regions.get( i );
				final int a = region.getIndexA(), b = region.getIndexB();
				final double score = state.activeRegions.contains( region )
						? correlator.score( samplers.get( a ), placements[ a ], samplers.get( b ), placements[ b ], region )
						: Double.NaN;
				return new RegionMetrics( region, state.displacements.get( region ).clone(), score, state.updates.get( region ) );
			},
			regions.size() );
	}

	private Map< Integer, TileSampler > getSamplers( final List< TileRecord > tiles ) throws InterruptedException, ExecutionException
	{
		final List< TileSampler > created = executor.map( i ->
			samplersCache.computeIfAbsent( tiles.get( i ).getIndex(), index -> new TileSampler( tiles.get( i ) ) ),
			tiles.size() );

		final Map< Integer, TileSampler > samplers = new HashMap<>();
		for ( final TileSampler sampler : created )
			samplers.put( sampler.getTile().getIndex(), sampler );
		return samplers;
	}

	private static class RefinementState
	{
		final PlacementRegistry registry;
		final Set< Integer > pinned;
		final Set< Integer > frozen = new TreeSet<>();
		final List< OverlapRegion > activeRegions = new ArrayList<>();
		final Map< OverlapRegion, double[] > displacements = new HashMap<>();
		final Map< OverlapRegion, Integer > updates = new HashMap<>();
		int acceptedUpdates;

		RefinementState( final PlacementRegistry registry, final Set< Integer > pinned )
		{
			this.registry = registry;
			this.pinned = pinned;
		}

		boolean isFixed( final int index )
		{
			return pinned.contains( index ) || frozen.contains( index );
		}
	}
}
