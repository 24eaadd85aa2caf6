package org.janelia.mosaic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.mosaic.alignment.PlacementRegistry;
import org.janelia.mosaic.alignment.RegionMetrics;
import org.janelia.mosaic.fusion.Canvas;
import org.janelia.mosaic.fusion.ProtectLinesMask;
import org.janelia.mosaic.gap.GapReport;

/**
 * State of a finished run: the working tiles and their placements, the canvas and the gap masks.
 * Manual adjustments keep updating it.
 */
public class MosaicResult
{
	private final List< TileRecord > tiles;
	private final List< String > excludedTiles;
	private final PlacementRegistry registry;
	private final List< OverlapRegion > regions;
	private final Map< OverlapRegion, RegionMetrics > regionMetrics = new LinkedHashMap<>();
	private final ProtectLinesMask protectLines;
	private final int iterations;
	private final boolean converged;

	private Canvas canvas;
	private GapReport gapReport;

	public MosaicResult(
			final List< TileRecord > tiles,
			final List< String > excludedTiles,
			final PlacementRegistry registry,
			final List< OverlapRegion > regions,
			final List< RegionMetrics > regionMetrics,
			final ProtectLinesMask protectLines,
			final int iterations,
			final boolean converged )
	{
		this.tiles = tiles;
		this.excludedTiles = excludedTiles;
		this.registry = registry;
		this.regions = regions;
		this.protectLines = protectLines;
		this.iterations = iterations;
		this.converged = converged;
		for ( final RegionMetrics metrics : regionMetrics )
			this.regionMetrics.put( metrics.getRegion(), metrics );
	}

	/**
	 * @return the tiles that took part in the run, with their normalized pixel buffers
	 */
	public List< TileRecord > getTiles() { return tiles; }
	public List< String > getExcludedTiles() { return excludedTiles; }
	public PlacementRegistry getRegistry() { return registry; }
	public List< OverlapRegion > getRegions() { return regions; }
	public ProtectLinesMask getProtectLines() { return protectLines; }
	public int getIterations() { return iterations; }
	public boolean isConverged() { return converged; }

	/**
	 * @return the composite, or {@code null} if blending was not part of the run
	 */
	public Canvas getCanvas() { return canvas; }
	public GapReport getGapReport() { return gapReport; }

	void setCanvas( final Canvas canvas, final GapReport gapReport )
	{
		this.canvas = canvas;
		this.gapReport = gapReport;
	}

	public TileRecord findTile( final String id )
	{
		for ( final TileRecord tile : tiles )
			if ( tile.getId().equals( id ) )
				return tile;
		return null;
	}

	public Placement getPlacement( final String id )
	{
		final TileRecord tile = findTile( id );
		return tile == null ? null : registry.get( tile.getIndex() );
	}

	public synchronized List< RegionMetrics > getRegionMetrics()
	{
		return new ArrayList<>( regionMetrics.values() );
	}

	/**
	 * Takes over the scores of a later evaluation. Displacements and update counts are added to the previous ones.
	 */
	public synchronized void mergeRegionMetrics( final List< RegionMetrics > update )
	{
		for ( final RegionMetrics metrics : update )
		{
			final RegionMetrics previous = regionMetrics.get( metrics.getRegion() );
			if ( previous == null )
			{
				regionMetrics.put( metrics.getRegion(), metrics );
				continue;
			}
			final double[] displacement = new double[] {
					previous.getDisplacement()[ 0 ] + metrics.getDisplacement()[ 0 ],
					previous.getDisplacement()[ 1 ] + metrics.getDisplacement()[ 1 ] };
			regionMetrics.put( metrics.getRegion(), new RegionMetrics( metrics.getRegion(), displacement, metrics.getCorrelationScore(), previous.getUpdates() + metrics.getUpdates() ) );
		}
	}

	public TransformRecord getTransformRecord()
	{
		final Placement[] placements = registry.getPlacements();
		final boolean[] flags = new boolean[ placements.length ];
		for ( final int index : registry.getManualAdjustNeeded() )
			flags[ index ] = true;
		return TransformRecord.create( tiles, placements, flags, getRegionMetrics() );
	}

	public MetricsRecord getMetricsRecord()
	{
		return MetricsRecord.create(
				getRegionMetrics(),
				registry.getManualAdjustNeeded().size(),
				gapReport == null ? 0 : gapReport.getGapPixelsBefore(),
				gapReport == null ? 0 : gapReport.getGapPixelsAfter(),
				excludedTiles,
				iterations,
				converged );
	}
}
