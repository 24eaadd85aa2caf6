package org.janelia.mosaic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.mosaic.alignment.RegionMetrics;

/**
 * Final placements of the tiles and the outcome of every overlap region, as written to the transform JSON file.
 */
public class TransformRecord
{
	public static class TileTransform
	{
		private double dx, dy;
		private double rotation;
		private double scale;
		private boolean manualAdjustNeeded;

		public TileTransform( final Placement placement, final boolean manualAdjustNeeded )
		{
			this.dx = placement.getDx();
			this.dy = placement.getDy();
			this.rotation = placement.getRotation();
			this.scale = placement.getScale();
			this.manualAdjustNeeded = manualAdjustNeeded;
		}

		protected TileTransform() { }

		public Placement toPlacement()
		{
			return new Placement( dx, dy, rotation, scale );
		}

		public boolean isManualAdjustNeeded() { return manualAdjustNeeded; }
	}

	public static class RegionRecord
	{
		private String tileA, tileB;
		private double[] displacement;
		private Double correlationScore;

		public RegionRecord( final String tileA, final String tileB, final double[] displacement, final double correlationScore )
		{
			this.tileA = tileA;
			this.tileB = tileB;
			this.displacement = displacement;
			this.correlationScore = Double.isNaN( correlationScore ) ? null : correlationScore;
		}

		protected RegionRecord() { }

		public String getTileA() { return tileA; }
		public String getTileB() { return tileB; }
		public double[] getDisplacement() { return displacement; }

		/**
		 * @return correlation score at the final placements, {@code null} if the region has no correlation signal
		 */
		public Double getCorrelationScore() { return correlationScore; }
	}

	private Map< String, TileTransform > tiles = new LinkedHashMap<>();
	private List< RegionRecord > regions = new ArrayList<>();

	public static TransformRecord create( final List< TileRecord > tileRecords, final Placement[] placements, final boolean[] manualAdjustNeeded, final List< RegionMetrics > regionMetrics )
	{
		final Map< Integer, String > ids = new LinkedHashMap<>();
		final TransformRecord record = new TransformRecord();
		for ( final TileRecord tile : tileRecords )
		{
			ids.put( tile.getIndex(), tile.getId() );
			record.tiles.put( tile.getId(), new TileTransform( placements[ tile.getIndex() ], manualAdjustNeeded[ tile.getIndex() ] ) );
		}
		for ( final RegionMetrics metrics : regionMetrics )
			record.regions.add( new RegionRecord(
					ids.get( metrics.getRegion().getIndexA() ),
					ids.get( metrics.getRegion().getIndexB() ),
					metrics.getDisplacement().clone(),
					metrics.getCorrelationScore() ) );
		return record;
	}

	public Map< String, TileTransform > getTiles() { return tiles; }
	public List< RegionRecord > getRegions() { return regions; }
}
