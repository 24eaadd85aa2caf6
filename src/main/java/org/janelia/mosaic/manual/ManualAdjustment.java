package org.janelia.mosaic.manual;

import com.google.gson.annotations.SerializedName;

/**
 * Operator correction of a single tile: additive translation in pixels and a multiplicative scale factor.
 */
public class ManualAdjustment
{
	@SerializedName( "tile" )
	private String tileId;

	private double dx;
	private double dy;
	private double scale = 1;
	private boolean refine;

	public ManualAdjustment( final String tileId, final double dx, final double dy, final double scale, final boolean refine )
	{
		this.tileId = tileId;
		this.dx = dx;
		this.dy = dy;
		this.scale = scale;
		this.refine = refine;
	}

	protected ManualAdjustment() { }

	public String getTileId() { return tileId; }
	public double getDx() { return dx; }
	public double getDy() { return dy; }
	public double getScale() { return scale; }

	/**
	 * @return {@code true} if the tile's seams should be refined again after applying the adjustment
	 */
	public boolean isRefine() { return refine; }

	@Override
	public String toString()
	{
		return String.format( "%s: dx=%.3f, dy=%.3f, scale=%.5f%s", tileId, dx, dy, scale, refine ? ", refine" : "" );
	}
}
