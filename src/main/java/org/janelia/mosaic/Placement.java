package org.janelia.mosaic;

import java.io.Serializable;

import net.imglib2.realtransform.AffineTransform2D;

/**
 * Placement of a tile relative to its nominal grid position:
 * sub-pixel translation, small-angle rotation (degrees) and a multiplicative scale,
 * both applied about the tile centre.
 */
public final class Placement implements Serializable
{
	private static final long serialVersionUID = 4179125086322418473L;

	public static final Placement IDENTITY = new Placement( 0, 0, 0, 1 );

	private final double dx, dy;
	private final double rotation;
	private final double scale;

	// missing keys of a deserialized placement keep the identity values
	private Placement()
	{
		this( 0, 0, 0, 1 );
	}

	public Placement( final double dx, final double dy )
	{
		this( dx, dy, 0, 1 );
	}

	public Placement( final double dx, final double dy, final double rotation, final double scale )
	{
		this.dx = dx;
		this.dy = dy;
		this.rotation = rotation;
		this.scale = scale;
	}

	public double getDx() { return dx; }
	public double getDy() { return dy; }
	public double getRotation() { return rotation; }
	public double getScale() { return scale; }

	public Placement translate( final double ddx, final double ddy )
	{
		return new Placement( dx + ddx, dy + ddy, rotation, scale );
	}

	public Placement withTranslation( final double newDx, final double newDy )
	{
		return new Placement( newDx, newDy, rotation, scale );
	}

	public Placement withRotationAndScale( final double newRotation, final double newScale )
	{
		return new Placement( dx, dy, newRotation, newScale );
	}

	/**
	 * Builds the tile-to-canvas transform for a tile with the given nominal position and size.
	 */
	public AffineTransform2D toTransform( final double[] position, final long[] size )
	{
		final double theta = Math.toRadians( rotation );
		final double cos = Math.cos( theta ) * scale, sin = Math.sin( theta ) * scale;
		final double cx = ( size[ 0 ] - 1 ) / 2.0, cy = ( size[ 1 ] - 1 ) / 2.0;

		final AffineTransform2D transform = new AffineTransform2D();
		transform.set(
				cos, -sin, position[ 0 ] + dx + cx - ( cos * cx - sin * cy ),
				sin, cos, position[ 1 ] + dy + cy - ( sin * cx + cos * cy ) );
		return transform;
	}

	/**
	 * @return translation distance from {@code other} along x and y, whichever is larger
	 */
	public double maxTranslationDistance( final Placement other )
	{
		return Math.max( Math.abs( dx - other.dx ), Math.abs( dy - other.dy ) );
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof Placement ) )
			return false;
		final Placement other = ( Placement ) obj;
		return Double.compare( dx, other.dx ) == 0 && Double.compare( dy, other.dy ) == 0
				&& Double.compare( rotation, other.rotation ) == 0 && Double.compare( scale, other.scale ) == 0;
	}

	@Override
	public int hashCode()
	{
		int hash = Double.hashCode( dx );
		hash = 31 * hash + Double.hashCode( dy );
		hash = 31 * hash + Double.hashCode( rotation );
		return 31 * hash + Double.hashCode( scale );
	}

	@Override
	public String toString()
	{
		return String.format( "(dx=%.3f, dy=%.3f, rotation=%.4f, scale=%.5f)", dx, dy, rotation, scale );
	}
}
