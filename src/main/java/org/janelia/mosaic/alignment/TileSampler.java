package org.janelia.mosaic.alignment;

import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TileRecord;
import org.janelia.mosaic.photometric.ColorSpace;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.realtransform.AffineTransform2D;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Samples the luminance of a tile at canvas coordinates under a given placement.
 * Points that fall outside of the tile or onto its background are reported as {@code NaN}.
 * Instances are safe to share between threads.
 */
public class TileSampler
{
	private static final double EPSILON = 1e-6;

	private final TileRecord tile;
	private final ArrayImg< FloatType, FloatArray > luminance;

	public TileSampler( final TileRecord tile )
	{
		this.tile = tile;
		this.luminance = computeLuminance( tile );
	}

	public TileRecord getTile()
	{
		return tile;
	}

	static ArrayImg< FloatType, FloatArray > computeLuminance( final TileRecord tile )
	{
		final long width = tile.getSize( 0 ), height = tile.getSize( 1 );
		final ArrayImg< FloatType, FloatArray > luminance = ArrayImgs.floats( width, height );
		final boolean color = tile.getNumChannels() >= 3;
		final RandomAccess< FloatType > pixelsRandomAccess = tile.getPixels().randomAccess();

		final Cursor< FloatType > cursor = luminance.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			pixelsRandomAccess.setPosition( cursor.getLongPosition( 0 ), 0 );
			pixelsRandomAccess.setPosition( cursor.getLongPosition( 1 ), 1 );
			pixelsRandomAccess.setPosition( 0, 2 );
			final double r = pixelsRandomAccess.get().getRealDouble();
			if ( color )
			{
				pixelsRandomAccess.fwd( 2 );
				final double g = pixelsRandomAccess.get().getRealDouble();
				pixelsRandomAccess.fwd( 2 );
				final double b = pixelsRandomAccess.get().getRealDouble();
				cursor.get().setReal( ColorSpace.luminance( r, g, b ) );
			}
			else
			{
				cursor.get().setReal( r );
			}
		}
		return luminance;
	}

	/**
	 * Samples the window row by row with bilinear interpolation.
	 *
	 * @return values in row-major order, {@code NaN} where the tile has no content
	 */
	public float[] sample( final Placement placement, final Interval window )
	{
		final int width = ( int ) window.dimension( 0 ), height = ( int ) window.dimension( 1 );
		final float[] values = new float[ width * height ];

		final AffineTransform2D transform = tile.getTransform( placement );
		final RealRandomAccess< FloatType > interpolated = Views.interpolate(
				Views.extendBorder( luminance ),
				new NLinearInterpolatorFactory< FloatType >() ).realRandomAccess();
		final RandomAccess< BitType > maskRandomAccess = tile.getContentMask().randomAccess();

		final double maxX = tile.getSize( 0 ) - 1, maxY = tile.getSize( 1 ) - 1;
		final double[] canvasPosition = new double[ 2 ], tilePosition = new double[ 2 ];

		int i = 0;
		for ( long y = window.min( 1 ); y <= window.max( 1 ); ++y )
		{
			for ( long x = window.min( 0 ); x <= window.max( 0 ); ++x, ++i )
			{
				canvasPosition[ 0 ] = x;
				canvasPosition[ 1 ] = y;
				transform.applyInverse( tilePosition, canvasPosition );

				if ( tilePosition[ 0 ] < -EPSILON || tilePosition[ 1 ] < -EPSILON || tilePosition[ 0 ] > maxX + EPSILON || tilePosition[ 1 ] > maxY + EPSILON )
				{
					values[ i ] = Float.NaN;
					continue;
				}

				maskRandomAccess.setPosition( Math.round( tilePosition[ 0 ] ), 0 );
				maskRandomAccess.setPosition( Math.round( tilePosition[ 1 ] ), 1 );
				if ( !maskRandomAccess.get().get() )
				{
					values[ i ] = Float.NaN;
					continue;
				}

				interpolated.setPosition( tilePosition );
				values[ i ] = interpolated.get().get();
			}
		}
		return values;
	}
}
