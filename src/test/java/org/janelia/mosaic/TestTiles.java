package org.janelia.mosaic;

import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Generates synthetic tiles for tests.
 */
public class TestTiles
{
	public interface Content
	{
		/**
		 * @return value of channel {@code c} at world coordinates (x, y)
		 */
		double get( double x, double y, int c );
	}

	/**
	 * Smooth texture without repetitions within the search range of the refiner.
	 */
	public static final Content TEXTURE = ( x, y, c ) -> 128 + 60 * Math.sin( x / 5 ) + 40 * Math.cos( y / 7 ) + 20 * Math.sin( ( x + y ) / 3 );

	public static Content solid( final double... values )
	{
		return ( x, y, c ) -> values[ Math.min( c, values.length - 1 ) ];
	}

	/**
	 * Creates a fully covered tile placed at (x, y) whose pixels show the content starting at world (x + contentOffsetX, y + contentOffsetY).
	 */
	public static TileRecord createTile(
			final int index,
			final double x,
			final double y,
			final long width,
			final long height,
			final double contentOffsetX,
			final double contentOffsetY,
			final ImageType type,
			final Content content )
	{
		final TileRecord tile = new TileRecord( "tile-" + index, new double[] { x, y }, new long[] { width, height } );
		tile.setIndex( index );
		tile.setType( type );

		final ArrayImg< FloatType, FloatArray > pixels = ArrayImgs.floats( width, height, type.getNumChannels() );
		final Cursor< FloatType > cursor = pixels.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			final double value = content.get(
					x + contentOffsetX + cursor.getDoublePosition( 0 ),
					y + contentOffsetY + cursor.getDoublePosition( 1 ),
					cursor.getIntPosition( 2 ) );
			cursor.get().setReal( Math.max( 0, Math.min( type.getMaxValue(), value ) ) );
		}

		tile.setImage( pixels, createMask( width, height ) );
		return tile;
	}

	public static TileRecord createTile( final int index, final double x, final double y, final long width, final long height, final Content content )
	{
		return createTile( index, x, y, width, height, 0, 0, ImageType.GRAY8, content );
	}

	public static ArrayImg< BitType, LongArray > createMask( final long width, final long height )
	{
		final ArrayImg< BitType, LongArray > mask = ArrayImgs.bits( width, height );
		for ( final BitType value : mask )
			value.set( true );
		return mask;
	}

	/**
	 * Default parameters without border crop, so that every tile pixel takes part in blending, on two threads.
	 */
	public static MosaicParameters createParameters()
	{
		final MosaicParameters params = new MosaicParameters();
		params.setBorderCropPx( 0 );
		params.setNumThreads( 2 );
		return params;
	}
}
