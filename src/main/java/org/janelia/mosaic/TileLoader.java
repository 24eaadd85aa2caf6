package org.janelia.mosaic;

import java.util.ArrayList;
import java.util.List;

import org.janelia.mosaic.fusion.ProtectLinesMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.IJ;
import ij.ImagePlus;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import net.imglib2.FinalInterval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Reads tile images, content masks and the protect lines mask with ImageJ, and writes the outputs of a run.
 */
public class TileLoader
{
	private static final Logger LOG = LoggerFactory.getLogger( TileLoader.class );

	/**
	 * Loads the pixel buffers and content masks of the given tiles.
	 * Tiles whose image or mask cannot be read or does not match are left unloaded and reported.
	 *
	 * @return ids of the tiles that could not be loaded
	 */
	public static List< String > loadTiles( final List< TileRecord > tiles )
	{
		final List< String > failed = new ArrayList<>();
		for ( final TileRecord tile : tiles )
		{
			final String problem = loadTile( tile );
			if ( problem != null )
			{
				LOG.warn( "tile {} is excluded: {}", tile, problem );
				failed.add( tile.getId() );
			}
		}
		return failed;
	}

	/**
	 * @return a description of the problem, or {@code null} if the tile was loaded
	 */
	public static String loadTile( final TileRecord tile )
	{
		if ( tile.getFilePath() == null )
			return "no image file";

		final ImagePlus imp = IJ.openImage( tile.getFilePath() );
		if ( imp == null )
			return "cannot open " + tile.getFilePath();

		final ImageType type = ImageType.valueOf( imp.getType() );
		if ( type == null )
			return "unsupported image type " + imp.getType();
		if ( tile.getType() != null && tile.getType() != type )
			LOG.warn( "tile {} is declared as {} but the image is {}", tile, tile.getType(), type );
		tile.setType( type );

		if ( tile.getSize() == null )
			tile.setSize( new long[] { imp.getWidth(), imp.getHeight() } );
		else if ( tile.getSize( 0 ) != imp.getWidth() || tile.getSize( 1 ) != imp.getHeight() )
			return "image is " + imp.getWidth() + "x" + imp.getHeight() + ", expected " + tile.getSize( 0 ) + "x" + tile.getSize( 1 );

		final RandomAccessibleInterval< FloatType > pixels = toFloatImage( imp.getProcessor(), type );

		final ArrayImg< BitType, LongArray > mask;
		if ( tile.getMaskFilePath() == null )
		{
			// without a mask the whole tile is content
			mask = ArrayImgs.bits( imp.getWidth(), imp.getHeight() );
			for ( final BitType value : mask )
				value.set( true );
		}
		else
		{
			final ImagePlus maskImp = IJ.openImage( tile.getMaskFilePath() );
			if ( maskImp == null )
				return "cannot open mask " + tile.getMaskFilePath();
			if ( maskImp.getWidth() != imp.getWidth() || maskImp.getHeight() != imp.getHeight() )
				return "mask is " + maskImp.getWidth() + "x" + maskImp.getHeight() + ", image is " + imp.getWidth() + "x" + imp.getHeight();
			mask = toMask( maskImp.getProcessor(), tile.isBackgroundMask() );
		}

		boolean hasContent = false;
		for ( final BitType value : mask )
			hasContent |= value.get();
		if ( !hasContent )
			return "content mask is empty";

		tile.setImage( pixels, mask );
		return tile.validate();
	}

	/**
	 * Converts an ImageJ processor to a (x, y, channel) float image with the raw sample values.
	 */
	public static RandomAccessibleInterval< FloatType > toFloatImage( final ImageProcessor ip, final ImageType type )
	{
		final int width = ip.getWidth(), height = ip.getHeight(), numChannels = type.getNumChannels();
		final ArrayImg< FloatType, FloatArray > img = ArrayImgs.floats( width, height, numChannels );
		final float[] data = img.update( null ).getCurrentStorageArray();
		final int channelSize = width * height;
		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				final int i = y * width + x;
				if ( type == ImageType.COLOR_RGB )
				{
					final int rgb = ip.get( x, y );
					data[ i ] = ( rgb >> 16 ) & 0xff;
					data[ channelSize + i ] = ( rgb >> 8 ) & 0xff;
					data[ 2 * channelSize + i ] = rgb & 0xff;
				}
				else
				{
					data[ i ] = ip.getf( x, y );
				}
			}
		}
		return img;
	}

	/**
	 * @param background {@code true} if non-zero values mark background, {@code false} if they mark content
	 */
	public static ArrayImg< BitType, LongArray > toMask( final ImageProcessor ip, final boolean background )
	{
		final ArrayImg< BitType, LongArray > mask = ArrayImgs.bits( ip.getWidth(), ip.getHeight() );
		final RandomAccess< BitType > randomAccess = mask.randomAccess();
		for ( int y = 0; y < ip.getHeight(); ++y )
		{
			for ( int x = 0; x < ip.getWidth(); ++x )
			{
				randomAccess.setPosition( x, 0 );
				randomAccess.setPosition( y, 1 );
				randomAccess.get().set( ( ip.get( x, y ) != 0 ) != background );
			}
		}
		return mask;
	}

	/**
	 * Loads the protect lines mask. Pixel (0, 0) of the image is the canvas origin.
	 *
	 * @param authorityPath optional image where a value {@code v > 0} names the tile with index {@code v - 1} as authoritative
	 */
	public static ProtectLinesMask loadProtectLines( final String maskPath, final String authorityPath ) throws PipelineExecutionException
	{
		final ImagePlus maskImp = IJ.openImage( maskPath );
		if ( maskImp == null )
			throw new PipelineExecutionException( "Cannot open protect lines mask " + maskPath );

		final ImageProcessor authorityIp;
		if ( authorityPath != null )
		{
			final ImagePlus authorityImp = IJ.openImage( authorityPath );
			if ( authorityImp == null )
				throw new PipelineExecutionException( "Cannot open authority image " + authorityPath );
			if ( authorityImp.getWidth() != maskImp.getWidth() || authorityImp.getHeight() != maskImp.getHeight() )
				throw new PipelineExecutionException( "Authority image and protect lines mask differ in size" );
			authorityIp = authorityImp.getProcessor();
		}
		else
		{
			authorityIp = null;
		}

		final ImageProcessor ip = maskImp.getProcessor();
		final ProtectLinesMask protectLines = new ProtectLinesMask( new FinalInterval( ip.getWidth(), ip.getHeight() ) );
		for ( int y = 0; y < ip.getHeight(); ++y )
		{
			for ( int x = 0; x < ip.getWidth(); ++x )
			{
				if ( ip.get( x, y ) == 0 )
					continue;
				final int authority = authorityIp == null ? 0 : authorityIp.get( x, y );
				protectLines.setProtected( x, y, authority > 0 ? authority - 1 : ProtectLinesMask.NO_AUTHORITY );
			}
		}
		LOG.info( "Loaded protect lines mask with {} protected pixels", protectLines.getNumProtected() );
		return protectLines;
	}

	/**
	 * Saves a (x, y, channel) image as TIFF in the given sample type.
	 */
	public static void saveImage( final RandomAccessibleInterval< FloatType > image, final ImageType type, final String path ) throws PipelineExecutionException
	{
		final int width = ( int ) image.dimension( 0 ), height = ( int ) image.dimension( 1 );
		final int numChannels = image.numDimensions() > 2 ? ( int ) image.dimension( 2 ) : 1;
		final RandomAccess< FloatType > randomAccess = image.randomAccess();
		final long[] position = new long[ image.numDimensions() ];

		final ImageProcessor ip;
		switch ( type )
		{
		case COLOR_RGB:
			ip = new ColorProcessor( width, height );
			break;
		case GRAY16:
			ip = new ShortProcessor( width, height );
			break;
		case GRAY8:
		default:
			ip = new ByteProcessor( width, height );
			break;
		}

		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				position[ 0 ] = x;
				position[ 1 ] = y;
				if ( type == ImageType.COLOR_RGB )
				{
					int rgb = 0;
					for ( int c = 0; c < 3; ++c )
					{
						if ( position.length > 2 )
							position[ 2 ] = Math.min( c, numChannels - 1 );
						randomAccess.setPosition( position );
						rgb = ( rgb << 8 ) | clampToInt( randomAccess.get().get(), 255 );
					}
					ip.set( x, y, rgb );
				}
				else
				{
					randomAccess.setPosition( position );
					ip.set( x, y, clampToInt( randomAccess.get().get(), type.getMaxValue() ) );
				}
			}
		}
		save( new ImagePlus( "", ip ), path );
	}

	/**
	 * Saves an 8-bit mask (255 = set) as TIFF.
	 */
	public static void saveMask( final RandomAccessibleInterval< ? extends IntegerType< ? > > mask, final String path ) throws PipelineExecutionException
	{
		final int width = ( int ) mask.dimension( 0 ), height = ( int ) mask.dimension( 1 );
		final ByteProcessor ip = new ByteProcessor( width, height );
		final RandomAccess< ? extends IntegerType< ? > > randomAccess = mask.randomAccess();
		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				randomAccess.setPosition( x, 0 );
				randomAccess.setPosition( y, 1 );
				ip.set( x, y, randomAccess.get().getInteger() != 0 ? 255 : 0 );
			}
		}
		save( new ImagePlus( "", ip ), path );
	}

	private static void save( final ImagePlus imp, final String path ) throws PipelineExecutionException
	{
		if ( !IJ.saveAsTiff( imp, path ) )
			throw new PipelineExecutionException( "Failed to save " + path );
		LOG.info( "Saved {}", path );
	}

	private static int clampToInt( final double value, final double maxValue )
	{
		return ( int ) Math.round( Math.max( 0, Math.min( maxValue, value ) ) );
	}
}
