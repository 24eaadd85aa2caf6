package org.janelia.mosaic.fusion;

import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;
import net.imglib2.exception.IncompatibleTypeException;

/**
 * Splits an image into frequency bands that sum up exactly to the original image.
 * <p>
 * Level {@code k} is the image blurred with sigma {@code 2^k} (level 0 is the image itself). The blur is normalized
 * by the blurred coverage so that pixels without content do not darken the levels near the edges.
 * Band {@code k} is the difference of levels {@code k} and {@code k+1}, the last band is the last level.
 */
public class BandDecomposition
{
	private static final double EPSILON = 1e-6;

	/**
	 * @param channels pixel values in row-major order, one array per channel
	 * @param coverage pixels that have content
	 * @return bands indexed by [band][channel][pixel]
	 */
	public static float[][][] decompose(
			final float[][] channels,
			final boolean[] coverage,
			final int width,
			final int height,
			final int numBands ) throws IncompatibleTypeException
	{
		final int numChannels = channels.length, numPixels = width * height;
		final float[][][] levels = new float[ numBands ][][];
		levels[ 0 ] = channels;

		if ( numBands > 1 )
		{
			final float[] mask = new float[ numPixels ];
			final float[][] maskedChannels = new float[ numChannels ][ numPixels ];
			for ( int i = 0; i < numPixels; ++i )
			{
				if ( !coverage[ i ] )
					continue;
				mask[ i ] = 1;
				for ( int c = 0; c < numChannels; ++c )
					maskedChannels[ c ][ i ] = channels[ c ][ i ];
			}

			for ( int k = 1; k < numBands; ++k )
			{
				final double sigma = Math.pow( 2, k );
				final float[] blurredMask = blur( mask, width, height, sigma );
				levels[ k ] = new float[ numChannels ][];
				for ( int c = 0; c < numChannels; ++c )
				{
					final float[] blurred = blur( maskedChannels[ c ], width, height, sigma );
					for ( int i = 0; i < numPixels; ++i )
						blurred[ i ] = coverage[ i ] && blurredMask[ i ] > EPSILON ? blurred[ i ] / blurredMask[ i ] : channels[ c ][ i ];
					levels[ k ][ c ] = blurred;
				}
			}
		}

		final float[][][] bands = new float[ numBands ][][];
		for ( int k = 0; k < numBands - 1; ++k )
		{
			bands[ k ] = new float[ numChannels ][ numPixels ];
			for ( int c = 0; c < numChannels; ++c )
				for ( int i = 0; i < numPixels; ++i )
					bands[ k ][ c ][ i ] = levels[ k ][ c ][ i ] - levels[ k + 1 ][ c ][ i ];
		}
		bands[ numBands - 1 ] = levels[ numBands - 1 ];
		return bands;
	}

	private static final double BLUR_ACCURACY = 0.0002;

	private static float[] blur( final float[] values, final int width, final int height, final double sigma )
	{
		final FloatProcessor processor = new FloatProcessor( width, height, values.clone() );
		new GaussianBlur().blurGaussian( processor, sigma, sigma, BLUR_ACCURACY );
		return ( float[] ) processor.getPixels();
	}
}
