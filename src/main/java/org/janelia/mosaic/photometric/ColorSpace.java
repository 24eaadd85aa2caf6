package org.janelia.mosaic.photometric;

/**
 * Full range BT.601 conversion between RGB and YCbCr.
 * Chroma components are centered at {@code floor(maxValue / 2) + 1}, i.e. 128 for 8-bit data.
 */
public class ColorSpace
{
	private static final double KR = 0.299, KG = 0.587, KB = 0.114;

	public static double luminance( final double r, final double g, final double b )
	{
		return KR * r + KG * g + KB * b;
	}

	public static void rgbToYCbCr( final double[] rgb, final double[] ycbcr, final double maxValue )
	{
		final double offset = chromaOffset( maxValue );
		final double y = luminance( rgb[ 0 ], rgb[ 1 ], rgb[ 2 ] );
		ycbcr[ 0 ] = y;
		ycbcr[ 1 ] = offset + ( rgb[ 2 ] - y ) / ( 2 * ( 1 - KB ) );
		ycbcr[ 2 ] = offset + ( rgb[ 0 ] - y ) / ( 2 * ( 1 - KR ) );
	}

	public static void yCbCrToRgb( final double[] ycbcr, final double[] rgb, final double maxValue )
	{
		final double offset = chromaOffset( maxValue );
		final double y = ycbcr[ 0 ], cb = ycbcr[ 1 ] - offset, cr = ycbcr[ 2 ] - offset;
		rgb[ 0 ] = y + 2 * ( 1 - KR ) * cr;
		rgb[ 2 ] = y + 2 * ( 1 - KB ) * cb;
		rgb[ 1 ] = ( y - KR * rgb[ 0 ] - KB * rgb[ 2 ] ) / KG;
	}

	private static double chromaOffset( final double maxValue )
	{
		return Math.floor( maxValue / 2 ) + 1;
	}
}
