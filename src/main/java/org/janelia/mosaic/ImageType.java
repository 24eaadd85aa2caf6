package org.janelia.mosaic;

import java.util.TreeMap;

import ij.ImagePlus;

/**
 * Convenience mapping from ImagePlus integer constant values of supported tile types to a enum,
 * together with the channel count and the sample range of each type.
 */
public enum ImageType
{
	/** 8-bit grayscale (unsigned) */
	GRAY8( ImagePlus.GRAY8, 1, 255 ),

	/** 16-bit grayscale (unsigned) */
	GRAY16( ImagePlus.GRAY16, 1, 65535 ),

	/** 24-bit packed RGB */
	COLOR_RGB( ImagePlus.COLOR_RGB, 3, 255 );

	private final int val;
	private final int numChannels;
	private final double maxValue;

	private ImageType( final int val, final int numChannels, final double maxValue )
	{
		this.val = val;
		this.numChannels = numChannels;
		this.maxValue = maxValue;
	}

	public int getNumChannels()
	{
		return numChannels;
	}

	public double getMaxValue()
	{
		return maxValue;
	}

	public int getImagePlusType()
	{
		return val;
	}

	// for creating ImageType object from an integer value
	private static final TreeMap< Integer, ImageType > map = new TreeMap<>();
	static
	{
		for ( final ImageType type : values() )
			map.put( type.val, type );
	}
	public static ImageType valueOf( final int val )
	{
		return map.get( val );
	}
}
