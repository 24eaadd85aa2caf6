package org.janelia.mosaic.photometric;

import com.google.gson.annotations.SerializedName;

/**
 * Strength of the luminance correction applied by {@link PhotometricNormalizer}.
 */
public enum ColorMatchMode
{
	/** tiles pass through unchanged */
	@SerializedName( "off" )
	OFF,

	/** linear mean/variance match */
	@SerializedName( "normal" )
	NORMAL,

	/** full histogram matching */
	@SerializedName( "strong" )
	STRONG;

	public static ColorMatchMode fromString( final String str )
	{
		for ( final ColorMatchMode mode : values() )
			if ( mode.name().equalsIgnoreCase( str ) )
				return mode;
		throw new IllegalArgumentException( "Invalid color match mode '" + str + "'. Possible values are: 'off', 'normal' or 'strong'" );
	}
}
