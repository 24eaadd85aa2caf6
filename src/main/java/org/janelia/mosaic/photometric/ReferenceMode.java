package org.janelia.mosaic.photometric;

import com.google.gson.annotations.SerializedName;

/**
 * Where the reference luminance statistic comes from.
 */
public enum ReferenceMode
{
	/** pooled statistic over the content pixels of all tiles */
	@SerializedName( "global" )
	GLOBAL,

	/** the already normalized left (or else top) neighbor of each tile */
	@SerializedName( "neighbor" )
	NEIGHBOR;

	public static ReferenceMode fromString( final String str )
	{
		for ( final ReferenceMode mode : values() )
			if ( mode.name().equalsIgnoreCase( str ) )
				return mode;
		throw new IllegalArgumentException( "Invalid reference mode '" + str + "'. Possible values are: 'global' or 'neighbor'" );
	}
}
