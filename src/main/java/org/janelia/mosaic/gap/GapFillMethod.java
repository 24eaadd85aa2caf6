package org.janelia.mosaic.gap;

import com.google.gson.annotations.SerializedName;

/**
 * How {@link GapHandler} paints closable gaps.
 */
public enum GapFillMethod
{
	@SerializedName( "edge-extend" )
	EDGE_EXTEND( "edge-extend" ),

	@SerializedName( "inpaint" )
	INPAINT( "inpaint" );

	private final String str;

	private GapFillMethod( final String str )
	{
		this.str = str;
	}

	@Override
	public String toString()
	{
		return str;
	}

	public static GapFillMethod fromString( final String str )
	{
		for ( final GapFillMethod method : values() )
			if ( method.str.equalsIgnoreCase( str ) || method.name().equalsIgnoreCase( str ) )
				return method;
		throw new IllegalArgumentException( "Invalid gap fill method '" + str + "'. Possible values are: 'edge-extend' or 'inpaint'" );
	}
}
