package org.janelia.mosaic;

import java.util.Arrays;

import net.imglib2.FinalRealInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealInterval;
import net.imglib2.realtransform.AffineTransform2D;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Represents a map tile: its metadata as stored in a tile configuration,
 * and the pixel buffer and content mask attached to it once loaded.
 * <p>
 * The pixel buffer is a 3D image (x, y, channel). The content mask is a 2D image of the same
 * width and height where {@code true} marks real imagery and {@code false} marks background/padding.
 */
public class TileRecord
{
	private String id;
	private Integer index;
	private String file;
	private String maskFile;
	private boolean backgroundMask;
	private ImageType type;
	private double[] position;
	private long[] size;
	private Placement placement;
	private boolean manualAdjustNeeded;

	private transient RandomAccessibleInterval< FloatType > pixels;
	private transient RandomAccessibleInterval< BitType > contentMask;

	public TileRecord( final String id, final double[] position, final long[] size )
	{
		if ( position.length != 2 || size.length != 2 )
			throw new IllegalArgumentException( "tiles are two-dimensional" );
		this.id = id;
		this.position = position;
		this.size = size;
		this.placement = Placement.IDENTITY;
	}

	TileRecord() { }

	public String getId() { return id; }
	public void setId( final String id ) { this.id = id; }

	public Integer getIndex() { return index; }
	public void setIndex( final Integer index ) { this.index = index; }

	public String getFilePath() { return file; }
	public void setFilePath( final String filePath ) { this.file = filePath; }

	public String getMaskFilePath() { return maskFile; }
	public void setMaskFilePath( final String maskFilePath ) { this.maskFile = maskFilePath; }

	/**
	 * @return {@code true} if the mask file marks background with non-zero values instead of content
	 */
	public boolean isBackgroundMask() { return backgroundMask; }
	public void setBackgroundMask( final boolean backgroundMask ) { this.backgroundMask = backgroundMask; }

	public ImageType getType() { return type; }
	public void setType( final ImageType type ) { this.type = type; }

	public double[] getPosition() { return position; }
	public double getPosition( final int d ) { return position[ d ]; }

	public long[] getSize() { return size; }
	public long getSize( final int d ) { return size[ d ]; }
	public void setSize( final long[] size ) { this.size = size; }

	/**
	 * @return the placement the tile was loaded with
	 */
	public Placement getInitialPlacement()
	{
		return placement == null ? Placement.IDENTITY : placement;
	}

	public void setInitialPlacement( final Placement placement )
	{
		this.placement = placement;
	}

	public RandomAccessibleInterval< FloatType > getPixels() { return pixels; }
	public RandomAccessibleInterval< BitType > getContentMask() { return contentMask; }

	public void setImage( final RandomAccessibleInterval< FloatType > pixels, final RandomAccessibleInterval< BitType > contentMask )
	{
		this.pixels = pixels;
		this.contentMask = contentMask;
	}

	/**
	 * @return {@code true} if an earlier run flagged the tile for manual adjustment, refinement leaves it in place
	 */
	public boolean isManualAdjustNeeded() { return manualAdjustNeeded; }
	public void setManualAdjustNeeded( final boolean manualAdjustNeeded ) { this.manualAdjustNeeded = manualAdjustNeeded; }

	/**
	 * @return a record with the same metadata and content mask but a different pixel buffer
	 */
	public TileRecord withPixels( final RandomAccessibleInterval< FloatType > newPixels )
	{
		final TileRecord copy = new TileRecord( id, position.clone(), size.clone() );
		copy.index = index;
		copy.file = file;
		copy.maskFile = maskFile;
		copy.backgroundMask = backgroundMask;
		copy.type = type;
		copy.placement = placement;
		copy.manualAdjustNeeded = manualAdjustNeeded;
		copy.setImage( newPixels, contentMask );
		return copy;
	}

	public int getNumChannels()
	{
		return pixels == null ? 0 : ( int ) pixels.dimension( 2 );
	}

	public double getMaxValue()
	{
		return type == null ? ImageType.GRAY8.getMaxValue() : type.getMaxValue();
	}

	public boolean isLoaded()
	{
		return pixels != null;
	}

	/**
	 * Checks that the pixel buffer and the content mask are present and have matching dimensions.
	 *
	 * @return a description of the problem, or {@code null} if the tile is valid
	 */
	public String validate()
	{
		if ( pixels == null )
			return "pixel buffer is missing";
		if ( contentMask == null )
			return "content mask is missing";
		if ( pixels.numDimensions() != 3 || contentMask.numDimensions() != 2 )
			return "unexpected dimensionality";
		for ( int d = 0; d < 2; ++d )
			if ( pixels.dimension( d ) != size[ d ] || contentMask.dimension( d ) != size[ d ] )
				return "size mismatch: expected " + Arrays.toString( size ) + ", pixels " + pixels.dimension( 0 ) + "x" + pixels.dimension( 1 ) + ", mask " + contentMask.dimension( 0 ) + "x" + contentMask.dimension( 1 );
		return null;
	}

	public AffineTransform2D getTransform( final Placement placement )
	{
		return placement.toTransform( position, size );
	}

	/**
	 * @return canvas-space bounding box of the tile under the given placement
	 */
	public RealInterval getFootprint( final Placement placement )
	{
		final AffineTransform2D transform = getTransform( placement );
		final double[] min = new double[] { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY };
		final double[] max = new double[] { Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY };
		final double[] corner = new double[ 2 ], transformed = new double[ 2 ];
		for ( int i = 0; i < 4; ++i )
		{
			corner[ 0 ] = ( i & 1 ) == 0 ? 0 : size[ 0 ] - 1;
			corner[ 1 ] = ( i & 2 ) == 0 ? 0 : size[ 1 ] - 1;
			transform.apply( corner, transformed );
			for ( int d = 0; d < 2; ++d )
			{
				min[ d ] = Math.min( min[ d ], transformed[ d ] );
				max[ d ] = Math.max( max[ d ], transformed[ d ] );
			}
		}
		return new FinalRealInterval( min, max );
	}

	@Override
	public String toString()
	{
		return id != null ? id : String.valueOf( index );
	}
}
