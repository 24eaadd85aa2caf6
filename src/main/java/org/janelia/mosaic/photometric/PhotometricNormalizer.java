package org.janelia.mosaic.photometric;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.janelia.mosaic.TileRecord;
import org.janelia.mosaic.histogram.HistogramsMatching;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Equalizes the luminance of tiles so that adjacent tiles do not show brightness jumps at their seams.
 * <p>
 * Color tiles are corrected in YCbCr space: only the luminance is changed, chroma is preserved.
 * Only content pixels are corrected, background pixels keep their values.
 * The tile's own buffer is never modified, a corrected copy is returned instead.
 */
public class PhotometricNormalizer
{
	private static final Logger LOG = LoggerFactory.getLogger( PhotometricNormalizer.class );

	private static final double EPSILON = 1e-6;

	private final ColorMatchMode mode;
	private final ReferenceMode referenceMode;

	public PhotometricNormalizer( final ColorMatchMode mode, final ReferenceMode referenceMode )
	{
		this.mode = mode;
		this.referenceMode = referenceMode;
	}

	public ColorMatchMode getMode() { return mode; }
	public ReferenceMode getReferenceMode() { return referenceMode; }

	public static LuminanceStatistics computeStatistics( final TileRecord tile )
	{
		return LuminanceStatistics.compute( tile.getPixels(), tile.getContentMask(), tile.getMaxValue() );
	}

	/**
	 * Normalizes every tile against the reference selected by the {@link ReferenceMode}.
	 *
	 * @return corrected pixel buffers in the same order as {@code tiles}
	 */
	public List< RandomAccessibleInterval< FloatType > > normalizeAll( final List< TileRecord > tiles )
	{
		final List< RandomAccessibleInterval< FloatType > > normalized = new ArrayList<>();
		if ( mode == ColorMatchMode.OFF )
		{
			for ( final TileRecord tile : tiles )
				normalized.add( tile.getPixels() );
			return normalized;
		}

		if ( referenceMode == ReferenceMode.GLOBAL )
		{
			final List< LuminanceStatistics > allStatistics = new ArrayList<>();
			double maxValue = 0;
			for ( final TileRecord tile : tiles )
			{
				allStatistics.add( computeStatistics( tile ) );
				maxValue = Math.max( maxValue, tile.getMaxValue() );
			}
			final LuminanceStatistics reference = LuminanceStatistics.pool( allStatistics, maxValue );
			LOG.info( "Normalizing {} tiles against global luminance {}", tiles.size(), reference );

			for ( int i = 0; i < tiles.size(); ++i )
				normalized.add( normalize( tiles.get( i ), allStatistics.get( i ), reference ) );
			return normalized;
		}

		// neighbor mode: a tile is corrected after its predecessor, which may come later in row order on a jittered grid
		final List< Integer > order = new ArrayList<>();
		final int[] predecessors = new int[ tiles.size() ];
		for ( int i = 0; i < tiles.size(); ++i )
		{
			order.add( i );
			normalized.add( null );
			predecessors[ i ] = findPredecessor( tiles, i );
		}
		order.sort( Comparator
				.comparingDouble( ( Integer i ) -> tiles.get( i ).getPosition( 1 ) )
				.thenComparingDouble( i -> tiles.get( i ).getPosition( 0 ) ) );

		for ( final int start : order )
		{
			final List< Integer > chain = new ArrayList<>();
			int i = start;
			while ( i >= 0 && normalized.get( i ) == null && !chain.contains( i ) )
			{
				chain.add( i );
				i = predecessors[ i ];
			}
			for ( int k = chain.size() - 1; k >= 0; --k )
				normalized.set( chain.get( k ), normalizeToPredecessor( tiles, chain.get( k ), predecessors[ chain.get( k ) ], normalized ) );
		}
		return normalized;
	}

	private RandomAccessibleInterval< FloatType > normalizeToPredecessor(
			final List< TileRecord > tiles,
			final int index,
			final int predecessor,
			final List< RandomAccessibleInterval< FloatType > > normalized )
	{
		final TileRecord tile = tiles.get( index );
		// the first tile of a chain, or a tile closing a cycle of predecessors
		if ( predecessor < 0 || normalized.get( predecessor ) == null )
		{
			LOG.debug( "tile {} has no corrected predecessor and serves as a reference", tile );
			return tile.getPixels();
		}

		final TileRecord referenceTile = tiles.get( predecessor );
		final LuminanceStatistics reference = LuminanceStatistics.compute( normalized.get( predecessor ), referenceTile.getContentMask(), referenceTile.getMaxValue() );
		LOG.debug( "tile {} is matched to its neighbor {} with luminance {}", tile, referenceTile, reference );
		return normalize( tile, computeStatistics( tile ), reference );
	}

	/**
	 * @return index of the left neighbor of the tile in the nominal grid, or of its top neighbor if there is no left one, or -1
	 */
	static int findPredecessor( final List< TileRecord > tiles, final int index )
	{
		final TileRecord tile = tiles.get( index );
		int left = -1, top = -1;
		double leftDistance = Double.POSITIVE_INFINITY, topDistance = Double.POSITIVE_INFINITY;
		for ( int j = 0; j < tiles.size(); ++j )
		{
			if ( j == index )
				continue;
			final TileRecord other = tiles.get( j );
			final double offsetX = tile.getPosition( 0 ) - other.getPosition( 0 );
			final double offsetY = tile.getPosition( 1 ) - other.getPosition( 1 );

			if ( Math.abs( offsetY ) < tile.getSize( 1 ) / 2.0 && offsetX > 0 && offsetX < leftDistance )
			{
				left = j;
				leftDistance = offsetX;
			}
			if ( Math.abs( offsetX ) < tile.getSize( 0 ) / 2.0 && offsetY > 0 && offsetY < topDistance )
			{
				top = j;
				topDistance = offsetY;
			}
		}
		return left >= 0 ? left : top;
	}

	public RandomAccessibleInterval< FloatType > normalize( final TileRecord tile, final LuminanceStatistics reference )
	{
		return normalize( tile, computeStatistics( tile ), reference );
	}

	public RandomAccessibleInterval< FloatType > normalize( final TileRecord tile, final LuminanceStatistics source, final LuminanceStatistics reference )
	{
		final ArrayImg< FloatType, FloatArray > corrected = copy( tile.getPixels() );
		if ( mode == ColorMatchMode.OFF || source.isEmpty() || reference.isEmpty() )
			return corrected;

		final LuminanceTransfer transfer = createTransfer( source, reference );
		final double maxValue = tile.getMaxValue();
		final boolean color = corrected.dimension( 2 ) >= 3;
		final long width = corrected.dimension( 0 ), height = corrected.dimension( 1 );

		final RandomAccess< FloatType > pixelsRandomAccess = corrected.randomAccess();
		final RandomAccess< BitType > maskRandomAccess = tile.getContentMask().randomAccess();
		final double[] rgb = new double[ 3 ], ycbcr = new double[ 3 ];

		for ( long y = 0; y < height; ++y )
		{
			for ( long x = 0; x < width; ++x )
			{
				maskRandomAccess.setPosition( x, 0 );
				maskRandomAccess.setPosition( y, 1 );
				if ( !maskRandomAccess.get().get() )
					continue;

				pixelsRandomAccess.setPosition( x, 0 );
				pixelsRandomAccess.setPosition( y, 1 );
				pixelsRandomAccess.setPosition( 0, 2 );

				if ( !color )
				{
					final FloatType value = pixelsRandomAccess.get();
					value.setReal( clamp( transfer.apply( value.getRealDouble() ), maxValue ) );
					continue;
				}

				for ( int c = 0; c < 3; ++c )
				{
					pixelsRandomAccess.setPosition( c, 2 );
					rgb[ c ] = pixelsRandomAccess.get().getRealDouble();
				}
				ColorSpace.rgbToYCbCr( rgb, ycbcr, maxValue );
				ycbcr[ 0 ] = transfer.apply( ycbcr[ 0 ] );
				ColorSpace.yCbCrToRgb( ycbcr, rgb, maxValue );
				for ( int c = 0; c < 3; ++c )
				{
					pixelsRandomAccess.setPosition( c, 2 );
					pixelsRandomAccess.get().setReal( clamp( rgb[ c ], maxValue ) );
				}
			}
		}
		return corrected;
	}

	private LuminanceTransfer createTransfer( final LuminanceStatistics source, final LuminanceStatistics reference )
	{
		if ( mode == ColorMatchMode.STRONG )
		{
			final HistogramsMatching matching = new HistogramsMatching( source.getHistogram(), reference.getHistogram() );
			return matching::map;
		}

		final double mean = source.getMean(), referenceMean = reference.getMean();
		final double std = source.getStandardDeviation();
		final double gain = std > EPSILON ? reference.getStandardDeviation() / std : 1;
		return luminance -> ( luminance - mean ) * gain + referenceMean;
	}

	private static double clamp( final double value, final double maxValue )
	{
		return Math.max( 0, Math.min( maxValue, value ) );
	}

	static ArrayImg< FloatType, FloatArray > copy( final RandomAccessibleInterval< FloatType > pixels )
	{
		final ArrayImg< FloatType, FloatArray > copy = ArrayImgs.floats( pixels.dimension( 0 ), pixels.dimension( 1 ), pixels.dimension( 2 ) );
		final Cursor< FloatType > sourceCursor = Views.flatIterable( pixels ).cursor();
		final Cursor< FloatType > targetCursor = copy.cursor();
		while ( targetCursor.hasNext() )
			targetCursor.next().set( sourceCursor.next() );
		return copy;
	}

	@FunctionalInterface
	private interface LuminanceTransfer
	{
		double apply( double luminance );
	}
}
