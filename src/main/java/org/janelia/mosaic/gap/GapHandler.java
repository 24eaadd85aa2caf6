package org.janelia.mosaic.gap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.janelia.mosaic.MosaicParameters;
import org.janelia.mosaic.fusion.Canvas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;

/**
 * Closes small gaps that remain in the canvas after compositing.
 * <p>
 * Gap pixels are grouped into 4-connected components. The thickness of a component is the side of the largest square
 * of gap pixels it contains, so a long seam crack of width 2 has thickness 2 regardless of its length.
 * Components not thicker than {@code seam_fill_max_px} are filled, larger ones are left as they are.
 * Components are always analyzed over the whole canvas, so a local rerun takes the same decisions as a full run.
 */
public class GapHandler
{
	private static final Logger LOG = LoggerFactory.getLogger( GapHandler.class );

	private final MosaicParameters params;

	public GapHandler( final MosaicParameters params )
	{
		this.params = params;
	}

	GapFiller createFiller()
	{
		switch ( params.getGapFill() )
		{
		case INPAINT:
			return new TeleaInpainter( params.getInpaintRadius() );
		case EDGE_EXTEND:
		default:
			// a pixel in a component of thickness t is at most 2t away from a contributed pixel
			return new EdgeExtendFiller( 2 * params.getSeamFillMaxPx() + 2 );
		}
	}

	public GapReport fill( final Canvas canvas )
	{
		return fill( canvas, canvas.getInterval() );
	}

	/**
	 * Fills the gaps within {@code region}. The region is grown to cover every gap component it touches,
	 * a component is always filled or left open as a whole.
	 *
	 * @return gap masks of the grown region before and after filling
	 */
	public GapReport fill( final Canvas canvas, final Interval region )
	{
		final Interval canvasInterval = canvas.getInterval();
		final int width = ( int ) canvasInterval.dimension( 0 ), height = ( int ) canvasInterval.dimension( 1 );
		final long minX = canvasInterval.min( 0 ), minY = canvasInterval.min( 1 );

		final boolean[] gaps = new boolean[ width * height ];
		for ( int y = 0; y < height; ++y )
			for ( int x = 0; x < width; ++x )
				gaps[ y * width + x ] = !canvas.hasContribution( minX + x, minY + y );

		final int[] squares = computeLargestSquares( gaps, width, height );
		final Interval target = growToComponents( Intervals.intersect( region, canvasInterval ), canvasInterval, gaps, squares );

		final int targetWidth = ( int ) target.dimension( 0 ), targetHeight = ( int ) target.dimension( 1 );
		final byte[] before = new byte[ targetWidth * targetHeight ];
		final boolean[] toFill = new boolean[ targetWidth * targetHeight ];
		final boolean[] visited = new boolean[ width * height ];
		int componentsFilled = 0, componentsLeft = 0;

		for ( long y = target.min( 1 ); y <= target.max( 1 ); ++y )
		{
			for ( long x = target.min( 0 ); x <= target.max( 0 ); ++x )
			{
				final int i = ( int ) ( ( y - minY ) * width + ( x - minX ) );
				if ( !gaps[ i ] )
					continue;

				before[ ( int ) ( ( y - target.min( 1 ) ) * targetWidth + ( x - target.min( 0 ) ) ) ] = GapReport.GAP;
				canvas.unfill( x, y );
				if ( visited[ i ] )
					continue;

				final List< Integer > component = new ArrayList<>();
				final int thickness = collectComponent( gaps, squares, visited, width, height, i, component );
				if ( params.isSeamFillEnabled() && thickness <= params.getSeamFillMaxPx() )
				{
					++componentsFilled;
					for ( final int j : component )
					{
						final long cx = minX + j % width, cy = minY + j / width;
						if ( cx >= target.min( 0 ) && cy >= target.min( 1 ) && cx <= target.max( 0 ) && cy <= target.max( 1 ) )
							toFill[ ( int ) ( ( cy - target.min( 1 ) ) * targetWidth + ( cx - target.min( 0 ) ) ) ] = true;
					}
				}
				else
				{
					++componentsLeft;
					LOG.debug( "gap of {} px with thickness {} is left unfilled", component.size(), thickness );
				}
			}
		}

		final long unfilled = createFiller().fill( canvas, target, toFill );
		if ( unfilled > 0 )
			LOG.warn( "{} gap pixels could not be reached from covered pixels", unfilled );

		final byte[] after = new byte[ before.length ];
		int i = 0;
		for ( long y = target.min( 1 ); y <= target.max( 1 ); ++y )
			for ( long x = target.min( 0 ); x <= target.max( 0 ); ++x, ++i )
				if ( before[ i ] == GapReport.GAP && !canvas.isFilled( x, y ) )
					after[ i ] = GapReport.GAP;

		final GapReport report = new GapReport( target, before, after, componentsFilled, componentsLeft );
		if ( report.getGapPixelsAfter() > 0 )
			LOG.warn( "{} gap pixels in {} remain unfilled ({} components thicker than {} px)", report.getGapPixelsAfter(), Util.printInterval( target ), componentsLeft, params.getSeamFillMaxPx() );
		else
			LOG.info( "Closed {} gap pixels in {} components", report.getGapPixelsBefore(), componentsFilled );
		return report;
	}

	/**
	 * @return {@code region} grown to the bounding box of the gap components that have a pixel within it
	 */
	static Interval growToComponents( final Interval region, final Interval canvasInterval, final boolean[] gaps, final int[] squares )
	{
		final int width = ( int ) canvasInterval.dimension( 0 ), height = ( int ) canvasInterval.dimension( 1 );
		final long minX = canvasInterval.min( 0 ), minY = canvasInterval.min( 1 );
		final long[] min = new long[ 2 ], max = new long[ 2 ];
		region.min( min );
		region.max( max );
		final boolean[] visited = new boolean[ width * height ];

		for ( long y = region.min( 1 ); y <= region.max( 1 ); ++y )
		{
			for ( long x = region.min( 0 ); x <= region.max( 0 ); ++x )
			{
				final int i = ( int ) ( ( y - minY ) * width + ( x - minX ) );
				if ( !gaps[ i ] || visited[ i ] )
					continue;

				final List< Integer > component = new ArrayList<>();
				collectComponent( gaps, squares, visited, width, height, i, component );
				for ( final int j : component )
				{
					final long cx = minX + j % width, cy = minY + j / width;
					min[ 0 ] = Math.min( min[ 0 ], cx );
					max[ 0 ] = Math.max( max[ 0 ], cx );
					min[ 1 ] = Math.min( min[ 1 ], cy );
					max[ 1 ] = Math.max( max[ 1 ], cy );
				}
			}
		}
		return new FinalInterval( min, max );
	}

	/**
	 * @return for every pixel the side of the largest all-gap square whose bottom right corner it is
	 */
	static int[] computeLargestSquares( final boolean[] gaps, final int width, final int height )
	{
		final int[] squares = new int[ width * height ];
		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				final int i = y * width + x;
				if ( !gaps[ i ] )
					continue;
				if ( x == 0 || y == 0 )
					squares[ i ] = 1;
				else
					squares[ i ] = 1 + Math.min( Math.min( squares[ i - 1 ], squares[ i - width ] ), squares[ i - width - 1 ] );
			}
		}
		return squares;
	}

	/**
	 * Collects the 4-connected component of gap pixels containing {@code seed}.
	 *
	 * @return thickness of the component
	 */
	private static int collectComponent(
			final boolean[] gaps,
			final int[] squares,
			final boolean[] visited,
			final int width,
			final int height,
			final int seed,
			final List< Integer > component )
	{
		int thickness = 0;
		final Deque< Integer > stack = new ArrayDeque<>();
		stack.push( seed );
		visited[ seed ] = true;
		while ( !stack.isEmpty() )
		{
			final int i = stack.pop();
			component.add( i );
			thickness = Math.max( thickness, squares[ i ] );

			final int x = i % width, y = i / width;
			if ( x > 0 )
				visit( gaps, visited, stack, i - 1 );
			if ( x < width - 1 )
				visit( gaps, visited, stack, i + 1 );
			if ( y > 0 )
				visit( gaps, visited, stack, i - width );
			if ( y < height - 1 )
				visit( gaps, visited, stack, i + width );
		}
		return thickness;
	}

	private static void visit( final boolean[] gaps, final boolean[] visited, final Deque< Integer > stack, final int i )
	{
		if ( gaps[ i ] && !visited[ i ] )
		{
			visited[ i ] = true;
			stack.push( i );
		}
	}
}
