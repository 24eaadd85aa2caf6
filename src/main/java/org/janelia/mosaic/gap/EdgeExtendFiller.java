package org.janelia.mosaic.gap;

import java.util.Arrays;

import org.janelia.mosaic.fusion.Canvas;

import net.imglib2.Interval;

/**
 * Fills every gap pixel with the inverse-distance weighted mean of the closest pixels that tiles contribute to.
 * Candidates are searched in square rings of growing radius, the first ring that contains any contributed pixel is used.
 * Only tile contributions are read, so the result does not depend on the order in which pixels are filled.
 */
public class EdgeExtendFiller implements GapFiller
{
	private final int searchRadius;

	public EdgeExtendFiller( final int searchRadius )
	{
		this.searchRadius = searchRadius;
	}

	@Override
	public long fill( final Canvas canvas, final Interval region, final boolean[] toFill )
	{
		final int numChannels = canvas.getNumChannels();
		final double[] values = new double[ numChannels ], sums = new double[ numChannels ];
		long unfilled = 0;

		int i = 0;
		for ( long y = region.min( 1 ); y <= region.max( 1 ); ++y )
		{
			for ( long x = region.min( 0 ); x <= region.max( 0 ); ++x, ++i )
			{
				if ( !toFill[ i ] )
					continue;

				boolean found = false;
				for ( int r = 1; r <= searchRadius && !found; ++r )
				{
					double weightSum = 0;
					Arrays.fill( sums, 0 );
					for ( long dy = -r; dy <= r; ++dy )
					{
						// only the ring at Chebyshev distance r
						final long step = Math.abs( dy ) == r ? 1 : 2 * r;
						for ( long dx = -r; dx <= r; dx += step )
						{
							final long nx = x + dx, ny = y + dy;
							if ( !canvas.contains( nx, ny ) || !canvas.hasContribution( nx, ny ) )
								continue;

							canvas.getValue( nx, ny, values );
							final double weight = 1.0 / Math.sqrt( dx * dx + dy * dy );
							for ( int c = 0; c < numChannels; ++c )
								sums[ c ] += weight * values[ c ];
							weightSum += weight;
						}
					}

					if ( weightSum > 0 )
					{
						for ( int c = 0; c < numChannels; ++c )
							sums[ c ] /= weightSum;
						canvas.fill( x, y, sums );
						found = true;
					}
				}

				if ( !found )
					++unfilled;
			}
		}
		return unfilled;
	}
}
