package org.janelia.mosaic.gap;

import org.janelia.mosaic.fusion.Canvas;

import net.imglib2.Interval;

/**
 * Assigns values to canvas pixels that no tile contributes to.
 */
public interface GapFiller
{
	/**
	 * @param region part of the canvas to work on
	 * @param toFill pixels of {@code region} in row-major order that have to be filled
	 * @return number of pixels that could not be filled
	 */
	long fill( Canvas canvas, Interval region, boolean[] toFill );
}
