package org.janelia.mosaic.fusion;

import net.imglib2.Interval;

/**
 * A tile resampled into canvas space over its placed bounding box, split into frequency bands,
 * with the blending weight of every band. All arrays are in row-major order over {@link #getInterval()}.
 */
public class TileContribution
{
	private final int tileIndex;
	private final Interval interval;
	private final boolean[] coverage;
	private final float[][] values;
	private final float[] baseWeights;
	private final float[][] bandWeights;
	private final float[][][] bands;

	public TileContribution(
			final int tileIndex,
			final Interval interval,
			final boolean[] coverage,
			final float[][] values,
			final float[] baseWeights,
			final float[][] bandWeights,
			final float[][][] bands )
	{
		this.tileIndex = tileIndex;
		this.interval = interval;
		this.coverage = coverage;
		this.values = values;
		this.baseWeights = baseWeights;
		this.bandWeights = bandWeights;
		this.bands = bands;
	}

	public int getTileIndex() { return tileIndex; }
	public Interval getInterval() { return interval; }
	public int getNumChannels() { return values.length; }
	public int getNumBands() { return bands.length; }

	public boolean isCovered( final int i ) { return coverage[ i ]; }

	/**
	 * @return resampled tile value before band decomposition
	 */
	public float getValue( final int channel, final int i ) { return values[ channel ][ i ]; }

	/**
	 * @return weight with the nominal feather ramp, used to elect the authoritative tile on protected pixels
	 */
	public float getBaseWeight( final int i ) { return baseWeights[ i ]; }

	public float getBandWeight( final int band, final int i ) { return bandWeights[ band ][ i ]; }
	public float getBandValue( final int band, final int channel, final int i ) { return bands[ band ][ channel ][ i ]; }
}
