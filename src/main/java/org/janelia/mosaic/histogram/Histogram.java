package org.janelia.mosaic.histogram;

import java.io.Serializable;

/**
 * Fixed-range histogram with uniform bins. Values outside of the range are counted in the first or the last bin
 * and additionally tracked as under/oversaturated quantities.
 */
public class Histogram implements Serializable
{
	private static final long serialVersionUID = 2715943047618092321L;

	private final double[] histogram;
	private final double minValue, maxValue, binWidth;
	private double quantityTotal, quantityLessThanMin, quantityGreaterThanMax;

	public Histogram( final double minValue, final double maxValue, final int bins )
	{
		if ( minValue >= maxValue || bins < 1 )
			throw new IllegalArgumentException( "invalid histogram range [" + minValue + ", " + maxValue + ") with " + bins + " bins" );
		this.histogram = new double[ bins ];
		this.minValue = minValue;
		this.maxValue = maxValue;
		this.binWidth = ( maxValue - minValue ) / bins;
	}

	public int getNumBins() { return histogram.length; }
	public double getMinValue() { return minValue; }
	public double getMaxValue() { return maxValue; }
	public double getBinWidth() { return binWidth; }
	public double getQuantityTotal() { return quantityTotal; }
	public double getQuantityLessThanMin() { return quantityLessThanMin; }
	public double getQuantityGreaterThanMax() { return quantityGreaterThanMax; }

	public double get( final int bin )
	{
		return histogram[ bin ];
	}

	/**
	 * @return the center of the bin
	 */
	public double getBinValue( final int bin )
	{
		return minValue + ( bin + 0.5 ) * binWidth;
	}

	public int getBin( final double value )
	{
		if ( value < minValue )
			return 0;
		if ( value >= maxValue )
			return histogram.length - 1;
		return Math.min( histogram.length - 1, ( int ) Math.floor( ( value - minValue ) / binWidth ) );
	}

	public void put( final double value )
	{
		put( value, 1 );
	}

	public void put( final double value, final double quantity )
	{
		if ( value < minValue )
			quantityLessThanMin += quantity;
		else if ( value >= maxValue )
			quantityGreaterThanMax += quantity;
		histogram[ getBin( value ) ] += quantity;
		quantityTotal += quantity;
	}

	public void add( final Histogram other )
	{
		if ( other.getNumBins() != getNumBins() || other.getMinValue() != minValue || other.getMaxValue() != maxValue )
			throw new IllegalArgumentException( "histograms have different binning" );

		for ( int bin = 0; bin < getNumBins(); ++bin )
			histogram[ bin ] += other.get( bin );

		quantityTotal += other.getQuantityTotal();
		quantityLessThanMin += other.getQuantityLessThanMin();
		quantityGreaterThanMax += other.getQuantityGreaterThanMax();
	}

	/**
	 * @return normalized cumulative distribution, {@code cdf[i]} being the fraction of the quantity in bins {@code 0..i}
	 */
	public double[] getCumulativeDistribution()
	{
		final double[] cdf = new double[ histogram.length ];
		double sum = 0;
		for ( int bin = 0; bin < histogram.length; ++bin )
		{
			sum += histogram[ bin ];
			cdf[ bin ] = quantityTotal > 0 ? sum / quantityTotal : 0;
		}
		return cdf;
	}
}
