package org.janelia.mosaic.histogram;

/**
 * Maps values of one distribution onto another by matching their cumulative distributions.
 * <p>
 * Both cumulative distributions are treated as piecewise linear functions through the bin centers,
 * where the knot of a bin is placed halfway through the quantity of that bin.
 * A value is converted into its quantile under the source histogram, and the quantile is converted back
 * into a value under the reference histogram.
 */
public class HistogramsMatching
{
	private static final double EPSILON = 1e-10;

	private final double[] sourceKnotValues, sourceKnotQuantiles;
	private final double[] referenceKnotValues, referenceKnotQuantiles;

	public HistogramsMatching( final Histogram source, final Histogram reference )
	{
		if ( source.getQuantityTotal() < EPSILON || reference.getQuantityTotal() < EPSILON )
			throw new IllegalArgumentException( "Cannot match empty histograms" );

		final int sourceKnots = source.getNumBins() + 2, referenceKnots = reference.getNumBins() + 2;
		sourceKnotValues = new double[ sourceKnots ];
		sourceKnotQuantiles = new double[ sourceKnots ];
		referenceKnotValues = new double[ referenceKnots ];
		referenceKnotQuantiles = new double[ referenceKnots ];
		fillKnots( source, sourceKnotValues, sourceKnotQuantiles );
		fillKnots( reference, referenceKnotValues, referenceKnotQuantiles );
	}

	private static void fillKnots( final Histogram histogram, final double[] values, final double[] quantiles )
	{
		final double total = histogram.getQuantityTotal();
		values[ 0 ] = histogram.getMinValue();
		quantiles[ 0 ] = 0;
		double cumulative = 0;
		for ( int bin = 0; bin < histogram.getNumBins(); ++bin )
		{
			values[ bin + 1 ] = histogram.getBinValue( bin );
			quantiles[ bin + 1 ] = ( cumulative + histogram.get( bin ) / 2 ) / total;
			cumulative += histogram.get( bin );
		}
		values[ values.length - 1 ] = histogram.getMaxValue();
		quantiles[ quantiles.length - 1 ] = 1;
	}

	/**
	 * @return quantile of {@code value} under the source distribution
	 */
	public double sourceQuantile( final double value )
	{
		if ( value <= sourceKnotValues[ 0 ] )
			return 0;
		if ( value >= sourceKnotValues[ sourceKnotValues.length - 1 ] )
			return 1;

		int hi = 1;
		while ( sourceKnotValues[ hi ] < value )
			++hi;
		final int lo = hi - 1;
		final double t = ( value - sourceKnotValues[ lo ] ) / ( sourceKnotValues[ hi ] - sourceKnotValues[ lo ] );
		return sourceKnotQuantiles[ lo ] + t * ( sourceKnotQuantiles[ hi ] - sourceKnotQuantiles[ lo ] );
	}

	/**
	 * @return the smallest value whose quantile under the reference distribution is {@code quantile}
	 */
	public double referenceValue( final double quantile )
	{
		if ( quantile <= referenceKnotQuantiles[ 0 ] )
			return referenceKnotValues[ 0 ];

		int hi = 1;
		while ( hi < referenceKnotQuantiles.length - 1 && referenceKnotQuantiles[ hi ] < quantile )
			++hi;
		final int lo = hi - 1;
		final double span = referenceKnotQuantiles[ hi ] - referenceKnotQuantiles[ lo ];
		if ( span < EPSILON )
			return referenceKnotValues[ hi ];
		final double t = ( quantile - referenceKnotQuantiles[ lo ] ) / span;
		return referenceKnotValues[ lo ] + t * ( referenceKnotValues[ hi ] - referenceKnotValues[ lo ] );
	}

	public double map( final double value )
	{
		return referenceValue( sourceQuantile( value ) );
	}

	/**
	 * Precomputes the mapping at the centers of the source bins.
	 */
	public double[] createLookupTable( final Histogram source )
	{
		final double[] lut = new double[ source.getNumBins() ];
		for ( int bin = 0; bin < lut.length; ++bin )
			lut[ bin ] = map( source.getBinValue( bin ) );
		return lut;
	}
}
