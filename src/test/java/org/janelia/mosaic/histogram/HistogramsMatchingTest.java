package org.janelia.mosaic.histogram;

import org.junit.Assert;
import org.junit.Test;

public class HistogramsMatchingTest
{
	private static final double EPSILON = 1e-6;

	private static Histogram uniform( final int from, final int to )
	{
		final Histogram histogram = new Histogram( 0, 256, 256 );
		for ( int value = from; value <= to; ++value )
			histogram.put( value );
		return histogram;
	}

	@Test
	public void testBinning()
	{
		final Histogram histogram = new Histogram( 10, 20, 5 );
		Assert.assertEquals( 11, histogram.getBinValue( 0 ), EPSILON );
		Assert.assertEquals( 19, histogram.getBinValue( 4 ), EPSILON );

		histogram.put( 5 );
		histogram.put( 12 );
		histogram.put( 25 );
		Assert.assertEquals( 1, histogram.get( 0 ), EPSILON );
		Assert.assertEquals( 1, histogram.get( 1 ), EPSILON );
		Assert.assertEquals( 1, histogram.get( 4 ), EPSILON );
		Assert.assertEquals( 1, histogram.getQuantityLessThanMin(), EPSILON );
		Assert.assertEquals( 1, histogram.getQuantityGreaterThanMax(), EPSILON );
		Assert.assertArrayEquals( new double[] { 1 / 3.0, 2 / 3.0, 2 / 3.0, 2 / 3.0, 1 }, histogram.getCumulativeDistribution(), EPSILON );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testDifferentBinningCannotBeAdded()
	{
		new Histogram( 0, 256, 256 ).add( new Histogram( 0, 256, 128 ) );
	}

	@Test
	public void testIdentity()
	{
		final Histogram histogram = uniform( 30, 200 );
		final HistogramsMatching matching = new HistogramsMatching( histogram, histogram );
		for ( int value = 30; value <= 200; value += 7 )
			Assert.assertEquals( value, matching.map( value ), EPSILON );
	}

	@Test
	public void testShiftedDistribution()
	{
		final HistogramsMatching matching = new HistogramsMatching( uniform( 50, 99 ), uniform( 100, 149 ) );
		Assert.assertEquals( 125, matching.map( 75 ), EPSILON );
		Assert.assertEquals( 0.5, matching.sourceQuantile( 75 ), EPSILON );

		final double[] lut = matching.createLookupTable( uniform( 50, 99 ) );
		for ( int bin = 51; bin < 99; ++bin )
			Assert.assertEquals( bin + 50.5, lut[ bin ], EPSILON );
	}

	@Test
	public void testMappingIsMonotonic()
	{
		final Histogram source = uniform( 0, 60 );
		source.add( uniform( 200, 255 ) );
		final HistogramsMatching matching = new HistogramsMatching( source, uniform( 80, 180 ) );
		double previous = Double.NEGATIVE_INFINITY;
		for ( int value = 1; value < 256; ++value )
		{
			final double mapped = matching.map( value );
			Assert.assertTrue( mapped >= previous - EPSILON );
			Assert.assertTrue( mapped >= 79 && mapped <= 182 );
			previous = mapped;
		}
	}

	@Test( expected = IllegalArgumentException.class )
	public void testEmptyHistogram()
	{
		new HistogramsMatching( new Histogram( 0, 256, 256 ), uniform( 0, 10 ) );
	}
}
