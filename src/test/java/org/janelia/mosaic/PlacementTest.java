package org.janelia.mosaic;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.RealInterval;
import net.imglib2.realtransform.AffineTransform2D;

public class PlacementTest
{
	private static final double EPSILON = 1e-9;

	@Test
	public void testTranslationOnly()
	{
		final AffineTransform2D transform = new Placement( 2.5, -1 ).toTransform( new double[] { 100, 50 }, new long[] { 10, 20 } );
		final double[] target = new double[ 2 ];
		transform.apply( new double[] { 0, 0 }, target );
		Assert.assertArrayEquals( new double[] { 102.5, 49 }, target, EPSILON );
		transform.apply( new double[] { 9, 19 }, target );
		Assert.assertArrayEquals( new double[] { 111.5, 68 }, target, EPSILON );
	}

	@Test
	public void testRotationAndScaleAboutCenter()
	{
		final long[] size = new long[] { 11, 21 };
		final double[] center = new double[] { 5, 10 };
		final AffineTransform2D transform = new Placement( 0, 0, 0.3, 1.004 ).toTransform( new double[] { 0, 0 }, size );
		final double[] target = new double[ 2 ];
		transform.apply( center, target );
		Assert.assertArrayEquals( center, target, EPSILON );

		// a point 10 px right of the center moves by the scale along x and by the rotation along y
		transform.apply( new double[] { 15, 10 }, target );
		Assert.assertEquals( 5 + 10 * 1.004 * Math.cos( Math.toRadians( 0.3 ) ), target[ 0 ], EPSILON );
		Assert.assertEquals( 10 + 10 * 1.004 * Math.sin( Math.toRadians( 0.3 ) ), target[ 1 ], EPSILON );
	}

	@Test
	public void testImmutableUpdates()
	{
		final Placement placement = new Placement( 1, 2, 0.1, 1.001 );
		final Placement moved = placement.translate( 0.5, -0.5 );
		Assert.assertEquals( new Placement( 1, 2, 0.1, 1.001 ), placement );
		Assert.assertEquals( new Placement( 1.5, 1.5, 0.1, 1.001 ), moved );
		Assert.assertEquals( new Placement( 3, 4, 0.1, 1.001 ), placement.withTranslation( 3, 4 ) );
		Assert.assertEquals( new Placement( 1, 2, -0.2, 0.999 ), placement.withRotationAndScale( -0.2, 0.999 ) );
		Assert.assertEquals( 1.5, new Placement( 1, -1 ).maxTranslationDistance( new Placement( 2, 0.5 ) ), EPSILON );
	}

	@Test
	public void testFootprint()
	{
		final TileRecord tile = new TileRecord( "t", new double[] { 10, 20 }, new long[] { 100, 50 } );
		final RealInterval footprint = tile.getFootprint( new Placement( 1.5, -2 ) );
		Assert.assertEquals( 11.5, footprint.realMin( 0 ), EPSILON );
		Assert.assertEquals( 18, footprint.realMin( 1 ), EPSILON );
		Assert.assertEquals( 110.5, footprint.realMax( 0 ), EPSILON );
		Assert.assertEquals( 67, footprint.realMax( 1 ), EPSILON );
	}

	@Test
	public void testBounds()
	{
		final MosaicParameters params = new MosaicParameters();
		params.setOverlapMax( 5 );
		params.setMaxScalePercent( 0.5 );
		params.setMaxRotationDeg( 0.2 );

		final Placement initial = new Placement( 1, 1 );
		Assert.assertTrue( params.isWithinBounds( new Placement( 6, -4, 0.2, 1.005 ), initial ) );
		Assert.assertFalse( params.isWithinBounds( new Placement( 6.1, 1 ), initial ) );
		Assert.assertFalse( params.isWithinBounds( new Placement( 1, 1, 0, 1.006 ), initial ) );
		Assert.assertFalse( params.isWithinBounds( new Placement( 1, 1, -0.3, 1 ), initial ) );

		final Placement clamped = params.clamp( new Placement( 20, -20, 1, 0.9 ), initial );
		Assert.assertEquals( new Placement( 6, -4, 0.2, 0.995 ), clamped );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testOverlapMaxLimit()
	{
		final MosaicParameters params = new MosaicParameters();
		params.setOverlapMax( MosaicParameters.OVERLAP_MAX_LIMIT + 1 );
		params.validate();
	}

	@Test( expected = IllegalArgumentException.class )
	public void testScaleLimit()
	{
		final MosaicParameters params = new MosaicParameters();
		params.setMaxScalePercent( 0.6 );
		params.validate();
	}
}
