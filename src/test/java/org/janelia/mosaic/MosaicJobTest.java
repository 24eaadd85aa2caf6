package org.janelia.mosaic;

import java.util.Arrays;
import java.util.EnumSet;

import org.janelia.mosaic.MosaicJob.PipelineStep;
import org.junit.Assert;
import org.junit.Test;

public class MosaicJobTest
{
	private static TileRecord createTile( final String id, final Integer index )
	{
		final TileRecord tile = new TileRecord( id, new double[] { 0, 0 }, new long[] { 10, 10 } );
		tile.setIndex( index );
		return tile;
	}

	@Test
	public void testPipeline()
	{
		final MosaicParameters params = new MosaicParameters();
		final TileRecord tile = createTile( "a", 0 );
		Assert.assertEquals( EnumSet.allOf( PipelineStep.class ), new MosaicJob( Arrays.asList( tile ), params ).getPipeline() );
		Assert.assertEquals( EnumSet.of( PipelineStep.Normalization, PipelineStep.Refinement ), new MosaicJob( Arrays.asList( tile ), params, true, false ).getPipeline() );
		Assert.assertEquals( EnumSet.of( PipelineStep.Normalization, PipelineStep.Blending ), new MosaicJob( Arrays.asList( tile ), params, false, true ).getPipeline() );
	}

	@Test
	public void testMissingIndexesAndIdsAreAssigned()
	{
		final TileRecord first = createTile( null, null ), second = createTile( "b", 0 ), third = createTile( "c", null );
		new MosaicJob( Arrays.asList( first, second, third ), new MosaicParameters() );

		Assert.assertEquals( 1, first.getIndex().intValue() );
		Assert.assertEquals( "1", first.getId() );
		Assert.assertEquals( 2, third.getIndex().intValue() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testDuplicateIndex()
	{
		new MosaicJob( Arrays.asList( createTile( "a", 3 ), createTile( "b", 3 ) ), new MosaicParameters() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testDuplicateId()
	{
		new MosaicJob( Arrays.asList( createTile( "a", 0 ), createTile( "a", 1 ) ), new MosaicParameters() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testExclusiveModes()
	{
		new MosaicJob( Arrays.asList( createTile( "a", 0 ) ), new MosaicParameters(), true, true );
	}
}
