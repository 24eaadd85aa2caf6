package org.janelia.mosaic;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.janelia.mosaic.fusion.ProtectLinesMask;

/**
 * Represents the input of a mosaic run: the tiles, the parameters, the optional protect lines mask
 * and the pipeline steps to execute.
 */
public class MosaicJob
{
	public enum PipelineStep
	{
		Normalization, // mandatory step
		Refinement,
		Blending
	}

	private final List< TileRecord > tiles;
	private final MosaicParameters params;
	private final EnumSet< PipelineStep > pipeline;
	private ProtectLinesMask protectLines;

	public MosaicJob( final List< TileRecord > tiles, final MosaicParameters params )
	{
		this( tiles, params, false, false );
	}

	public MosaicJob( final List< TileRecord > tiles, final MosaicParameters params, final boolean refineOnly, final boolean blendOnly )
	{
		if ( refineOnly && blendOnly )
			throw new IllegalArgumentException( "refine-only and blend-only cannot be combined" );

		this.tiles = new ArrayList<>( tiles );
		this.params = params;
		this.pipeline = setUpPipeline( refineOnly, blendOnly );
		checkTilesConfiguration();
	}

	private static EnumSet< PipelineStep > setUpPipeline( final boolean refineOnly, final boolean blendOnly )
	{
		final List< PipelineStep > pipelineStepsList = new ArrayList<>();
		pipelineStepsList.add( PipelineStep.Normalization );

		if ( !blendOnly )
			pipelineStepsList.add( PipelineStep.Refinement );

		if ( !refineOnly )
			pipelineStepsList.add( PipelineStep.Blending );

		return EnumSet.copyOf( pipelineStepsList );
	}

	public EnumSet< PipelineStep > getPipeline() { return pipeline; }
	public List< TileRecord > getTiles() { return tiles; }
	public MosaicParameters getParams() { return params; }

	public ProtectLinesMask getProtectLines() { return protectLines; }
	public void setProtectLines( final ProtectLinesMask protectLines ) { this.protectLines = protectLines; }

	/**
	 * Assigns indexes to tiles that have none and ids to tiles without an id, and checks that both are unique.
	 */
	private void checkTilesConfiguration()
	{
		final Set< Integer > usedIndexes = new HashSet<>();
		for ( final TileRecord tile : tiles )
			if ( tile.getIndex() != null && !usedIndexes.add( tile.getIndex() ) )
				throw new IllegalArgumentException( "duplicate tile index " + tile.getIndex() );

		int nextIndex = 0;
		final Set< String > usedIds = new HashSet<>();
		for ( final TileRecord tile : tiles )
		{
			if ( tile.getIndex() == null )
			{
				while ( usedIndexes.contains( nextIndex ) )
					++nextIndex;
				tile.setIndex( nextIndex );
				usedIndexes.add( nextIndex );
			}
			if ( tile.getIndex() < 0 )
				throw new IllegalArgumentException( "negative tile index " + tile.getIndex() );
			if ( tile.getId() == null )
				tile.setId( String.valueOf( tile.getIndex() ) );
			if ( !usedIds.add( tile.getId() ) )
				throw new IllegalArgumentException( "duplicate tile id " + tile.getId() );
		}
	}
}
