package org.janelia.mosaic.alignment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

import org.janelia.mosaic.Placement;
import org.janelia.mosaic.TileRecord;

/**
 * Holds the current placement of every tile, keyed by tile index.
 * <p>
 * Every change of a placement increments the version of the tile, which lets queued work detect that it was
 * computed for an outdated placement. Writers must hold the lock of the tile, see {@link #lock(Collection)}.
 */
public class PlacementRegistry
{
	private final Placement[] initialPlacements;
	private final Placement[] placements;
	private final long[] versions;
	private final boolean[] manualAdjustNeeded;
	private final ReentrantLock[] locks;

	public PlacementRegistry( final List< TileRecord > tiles )
	{
		int size = 0;
		for ( final TileRecord tile : tiles )
			size = Math.max( size, tile.getIndex() + 1 );

		initialPlacements = new Placement[ size ];
		placements = new Placement[ size ];
		versions = new long[ size ];
		manualAdjustNeeded = new boolean[ size ];
		locks = new ReentrantLock[ size ];
		for ( int i = 0; i < size; ++i )
			locks[ i ] = new ReentrantLock();

		for ( final TileRecord tile : tiles )
		{
			initialPlacements[ tile.getIndex() ] = tile.getInitialPlacement();
			placements[ tile.getIndex() ] = tile.getInitialPlacement();
			manualAdjustNeeded[ tile.getIndex() ] = tile.isManualAdjustNeeded();
		}
	}

	public int size()
	{
		return placements.length;
	}

	public synchronized Placement get( final int index )
	{
		return placements[ index ];
	}

	public Placement getInitial( final int index )
	{
		return initialPlacements[ index ];
	}

	public synchronized long getVersion( final int index )
	{
		return versions[ index ];
	}

	/**
	 * @return a copy of the current placements indexed by tile index
	 */
	public synchronized Placement[] getPlacements()
	{
		return placements.clone();
	}

	/**
	 * Replaces the placement of a tile and bumps its version. The caller must hold the lock of the tile.
	 */
	public synchronized void set( final int index, final Placement placement )
	{
		if ( !locks[ index ].isHeldByCurrentThread() )
			throw new IllegalStateException( "placement of tile " + index + " is updated without holding its lock" );
		placements[ index ] = placement;
		++versions[ index ];
	}

	public synchronized boolean isManualAdjustNeeded( final int index )
	{
		return manualAdjustNeeded[ index ];
	}

	public synchronized void setManualAdjustNeeded( final int index, final boolean flag )
	{
		manualAdjustNeeded[ index ] = flag;
	}

	public synchronized List< Integer > getManualAdjustNeeded()
	{
		final List< Integer > flagged = new ArrayList<>();
		for ( int i = 0; i < manualAdjustNeeded.length; ++i )
			if ( manualAdjustNeeded[ i ] )
				flagged.add( i );
		return flagged;
	}

	/**
	 * Acquires the locks of the given tiles in ascending index order.
	 * Locks are reentrant, so a thread that already holds a superset of them can lock again.
	 */
	public TileLocks lock( final Collection< Integer > indexes )
	{
		final List< ReentrantLock > acquired = new ArrayList<>();
		for ( final int index : new TreeSet<>( indexes ) )
		{
			locks[ index ].lock();
			acquired.add( locks[ index ] );
		}
		return new TileLocks( acquired );
	}

	public static class TileLocks implements AutoCloseable
	{
		private final List< ReentrantLock > acquired;

		private TileLocks( final List< ReentrantLock > acquired )
		{
			this.acquired = acquired;
		}

		@Override
		public void close()
		{
			for ( int i = acquired.size() - 1; i >= 0; --i )
				acquired.get( i ).unlock();
		}
	}
}
