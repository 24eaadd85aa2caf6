package org.janelia.mosaic.alignment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.janelia.mosaic.OverlapRegion;

/**
 * FIFO queue of overlap regions awaiting correlation.
 * Every entry remembers the placement versions of both tiles at the time it was enqueued,
 * entries that no longer match the registry are discarded when they are dequeued.
 */
public class RegionWorkQueue
{
	public static class Entry
	{
		private final OverlapRegion region;
		private final long versionA, versionB;

		Entry( final OverlapRegion region, final long versionA, final long versionB )
		{
			this.region = region;
			this.versionA = versionA;
			this.versionB = versionB;
		}

		public OverlapRegion getRegion() { return region; }
		public long getVersionA() { return versionA; }
		public long getVersionB() { return versionB; }

		public boolean isStale( final PlacementRegistry registry )
		{
			return registry.getVersion( region.getIndexA() ) != versionA || registry.getVersion( region.getIndexB() ) != versionB;
		}
	}

	private final Deque< Entry > entries = new ArrayDeque<>();
	private int staleCount;

	public void enqueue( final OverlapRegion region, final PlacementRegistry registry )
	{
		entries.addLast( new Entry( region, registry.getVersion( region.getIndexA() ), registry.getVersion( region.getIndexB() ) ) );
	}

	public boolean isEmpty()
	{
		return entries.isEmpty();
	}

	public int size()
	{
		return entries.size();
	}

	/**
	 * @return number of stale entries discarded so far
	 */
	public int getStaleCount()
	{
		return staleCount;
	}

	/**
	 * @return the next up-to-date entry, or {@code null} if the queue is exhausted
	 */
	public Entry poll( final PlacementRegistry registry )
	{
		while ( !entries.isEmpty() )
		{
			final Entry entry = entries.pollFirst();
			if ( !entry.isStale( registry ) )
				return entry;
			++staleCount;
		}
		return null;
	}

	/**
	 * Removes the longest run of up-to-date entries from the head of the queue in which no two regions share a tile.
	 * Queue order is preserved: the run stops at the first entry that conflicts with an entry already taken.
	 */
	public List< Entry > pollBatch( final PlacementRegistry registry )
	{
		final List< Entry > batch = new ArrayList<>();
		final Set< Integer > batchTiles = new HashSet<>();
		while ( !entries.isEmpty() )
		{
			final Entry entry = entries.peekFirst();
			if ( entry.isStale( registry ) )
			{
				entries.pollFirst();
				++staleCount;
				continue;
			}

			final OverlapRegion region = entry.getRegion();
			if ( batchTiles.contains( region.getIndexA() ) || batchTiles.contains( region.getIndexB() ) )
				break;

			entries.pollFirst();
			batch.add( entry );
			batchTiles.add( region.getIndexA() );
			batchTiles.add( region.getIndexB() );
		}
		return batch;
	}
}
