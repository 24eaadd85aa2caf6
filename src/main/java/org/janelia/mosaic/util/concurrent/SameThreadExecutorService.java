package org.janelia.mosaic.util.concurrent;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs every task on the calling thread. Used for per-tile filtering that is already parallelized across tiles.
 */
public class SameThreadExecutorService extends AbstractExecutorService
{
	private volatile boolean shutdown;

	@Override
	public void shutdown()
	{
		shutdown = true;
	}

	@Override
	public List< Runnable > shutdownNow()
	{
		shutdown = true;
		return Collections.emptyList();
	}

	@Override
	public boolean isShutdown()
	{
		return shutdown;
	}

	@Override
	public boolean isTerminated()
	{
		return shutdown;
	}

	@Override
	public boolean awaitTermination( final long time, final TimeUnit unit )
	{
		return true;
	}

	@Override
	public void execute( final Runnable runnable )
	{
		if ( shutdown )
			throw new IllegalStateException( "executor is shut down" );
		runnable.run();
	}
}
