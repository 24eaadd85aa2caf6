package org.janelia.mosaic.util.concurrent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;

/**
 * Fixed-size thread pool that processes index ranges, each thread taking every n-th index.
 * Results of {@link #map(IntFunction, int)} are returned in index order regardless of which thread computed them.
 */
public class MultithreadedExecutor implements AutoCloseable
{
	private final ExecutorService threadPool;
	private final int numThreads;

	public MultithreadedExecutor()
	{
		// reserve one thread for the OS
		this( Math.max( 1, Runtime.getRuntime().availableProcessors() - 1 ) );
	}

	public MultithreadedExecutor( final int numThreads )
	{
		this( numThreads == 1 ? new SameThreadExecutorService() : Executors.newFixedThreadPool( numThreads ), numThreads );
	}

	public MultithreadedExecutor( final ExecutorService threadPool, final int numThreads )
	{
		this.threadPool = threadPool;
		this.numThreads = numThreads;
	}

	@Override
	public void close()
	{
		threadPool.shutdown();
	}

	public int getNumThreads()
	{
		return numThreads;
	}

	public void run( final IntConsumer func, final int totalSize ) throws InterruptedException, ExecutionException
	{
		if ( totalSize == 0 )
			return;

		// no need to go through the pool for a single item
		if ( totalSize == 1 || numThreads == 1 )
		{
			for ( int i = 0; i < totalSize; ++i )
				func.accept( i );
			return;
		}

		final AtomicInteger ai = new AtomicInteger();
		final int threads = Math.min( numThreads, totalSize );
		final Future< ? >[] futures = new Future[ threads ];

		for ( int ithread = 0; ithread < threads; ++ithread )
			futures[ ithread ] = threadPool.submit( () ->
			{
				final int myNumber = ai.getAndIncrement();
				for ( int i = myNumber; i < totalSize; i += threads )
					func.accept( i );
			});

		for ( final Future< ? > future : futures )
			future.get();
	}

	public < T > List< T > map( final IntFunction< T > func, final int totalSize ) throws InterruptedException, ExecutionException
	{
		final Object[] results = new Object[ totalSize ];
		run( i -> results[ i ] = func.apply( i ), totalSize );

		@SuppressWarnings( "unchecked" )
		final List< T > list = new ArrayList<>( ( List< T > ) Arrays.asList( results ) );
		return list;
	}
}
