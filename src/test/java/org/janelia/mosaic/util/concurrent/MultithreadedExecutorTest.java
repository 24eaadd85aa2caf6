package org.janelia.mosaic.util.concurrent;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class MultithreadedExecutorTest
{
	private Random rnd;
	private int numThreads;
	private MultithreadedExecutor multithreadedExecutor;

	@Before
	public void setUp()
	{
		rnd = new Random();
		numThreads = rnd.nextInt( Runtime.getRuntime().availableProcessors() * 2 ) + 1;
		multithreadedExecutor = new MultithreadedExecutor( Executors.newFixedThreadPool( numThreads ), numThreads );
	}

	@Test
	public void testRun() throws Exception
	{
		for ( int t = 0; t < 10; t++ )
		{
			final int totalSteps = rnd.nextInt( 100000 ) + 1;
			final int[] arr = new int[ totalSteps ];

			multithreadedExecutor.run( i -> arr[ i ]++, totalSteps );

			for ( int i = 0; i < totalSteps; i++ )
				Assert.assertEquals( 1, arr[ i ] );
		}
	}

	@Test
	public void testMapKeepsIndexOrder() throws Exception
	{
		for ( int t = 0; t < 10; t++ )
		{
			final int totalSteps = rnd.nextInt( 1000 );
			final List< Integer > squares = multithreadedExecutor.map( i -> i * i, totalSteps );
			Assert.assertEquals( totalSteps, squares.size() );
			for ( int i = 0; i < totalSteps; i++ )
				Assert.assertEquals( i * i, squares.get( i ).intValue() );
		}
	}

	@Test( expected = ExecutionException.class )
	public void testFailurePropagates() throws Exception
	{
		final MultithreadedExecutor executor = new MultithreadedExecutor( 2 );
		try
		{
			executor.run( i -> { if ( i == 3 ) throw new IllegalStateException( "failed at " + i ); }, 10 );
		}
		finally
		{
			executor.close();
		}
	}

	@Test
	public void testSameThreadExecutorService() throws Exception
	{
		final SameThreadExecutorService service = new SameThreadExecutorService();
		final Thread caller = Thread.currentThread();
		Assert.assertSame( caller, service.submit( Thread::currentThread ).get() );
		service.shutdown();
		Assert.assertTrue( service.isShutdown() );
	}

	@After
	public void tearDown() throws Exception
	{
		multithreadedExecutor.close();
	}
}
