package org.janelia.mosaic;

/**
 * Raised when the pipeline cannot continue, e.g. when the output canvas cannot be allocated.
 */
public class PipelineExecutionException extends Exception
{
	private static final long serialVersionUID = -6430952814927736122L;

	public PipelineExecutionException( final String message )
	{
		super( message );
	}

	public PipelineExecutionException( final String message, final Throwable cause )
	{
		super( message, cause );
	}

	public PipelineExecutionException( final Throwable cause )
	{
		super( cause );
	}
}
