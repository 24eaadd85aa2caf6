package org.janelia.mosaic;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.manual.ManualAdjustment;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Provides convenience methods for loading and storing the JSON files of a mosaic run:
 * the tile configuration, the parameters, the manual adjustments and the transform and metrics records.
 * <p>
 * Parameter keys use snake_case, all other files use the field names as they are.
 */
public class TileConfigurationJSONProvider
{
	public static TileRecord[] loadTilesConfiguration( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			return createGson().fromJson( closeableReader, TileRecord[].class );
		}
	}

	public static void saveTilesConfiguration( final TileRecord[] tiles, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( tiles ) );
		}
	}

	/**
	 * Keys that are missing in the file keep their default values.
	 */
	public static MosaicParameters loadParameters( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final MosaicParameters params = createParametersGson().fromJson( closeableReader, MosaicParameters.class );
			return params != null ? params : new MosaicParameters();
		}
	}

	public static void saveParameters( final MosaicParameters params, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createParametersGson().toJson( params ) );
		}
	}

	public static List< ManualAdjustment > loadManualAdjustments( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final ManualAdjustment[] adjustments = createGson().fromJson( closeableReader, ManualAdjustment[].class );
			return adjustments != null ? new ArrayList<>( Arrays.asList( adjustments ) ) : new ArrayList<>();
		}
	}

	public static TransformRecord loadTransformRecord( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			return createGson().fromJson( closeableReader, TransformRecord.class );
		}
	}

	public static void saveTransformRecord( final TransformRecord record, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( record ) );
		}
	}

	public static MetricsRecord loadMetricsRecord( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			return createGson().fromJson( closeableReader, MetricsRecord.class );
		}
	}

	public static void saveMetricsRecord( final MetricsRecord record, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( record ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder()
				.serializeNulls()
				.setPrettyPrinting()
				.create();
	}

	private static Gson createParametersGson()
	{
		return new GsonBuilder()
				.setFieldNamingPolicy( FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES )
				.setPrettyPrinting()
				.create();
	}
}
