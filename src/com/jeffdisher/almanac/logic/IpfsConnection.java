package com.jeffdisher.almanac.logic;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.almanac.types.IpfsConnectionException;
import com.jeffdisher.almanac.types.IpfsFile;
import com.jeffdisher.almanac.types.IpfsKey;
import com.jeffdisher.almanac.utils.Assert;


/**
 * An implementation of the connection used when contacting a real IPFS (Kubo) RPC API server.
 * All RPC calls are POSTs against the "/api/v0" base and are stateless, so concurrent use is safe.
 */
public class IpfsConnection implements IConnection
{
	// Same as the defaults of the common IPFS client libraries.
	public static final int CONNECT_TIMEOUT_MILLIS = 10_000;
	public static final int READ_TIMEOUT_MILLIS = 60_000;

	private final String _apiBase;

	/**
	 * Creates the IPFS connection abstraction.
	 * 
	 * @param apiBase The RPC base URL, including the "/api/v0" suffix (for example, "http://127.0.0.1:5001/api/v0").
	 */
	public IpfsConnection(String apiBase)
	{
		Assert.assertTrue(null != apiBase);
		_apiBase = apiBase.endsWith("/")
				? apiBase.substring(0, apiBase.length() - 1)
				: apiBase
		;
	}

	@Override
	public byte[] loadSnapshotDocument(IpfsFile cid) throws IpfsConnectionException
	{
		Assert.assertTrue(null != cid);
		try
		{
			return _post("/dag/get?arg=" + _encode(cid.toSafeString()));
		}
		catch (IOException e)
		{
			throw new IpfsConnectionException("dag/get", cid, e);
		}
	}

	@Override
	public IpfsFile resolvePointer(IpfsKey pointer) throws IpfsConnectionException
	{
		Assert.assertTrue(null != pointer);
		// We resolve offline so that we only see what the local node has, which avoids waiting on a DHT walk for
		// pointers the node is already following.
		String publishedPath;
		try
		{
			byte[] rawData = _post("/name/resolve?arg=" + _encode(pointer.toPublicKey()) + "&offline=true");
			// Parse the data as JSON and get the "Path" key to extract the IPFS path.
			JsonValue object = Json.parse(new String(rawData, StandardCharsets.UTF_8));
			publishedPath = object.isObject()
					? object.asObject().getString("Path", null)
					: null
			;
		}
		catch (ParseException | IOException e)
		{
			throw new IpfsConnectionException("name/resolve", pointer, e);
		}
		if (null == publishedPath)
		{
			throw new IpfsConnectionException("name/resolve", pointer, new IOException("Response missing \"Path\""));
		}
		// The path is of the form "/ipfs/<cid>" so we just want the last component.
		String published = publishedPath.substring(publishedPath.lastIndexOf("/") + 1);
		IpfsFile file = IpfsFile.fromIpfsCid(published);
		if (null == file)
		{
			throw new IpfsConnectionException("name/resolve", pointer, new IOException("Resolved to a non-CID path: " + publishedPath));
		}
		return file;
	}


	private byte[] _post(String pathAndQuery) throws IOException
	{
		String fullUrl = _apiBase + pathAndQuery;
		HttpURLConnection connection;
		try
		{
			connection = (HttpURLConnection) new URL(fullUrl).openConnection();
		}
		catch (MalformedURLException e)
		{
			// The base was validated when parsing the environment so this would be a static error.
			throw Assert.unexpected(e);
		}
		try
		{
			connection.setRequestMethod("POST");
			connection.setConnectTimeout(CONNECT_TIMEOUT_MILLIS);
			connection.setReadTimeout(READ_TIMEOUT_MILLIS);
			connection.setDoOutput(true);
			connection.getOutputStream().close();
			int status = connection.getResponseCode();
			if (HttpURLConnection.HTTP_OK != status)
			{
				throw new IOException("IPFS RPC returned HTTP " + status + " for " + fullUrl);
			}
			try (InputStream input = connection.getInputStream())
			{
				return input.readAllBytes();
			}
		}
		finally
		{
			connection.disconnect();
		}
	}

	private static String _encode(String arg)
	{
		return URLEncoder.encode(arg, StandardCharsets.UTF_8);
	}
}
