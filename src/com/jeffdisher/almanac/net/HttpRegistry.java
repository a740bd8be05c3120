package com.jeffdisher.almanac.net;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;

import com.jeffdisher.almanac.logic.IRegistry;
import com.jeffdisher.almanac.logic.RegistryMapping;
import com.jeffdisher.almanac.types.FailedDeserializationException;
import com.jeffdisher.almanac.types.RegistryUnavailableException;


/**
 * Fetches the dataset registry (a static JSON document, typically served from GitHub pages) with the Jetty HTTP
 * client.  We use Jetty here, instead of HttpURLConnection, since the registry is normally HTTPS and served through a
 * CDN which may redirect, both of which Jetty handles with its default configuration.
 */
public class HttpRegistry implements IRegistry
{
	public static final long REQUEST_TIMEOUT_SECONDS = 30L;

	private final HttpClient _client;
	private final String _registryUrl;

	/**
	 * Creates the registry client but doesn't start it (call "start()").
	 * 
	 * @param registryUrl The full URL of the registry document.
	 */
	public HttpRegistry(String registryUrl)
	{
		_client = new HttpClient();
		_client.setFollowRedirects(true);
		_registryUrl = registryUrl;
	}

	/**
	 * Starts the HTTP client.
	 * 
	 * @throws Exception Something went wrong.
	 */
	public void start() throws Exception
	{
		_client.start();
	}

	/**
	 * Stops the HTTP client.
	 * 
	 * @throws Exception Something went wrong.
	 */
	public void stop() throws Exception
	{
		_client.stop();
	}

	@Override
	public RegistryMapping fetchMapping() throws RegistryUnavailableException
	{
		ContentResponse response;
		try
		{
			response = _client.newRequest(_registryUrl)
					.method(HttpMethod.GET)
					.param("decoder", "json")
					.timeout(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS)
					.send();
		}
		catch (InterruptedException e)
		{
			// Leave the interrupt visible to the caller:  the fetch is simply abandoned.
			Thread.currentThread().interrupt();
			throw new RegistryUnavailableException("Interrupted fetching registry: " + _registryUrl, e);
		}
		catch (TimeoutException e)
		{
			throw new RegistryUnavailableException("Timed out fetching registry: " + _registryUrl, e);
		}
		catch (ExecutionException e)
		{
			// This is how Jetty reports connection failures (refused, DNS, TLS, etc).
			throw new RegistryUnavailableException("Failed to fetch registry: " + _registryUrl, e);
		}
		
		int status = response.getStatus();
		if (!HttpStatus.isSuccess(status))
		{
			throw new RegistryUnavailableException("Registry returned HTTP " + status + ": " + _registryUrl);
		}
		try
		{
			return RegistryMapping.fromJson(response.getContentAsString().getBytes(StandardCharsets.UTF_8));
		}
		catch (FailedDeserializationException e)
		{
			throw new RegistryUnavailableException("Registry returned a malformed mapping: " + _registryUrl, e);
		}
	}

	@Override
	public String getLocationForReporting()
	{
		return _registryUrl;
	}
}
