package com.jeffdisher.almanac;

import java.io.File;
import java.io.PrintStream;
import java.net.MalformedURLException;
import java.net.URL;

import com.jeffdisher.almanac.codec.KeyContext;
import com.jeffdisher.almanac.commands.Context;
import com.jeffdisher.almanac.commands.ICommand;
import com.jeffdisher.almanac.logic.DatasetClient;
import com.jeffdisher.almanac.logic.IpfsConnection;
import com.jeffdisher.almanac.logic.NameResolver;
import com.jeffdisher.almanac.logic.RealConfigFileSystem;
import com.jeffdisher.almanac.logic.StandardLogger;
import com.jeffdisher.almanac.logic.VersionChainWalker;
import com.jeffdisher.almanac.net.HttpRegistry;
import com.jeffdisher.almanac.types.AlmanacException;
import com.jeffdisher.almanac.types.InvalidKeyException;
import com.jeffdisher.almanac.types.UsageException;


public class Almanac {
	/**
	 * Exit code when there was a problem due to a static usage error.
	 */
	private static final int EXIT_STATIC_ERROR = 1;
	/**
	 * Exit code when there was a minor error which was ultimately mitigated.
	 */
	private static final int EXIT_SAFE_ERROR = 2;
	/**
	 * Exit code when there is a serious error which prevented the command from completing.
	 */
	private static final int EXIT_COMPLETE_ERROR = 3;

	/**
	 * The default IPFS RPC host, as printed by the daemon on start-up:  "RPC API server listening on
	 * /ip4/127.0.0.1/tcp/5001".
	 */
	private static final String DEFAULT_IPFS_HOST = "http://127.0.0.1:5001";
	private static final String IPFS_API_SUFFIX = "/api/v0";
	private static final String DEFAULT_REGISTRY_URL = "https://dclimate.github.io/dclimate-data-cids/cids.json";
	private static final String DEFAULT_STORAGE_DIRECTORY_NAME = ".almanac";

	/**
	 * The main entry-point for running the system.  Run without arguments to see the usage string.
	 *
	 * @param args The command-line arguments.
	 */
	public static void main(String[] args)
	{
		if (args.length > 0)
		{
			ICommand<?> command = null;
			try
			{
				command = CommandParser.parseArgs(args, System.err);
			}
			catch (UsageException e)
			{
				System.err.println("Usage error in parsing command: " + e.getLocalizedMessage());
				System.exit(EXIT_STATIC_ERROR);
			}
			if (null != command)
			{
				File storageDirectory = _storageDirectory();
				String ipfsApiBase = _ipfsApiBase();
				String registryUrl = System.getenv(EnvVars.ENV_VAR_ALMANAC_REGISTRY_URL);
				if (null == registryUrl)
				{
					registryUrl = DEFAULT_REGISTRY_URL;
				}

				// The key is optional:  only the chunk commands need it and they fail with a configuration error if missing.
				KeyContext keys = KeyContext.shared();
				String hexKey = System.getenv(EnvVars.ENV_VAR_ALMANAC_ENCRYPTION_KEY);
				if (null != hexKey)
				{
					try
					{
						keys.setKeyHex(hexKey);
					}
					catch (InvalidKeyException e)
					{
						System.err.println("Invalid " + EnvVars.ENV_VAR_ALMANAC_ENCRYPTION_KEY + ": " + e.getLocalizedMessage());
						System.exit(EXIT_STATIC_ERROR);
					}
				}

				boolean verbose = (null != System.getenv(EnvVars.ENV_VAR_ALMANAC_VERBOSE));
				StandardLogger logger = StandardLogger.topLogger(System.out, System.err, verbose);
				HttpRegistry registry = new HttpRegistry(registryUrl);
				boolean errorDidOccur = false;
				try
				{
					registry.start();
				}
				catch (Exception e)
				{
					System.err.println("Failed to start HTTP client: " + e.getLocalizedMessage());
					e.printStackTrace();
					System.exit(EXIT_COMPLETE_ERROR);
				}
				try
				{
					NameResolver names = new NameResolver(logger, registry, new RealConfigFileSystem(storageDirectory));
					IpfsConnection connection = new IpfsConnection(ipfsApiBase);
					VersionChainWalker walker = new VersionChainWalker(connection, logger, VersionChainWalker.DEFAULT_MAX_HOPS);
					Context context = new Context(new DatasetClient(names, connection, walker), keys, logger);

					ICommand.Result result = command.runInContext(context);
					result.writeHumanReadable(System.out);
					errorDidOccur = logger.didErrorOccur();
				}
				catch (AlmanacException e)
				{
					int exitCode = _describeFailure(System.err, e);
					_stopQuietly(registry);
					System.exit(exitCode);
				}
				_stopQuietly(registry);
				if (errorDidOccur)
				{
					// This is a "safe" error, meaning that the command completed successfully but some kind of clean-up (like refreshing the local cache) failed.
					System.exit(EXIT_SAFE_ERROR);
				}
			}
			else if ((1 == args.length) && "--help".equals(args[0]))
			{
				// We handle "--help" as a special-case where we provide more than basic usage data but don't want to do the normal start-up.
				_commonUsage(System.out);
				CommandParser.printHelp(System.out);
			}
			else
			{
				errorStart();
			}
		}
		else
		{
			errorStart();
		}
	}


	private static int _describeFailure(PrintStream stream, AlmanacException e)
	{
		int exitCode;
		switch (e.getKind())
		{
		case USAGE:
			stream.println("Usage error in running command: " + e.getLocalizedMessage());
			exitCode = EXIT_STATIC_ERROR;
			break;
		case CONFIGURATION:
			stream.println("Configuration error: " + e.getLocalizedMessage());
			exitCode = EXIT_STATIC_ERROR;
			break;
		case NOT_FOUND:
			stream.println("Not found: " + e.getLocalizedMessage());
			exitCode = EXIT_COMPLETE_ERROR;
			break;
		case INTEGRITY:
			stream.println("Integrity check failed (" + e.getLocalizedMessage() + ").  No output was written.");
			exitCode = EXIT_COMPLETE_ERROR;
			break;
		case UNAVAILABLE:
			stream.println("Unexpected exception while contacting the network (" + e.getLocalizedMessage() + ").  The command did not complete.");
			exitCode = EXIT_COMPLETE_ERROR;
			break;
		case PROTOCOL:
			stream.println("Found malformed data on the network (" + e.getLocalizedMessage() + ").  The command did not complete.");
			exitCode = EXIT_COMPLETE_ERROR;
			break;
		default:
			stream.println("Exception encountered while running command: " + e.getLocalizedMessage());
			e.printStackTrace();
			exitCode = EXIT_COMPLETE_ERROR;
		}
		return exitCode;
	}

	private static File _storageDirectory()
	{
		String override = System.getenv(EnvVars.ENV_VAR_ALMANAC_STORAGE);
		return (null != override)
				? new File(override)
				: new File(System.getProperty("user.home"), DEFAULT_STORAGE_DIRECTORY_NAME)
		;
	}

	private static String _ipfsApiBase()
	{
		String host = System.getenv(EnvVars.ENV_VAR_ALMANAC_IPFS_HOST);
		if (null == host)
		{
			host = DEFAULT_IPFS_HOST;
		}
		if (host.endsWith("/"))
		{
			host = host.substring(0, host.length() - 1);
		}
		String base = host + IPFS_API_SUFFIX;
		try
		{
			new URL(base);
		}
		catch (MalformedURLException e)
		{
			System.err.println("Invalid " + EnvVars.ENV_VAR_ALMANAC_IPFS_HOST + ": \"" + host + "\"");
			System.exit(EXIT_STATIC_ERROR);
		}
		return base;
	}

	private static void _stopQuietly(HttpRegistry registry)
	{
		try
		{
			registry.stop();
		}
		catch (Exception e)
		{
			// The command is already done so this only affects shutdown.
			System.err.println("Failed to stop HTTP client: " + e.getLocalizedMessage());
		}
	}

	private static void errorStart()
	{
		_commonUsage(System.err);
		CommandParser.printUsage(System.err);
		System.err.println("More detailed usage can be seen with --help");
		System.exit(EXIT_STATIC_ERROR);
	}

	private static void _commonUsage(PrintStream stream)
	{
		stream.println("Usage:  Almanac <command>");
		stream.println("\tStorage directory defaults to ~/" + DEFAULT_STORAGE_DIRECTORY_NAME + " unless overridden with " + EnvVars.ENV_VAR_ALMANAC_STORAGE + " env var");
		stream.println("\tIPFS RPC host defaults to " + DEFAULT_IPFS_HOST + " unless overridden with " + EnvVars.ENV_VAR_ALMANAC_IPFS_HOST + " env var");
	}
}
