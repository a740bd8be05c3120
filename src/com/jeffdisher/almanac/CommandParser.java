package com.jeffdisher.almanac;

import java.io.File;
import java.io.PrintStream;
import java.time.Instant;

import com.jeffdisher.almanac.codec.EncryptionCodec;
import com.jeffdisher.almanac.commands.DecryptChunkCommand;
import com.jeffdisher.almanac.commands.EncryptChunkCommand;
import com.jeffdisher.almanac.commands.ICommand;
import com.jeffdisher.almanac.commands.ListDatasetsCommand;
import com.jeffdisher.almanac.commands.ResolveDatasetCommand;
import com.jeffdisher.almanac.commands.ShowMetadataCommand;
import com.jeffdisher.almanac.types.UsageException;
import com.jeffdisher.almanac.utils.Assert;


public class CommandParser
{
	private static record PreParse(ParameterType type, String pre) {
		<T> T parse(Class<T> clazz) throws UsageException
		{
			return this.type.parse(clazz, this.pre);
		}
	};
	@java.lang.FunctionalInterface
	private static interface IParseFunction
	{
		public ICommand<?> apply(PreParse[] required, PreParse[] optional) throws UsageException;
	}
	private static enum ArgPattern
	{
		LIST_DATASETS("--listDatasets"
				, new ArgParameter[0]
				, new ArgParameter[0]
				, "Lists the keys of all datasets known to the registry (or the local cache, if the registry is unreachable)."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new ListDatasetsCommand();
		}),
		RESOLVE_DATASET("--resolveDataset"
				, new ArgParameter[] { new ArgParameter("--key", ParameterType.STRING, "The dataset key") }
				, new ArgParameter[] { new ArgParameter("--asOf", ParameterType.TIMESTAMP
						, "Find the snapshot which was current at this time, instead of the latest"
				) }
				, "Finds the snapshot of a dataset, optionally as of a point in time."
				, (PreParse[] required, PreParse[] optional) ->
		{
			String key = required[0].parse(String.class);
			Instant asOf = (null != optional[0])
					? optional[0].parse(Instant.class)
					: null
			;
			return new ResolveDatasetCommand(key, asOf);
		}),
		SHOW_METADATA("--showMetadata"
				, new ArgParameter[] { new ArgParameter("--key", ParameterType.STRING, "The dataset key") }
				, new ArgParameter[0]
				, "Prints the full metadata document of the latest snapshot of a dataset."
				, (PreParse[] required, PreParse[] optional) ->
		{
			String key = required[0].parse(String.class);
			return new ShowMetadataCommand(key);
		}),
		ENCRYPT_CHUNK("--encryptChunk"
				, new ArgParameter[] { new ArgParameter("--input", ParameterType.FILE, "The chunk to encrypt")
					, new ArgParameter("--output", ParameterType.OUTPUT_FILE, "Where to write the encrypted frame")
				}
				, new ArgParameter[] { new ArgParameter("--header", ParameterType.STRING
						, "The associated data header (default \"" + EncryptionCodec.DEFAULT_HEADER + "\")"
				) }
				, "Encrypts a chunk file with the key from " + EnvVars.ENV_VAR_ALMANAC_ENCRYPTION_KEY + "."
				, (PreParse[] required, PreParse[] optional) ->
		{
			File input = required[0].parse(File.class);
			File output = required[1].parse(File.class);
			String header = _optionalString(optional[0], EncryptionCodec.DEFAULT_HEADER);
			return new EncryptChunkCommand(input, output, header);
		}),
		DECRYPT_CHUNK("--decryptChunk"
				, new ArgParameter[] { new ArgParameter("--input", ParameterType.FILE, "The encrypted frame")
					, new ArgParameter("--output", ParameterType.OUTPUT_FILE, "Where to write the decrypted chunk")
				}
				, new ArgParameter[] { new ArgParameter("--header", ParameterType.STRING
						, "The associated data header (default \"" + EncryptionCodec.DEFAULT_HEADER + "\")"
				) }
				, "Decrypts and verifies a chunk file with the key from " + EnvVars.ENV_VAR_ALMANAC_ENCRYPTION_KEY + "."
				, (PreParse[] required, PreParse[] optional) ->
		{
			File input = required[0].parse(File.class);
			File output = required[1].parse(File.class);
			String header = _optionalString(optional[0], EncryptionCodec.DEFAULT_HEADER);
			return new DecryptChunkCommand(input, output, header);
		}),
		;

		private final String _name;
		private final ArgParameter[] _params;
		private final ArgParameter[] _optionalParams;
		private final String _description;
		private final IParseFunction _factory;

		private ArgPattern(String name, ArgParameter[] params, ArgParameter[] optionalParams, String description, IParseFunction factory)
		{
			_name = name;
			_params = params;
			_optionalParams = optionalParams;
			_description = description;
			_factory = factory;
		}

		private boolean isValid(String arg)
		{
			return arg.equals(_name);
		}

		// Returns null if the arguments didn't match this pattern.
		private ICommand<?> parse(String[] args) throws UsageException
		{
			Assert.assertTrue(args[0].equals(_name));
			// After the command name, everything must be "--name value" pairs.
			if (0 == (args.length % 2))
			{
				return null;
			}

			PreParse[] required = new PreParse[_params.length];
			PreParse[] optional = new PreParse[_optionalParams.length];
			for (int scanIndex = 1; scanIndex < args.length; scanIndex += 2)
			{
				String next = args[scanIndex];
				String value = args[scanIndex + 1];
				boolean matched = _match(_params, required, next, value) || _match(_optionalParams, optional, next, value);
				if (!matched)
				{
					return null;
				}
			}
			for (PreParse check : required)
			{
				if (null == check)
				{
					return null;
				}
			}
			return _factory.apply(required, optional);
		}

		private void printUsage(PrintStream stream)
		{
			stream.print(_name + " ");
			for(ArgParameter param : _params)
			{
				stream.print(param.shortDescription() + " ");
			}
			for(ArgParameter param : _optionalParams)
			{
				stream.print("[" + param.shortDescription() + "] ");
			}
		}

		private static boolean _match(ArgParameter[] params, PreParse[] out, String name, String value)
		{
			boolean matched = false;
			for (int i = 0; !matched && (i < params.length); ++i)
			{
				if (name.equals(params[i].name))
				{
					out[i] = new PreParse(params[i].type, value);
					matched = true;
				}
			}
			return matched;
		}
	}

	/**
	 * Parses the command line into a command.
	 *
	 * @param args The command-line arguments (must not be empty).
	 * @param errorStream Where to describe parse failures.
	 * @return The command, or null if the arguments didn't describe a valid command.
	 * @throws UsageException A parameter value couldn't be interpreted.
	 */
	public static ICommand<?> parseArgs(String[] args, PrintStream errorStream) throws UsageException
	{
		// We assume that we only get this far is we have args.
		Assert.assertTrue(args.length > 0);

		ICommand<?> matched = null;
		for (ArgPattern pattern : ArgPattern.values())
		{
			if (pattern.isValid(args[0]))
			{
				matched = pattern.parse(args);
				if (null == matched)
				{
					// This is a valid pattern, but didn't parse, meaning sub-args were missing or unknown.
					errorStream.println("Missing or unknown command sub-arguments.");
				}
				break;
			}
		}
		return matched;
	}

	public static void printUsage(PrintStream stream)
	{
		stream.println("Commands:");
		for (ArgPattern pattern : ArgPattern.values())
		{
			stream.print("\t");
			pattern.printUsage(stream);
			stream.println();
		}
	}

	public static void printHelp(PrintStream stream)
	{
		for (ArgPattern pattern : ArgPattern.values())
		{
			stream.println();
			stream.println(pattern._name);
			stream.println("\tDescription: " + pattern._description);
			stream.println("\tRequired parameters:");
			_describeParameterList(stream, "\t\t", pattern._params);
			stream.println("\tOptional parameters:");
			_describeParameterList(stream, "\t\t", pattern._optionalParams);
		}
	}


	private static String _optionalString(PreParse param, String defaultValue) throws UsageException
	{
		return (null != param)
				? param.parse(String.class)
				: defaultValue
		;
	}

	private static void _describeParameterList(PrintStream stream, String prefix, ArgParameter[] list)
	{
		if (0 == list.length)
		{
			stream.println(prefix + "(none)");
		}
		else
		{
			for (int i = 0; i < list.length; ++i)
			{
				stream.println(prefix + list[i].longDescription());
			}
		}
	}
}
