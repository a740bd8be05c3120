package com.jeffdisher.almanac.logic;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.almanac.types.FailedDeserializationException;
import com.jeffdisher.almanac.types.IpfsKey;


/**
 * An immutable dataset key to pointer mapping.  This is both the shape of the registry response and the shape of the
 * local cache file:  a flat JSON object of string to string.
 * Values are kept exactly as the registry spelled them.  A value which isn't a usable pointer only makes that one
 * entry unresolvable (see lookup()), since one bad entry must not invalidate an otherwise authoritative registry.
 * Equality is by content (ignoring key order), which is how we decide whether the cache needs to be rewritten.
 */
public class RegistryMapping
{
	public static final RegistryMapping EMPTY = new RegistryMapping(new LinkedHashMap<String, String>());

	/**
	 * Parses a mapping from its JSON encoding.
	 * 
	 * @param raw The UTF-8 JSON bytes.
	 * @return The mapping (never null).
	 * @throws FailedDeserializationException The data wasn't a JSON object or had a non-string value.
	 */
	public static RegistryMapping fromJson(byte[] raw) throws FailedDeserializationException
	{
		JsonValue root;
		try
		{
			root = Json.parse(new String(raw, StandardCharsets.UTF_8));
		}
		catch (ParseException e)
		{
			throw new FailedDeserializationException(RegistryMapping.class, e);
		}
		if (!root.isObject())
		{
			throw new FailedDeserializationException(RegistryMapping.class, "top-level value is not an object");
		}
		LinkedHashMap<String, String> entries = new LinkedHashMap<>();
		for (JsonObject.Member member : root.asObject())
		{
			JsonValue value = member.getValue();
			if (!value.isString())
			{
				throw new FailedDeserializationException(RegistryMapping.class, "value for \"" + member.getName() + "\" is not a string");
			}
			entries.put(member.getName(), value.asString());
		}
		return new RegistryMapping(entries);
	}


	private final Map<String, String> _entries;

	public RegistryMapping(Map<String, IpfsKey> entries)
	{
		this(_encode(entries));
	}

	private RegistryMapping(LinkedHashMap<String, String> rawEntries)
	{
		_entries = Collections.unmodifiableMap(rawEntries);
	}

	/**
	 * @param datasetKey The dataset name.
	 * @return The pointer for that dataset, null if it isn't in the mapping or its value isn't a usable pointer.
	 */
	public IpfsKey lookup(String datasetKey)
	{
		String raw = _entries.get(datasetKey);
		return (null != raw)
				? IpfsKey.fromPublicKey(raw)
				: null
		;
	}

	/**
	 * @param datasetKey The dataset name.
	 * @return The value exactly as the registry listed it, null if the key isn't in the mapping.
	 */
	public String getRawValue(String datasetKey)
	{
		return _entries.get(datasetKey);
	}

	/**
	 * @return The dataset keys, in the order the source listed them.
	 */
	public Set<String> keys()
	{
		return _entries.keySet();
	}

	/**
	 * @return The UTF-8 JSON encoding of the mapping.
	 */
	public byte[] toJson()
	{
		JsonObject object = new JsonObject();
		for (Map.Entry<String, String> entry : _entries.entrySet())
		{
			object.add(entry.getKey(), entry.getValue());
		}
		return object.toString().getBytes(StandardCharsets.UTF_8);
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (obj instanceof RegistryMapping)
		{
			isEqual = _entries.equals(((RegistryMapping)obj)._entries);
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return _entries.hashCode();
	}

	@Override
	public String toString()
	{
		return "RegistryMapping(" + _entries.size() + " datasets)";
	}


	private static LinkedHashMap<String, String> _encode(Map<String, IpfsKey> entries)
	{
		LinkedHashMap<String, String> raw = new LinkedHashMap<>();
		for (Map.Entry<String, IpfsKey> entry : entries.entrySet())
		{
			raw.put(entry.getKey(), entry.getValue().toPublicKey());
		}
		return raw;
	}
}
