package com.jeffdisher.almanac.logic;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Set;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.almanac.types.FailedDeserializationException;
import com.jeffdisher.almanac.types.IpfsFile;
import com.jeffdisher.almanac.types.VersionSnapshot;


/**
 * Helpers for interpreting the STAC metadata documents which make up a dataset's version chain.
 * The parts we care about look like this (DAG-JSON, so CID links are objects with a "/" key):
 * <pre>
 * {
 *   "properties": {"updated": "2022-07-26T19:17:55Z", ...},
 *   "links": [{"rel": "previous", "metadata href": {"/": "bafy..."}}, ...],
 *   "assets": {"analytic": {"href": {"/": "bafy..."}}, ...}
 * }
 * </pre>
 */
public class SnapshotDocument
{
	/**
	 * The "rel" values which name the link to the next-older snapshot.  "prev" was used by older publishers.
	 */
	public static final Set<String> PREVIOUS_RELATIONS = Set.of("previous", "prev");
	public static final DateTimeFormatter UPDATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

	private static final String LINK_HREF = "metadata href";
	private static final String CID_LINK_KEY = "/";

	/**
	 * Parses a snapshot document.
	 *
	 * @param contentId The CID the document was loaded from.
	 * @param raw The raw JSON bytes.
	 * @return The parsed snapshot.
	 * @throws FailedDeserializationException The document is missing its timestamp or has malformed links.
	 */
	public static VersionSnapshot parse(IpfsFile contentId, byte[] raw) throws FailedDeserializationException
	{
		JsonValue root;
		try
		{
			root = Json.parse(new String(raw, StandardCharsets.UTF_8));
		}
		catch (ParseException e)
		{
			throw new FailedDeserializationException(VersionSnapshot.class, e);
		}
		if (!root.isObject())
		{
			throw new FailedDeserializationException(VersionSnapshot.class, contentId + " is not a JSON object");
		}
		JsonObject document = root.asObject();
		Instant createdAt = _readUpdated(contentId, document);
		IpfsFile previous = _readPrevious(contentId, document);
		IpfsFile payload = _readPayload(contentId, document);
		return new VersionSnapshot(contentId, createdAt, previous, payload, document);
	}

	/**
	 * Parses a timestamp in the format used by the "updated" property.
	 *
	 * @param text The timestamp text (UTC, second precision, "Z" suffix).
	 * @return The instant, or null if the text isn't in the expected format.
	 */
	public static Instant parseTimestamp(String text)
	{
		try
		{
			return LocalDateTime.parse(text, UPDATED_FORMAT).toInstant(ZoneOffset.UTC);
		}
		catch (DateTimeParseException e)
		{
			return null;
		}
	}


	private static Instant _readUpdated(IpfsFile contentId, JsonObject document) throws FailedDeserializationException
	{
		JsonValue properties = document.get("properties");
		JsonValue updated = ((null != properties) && properties.isObject())
				? properties.asObject().get("updated")
				: null
		;
		if ((null == updated) || !updated.isString())
		{
			throw new FailedDeserializationException(VersionSnapshot.class, contentId + " has no \"properties.updated\"");
		}
		Instant createdAt = parseTimestamp(updated.asString());
		if (null == createdAt)
		{
			throw new FailedDeserializationException(VersionSnapshot.class, contentId + " has invalid timestamp \"" + updated.asString() + "\"");
		}
		return createdAt;
	}

	private static IpfsFile _readPrevious(IpfsFile contentId, JsonObject document) throws FailedDeserializationException
	{
		JsonValue links = document.get("links");
		IpfsFile previous = null;
		if (null != links)
		{
			if (!links.isArray())
			{
				throw new FailedDeserializationException(VersionSnapshot.class, contentId + " has non-array \"links\"");
			}
			for (JsonValue link : links.asArray())
			{
				if (link.isObject())
				{
					JsonObject object = link.asObject();
					String rel = object.getString("rel", null);
					// (Set.of() collections reject null lookups)
					if ((null != rel) && PREVIOUS_RELATIONS.contains(rel))
					{
						previous = _readCidLink(contentId, object.get(LINK_HREF), "previous link");
						// We only expect one of these so just take the first.
						break;
					}
				}
			}
		}
		return previous;
	}

	private static IpfsFile _readPayload(IpfsFile contentId, JsonObject document) throws FailedDeserializationException
	{
		JsonValue assets = document.get("assets");
		JsonValue analytic = ((null != assets) && assets.isObject())
				? assets.asObject().get("analytic")
				: null
		;
		return ((null != analytic) && analytic.isObject())
				? _readCidLink(contentId, analytic.asObject().get("href"), "analytic asset")
				: null
		;
	}

	private static IpfsFile _readCidLink(IpfsFile contentId, JsonValue link, String description) throws FailedDeserializationException
	{
		JsonValue cid = ((null != link) && link.isObject())
				? link.asObject().get(CID_LINK_KEY)
				: null
		;
		IpfsFile file = ((null != cid) && cid.isString())
				? IpfsFile.fromIpfsCid(cid.asString())
				: null
		;
		if (null == file)
		{
			throw new FailedDeserializationException(VersionSnapshot.class, contentId + " has malformed " + description);
		}
		return file;
	}
}
