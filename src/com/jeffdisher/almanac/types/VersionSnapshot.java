package com.jeffdisher.almanac.types;

import java.time.Instant;

import com.eclipsesource.json.JsonObject;


/**
 * One immutable metadata document in a dataset's version chain.
 * 
 * @param contentId The CID this snapshot was loaded from.
 * @param createdAt When the snapshot was generated (UTC, second precision).
 * @param previous The CID of the next-older snapshot, null if this is the root of the chain.
 * @param payloadRef The CID of the dataset payload this snapshot describes, null if the document doesn't name one.
 * @param document The raw document, for callers which want to show the full metadata.
 */
public record VersionSnapshot(IpfsFile contentId
		, Instant createdAt
		, IpfsFile previous
		, IpfsFile payloadRef
		, JsonObject document
)
{
}
