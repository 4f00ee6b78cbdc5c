package com.metering.fetch.storage.blob;

import java.util.List;

/**
 * One page of a prefix listing. {@code nextCursor} is {@code null} on the last page.
 */
public record BlobListing(List<BlobSummary> objects, String nextCursor) {

    public BlobListing {
        objects = objects == null ? List.of() : List.copyOf(objects);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
