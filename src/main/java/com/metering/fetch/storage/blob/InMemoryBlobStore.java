package com.metering.fetch.storage.blob;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local {@link BlobStore}. Keys are kept sorted so prefix listings page by key.
 */
public class InMemoryBlobStore implements BlobStore {

    private final ConcurrentSkipListMap<String, Entry> objects = new ConcurrentSkipListMap<>();
    private final Clock clock;

    public InMemoryBlobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<BlobObject> get(String key) {
        Entry entry = objects.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new BlobObject(key, Arrays.copyOf(entry.body, entry.body.length), entry.metadata));
    }

    @Override
    public Optional<BlobSummary> head(String key) {
        Entry entry = objects.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.summary(key));
    }

    @Override
    public void put(String key, byte[] body, BlobMetadata metadata) {
        objects.put(key, new Entry(Arrays.copyOf(body, body.length), metadata, clock.instant()));
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
    }

    @Override
    public BlobListing list(String prefix, String cursor, int limit) {
        NavigableMap<String, Entry> view = cursor == null
            ? objects.tailMap(prefix, true)
            : objects.tailMap(cursor, false);

        List<BlobSummary> page = new ArrayList<>();
        String last = null;
        for (Map.Entry<String, Entry> item : view.entrySet()) {
            if (!item.getKey().startsWith(prefix)) {
                break;
            }
            if (page.size() == limit) {
                return new BlobListing(page, last);
            }
            page.add(item.getValue().summary(item.getKey()));
            last = item.getKey();
        }
        return new BlobListing(page, null);
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    public int size() {
        return objects.size();
    }

    private record Entry(byte[] body, BlobMetadata metadata, Instant lastModified) {

        BlobSummary summary(String key) {
            return new BlobSummary(key, body.length, lastModified, metadata);
        }
    }
}
