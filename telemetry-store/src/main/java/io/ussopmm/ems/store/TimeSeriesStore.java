package io.ussopmm.ems.store;

import java.nio.ByteBuffer;
import java.time.Instant;

/**
 * Access contract of the partitioned reading store.
 * <p>
 * Windows are inclusive on both ends. Pages are ordered by sort key ascending and are fetched
 * one at a time: pass {@code null} as cursor for the first page, then
 * {@link RecordPage#nextCursor()} until it is {@code null}. Records whose TTL has elapsed may
 * still be returned until the store purges them; callers treat them as absent.
 */
public interface TimeSeriesStore {

    /**
     * Writes the record under its partition and, unless it is an error record, under the device
     * index. Each call commits independently.
     *
     * @throws StoreUnavailableException when the store cannot be reached; the write may be retried
     */
    void put(StorageRecord record);

    RecordPage queryByPartition(String partitionKey, Instant from, Instant to, ByteBuffer cursor);

    /**
     * Device-scoped range read through the device index. Reflects last-write-wins of the primary
     * partition: an entry whose primary record now belongs to another device is not returned.
     */
    RecordPage queryByDevice(String deviceId, Instant from, Instant to, ByteBuffer cursor);
}
