package io.ussopmm.ems.query.engine;

import io.ussopmm.ems.store.RecordPage;
import io.ussopmm.ems.store.StorageRecord;
import io.ussopmm.ems.store.TimeSeriesStore;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed store with the same key and paging contract as the Cassandra one.
 */
class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private final Map<String, TreeMap<Instant, StorageRecord>> partitions = new ConcurrentHashMap<>();
    private final int pageSize;
    final AtomicInteger pageRequests = new AtomicInteger();

    InMemoryTimeSeriesStore(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public synchronized void put(StorageRecord record) {
        partitions.computeIfAbsent(record.getPartitionKey(), k -> new TreeMap<>()).put(record.getSortKey(), record);
    }

    @Override
    public synchronized RecordPage queryByPartition(String partitionKey, Instant from, Instant to, ByteBuffer cursor) {
        TreeMap<Instant, StorageRecord> partition = partitions.getOrDefault(partitionKey, new TreeMap<>());
        return page(new ArrayList<>(partition.subMap(from, true, to, true).values()), cursor);
    }

    @Override
    public synchronized RecordPage queryByDevice(String deviceId, Instant from, Instant to, ByteBuffer cursor) {
        List<StorageRecord> matching = new ArrayList<>();
        for (Map.Entry<String, TreeMap<Instant, StorageRecord>> partition : partitions.entrySet()) {
            for (StorageRecord record : partition.getValue().subMap(from, true, to, true).values()) {
                if (!record.isError() && Objects.equals(deviceId, record.getDeviceId())) {
                    matching.add(record);
                }
            }
        }
        matching.sort((a, b) -> a.getSortKey().compareTo(b.getSortKey()));
        return page(matching, cursor);
    }

    private RecordPage page(List<StorageRecord> all, ByteBuffer cursor) {
        pageRequests.incrementAndGet();
        int offset = cursor == null ? 0 : cursor.duplicate().getInt();
        int end = Math.min(all.size(), offset + pageSize);
        ByteBuffer next = end < all.size() ? (ByteBuffer) ByteBuffer.allocate(4).putInt(end).flip() : null;
        return new RecordPage(List.copyOf(all.subList(offset, end)), next);
    }
}
