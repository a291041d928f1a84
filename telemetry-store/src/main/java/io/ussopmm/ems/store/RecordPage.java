package io.ussopmm.ems.store;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * One page of a range query.
 *
 * @param records    records of this page, ascending by sort key
 * @param nextCursor opaque position of the next page, {@code null} when the range is exhausted
 */
public record RecordPage(List<StorageRecord> records, ByteBuffer nextCursor) {

    public static RecordPage empty() {
        return new RecordPage(List.of(), null);
    }

    public boolean hasNext() {
        return nextCursor != null;
    }
}
