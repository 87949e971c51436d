package dev.evalkit.eval;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/** An immutable snapshot of records. Each cursor walks the snapshot from the start. */
class DatasetInMemoryImpl implements Dataset {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final List<Map<String, Object>> records;
    private final String id;

    DatasetInMemoryImpl(List<Map<String, Object>> records) {
        this.records = List.copyOf(records);
        this.id = "in-memory-dataset-" + NEXT_ID.incrementAndGet();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Cursor openCursor() {
        return new SnapshotCursor(records.iterator());
    }

    private static final class SnapshotCursor implements Cursor {
        private final Iterator<Map<String, Object>> remaining;
        private boolean closed;

        SnapshotCursor(Iterator<Map<String, Object>> remaining) {
            this.remaining = remaining;
        }

        @Override
        public Optional<Map<String, Object>> next() {
            if (closed) {
                throw new IllegalStateException("cursor is closed");
            }
            return remaining.hasNext() ? Optional.of(remaining.next()) : Optional.empty();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
