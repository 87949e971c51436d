package dev.evalkit.eval;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A source of raw dataset records. Records are string-keyed maps of arbitrary values which a
 * {@link DatasetEvaluator} maps onto {@link MetricInput}s.
 */
public interface Dataset {
    Cursor openCursor();

    String id();

    @NotThreadSafe
    interface Cursor extends AutoCloseable {
        /**
         * Fetch the next record. Returns empty if there are no more records.
         *
         * <p>If this method is invoked after {@link #close()} an IllegalStateException will be
         * thrown
         */
        Optional<Map<String, Object>> next();

        /** close all cursor resources */
        @Override
        void close();
    }

    /** Create an in-memory Dataset containing the provided records. */
    @SafeVarargs
    static Dataset of(Map<String, Object>... records) {
        return new DatasetInMemoryImpl(List.of(records));
    }

    static Dataset of(List<Map<String, Object>> records) {
        return new DatasetInMemoryImpl(records);
    }
}
