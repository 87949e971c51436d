package dev.evalkit.eval;

/**
 * Receives a notification each time an item finishes evaluating.
 *
 * <p>Callbacks are never invoked concurrently with each other. In concurrent mode they are invoked
 * in completion order, which need not match input order.
 */
@FunctionalInterface
public interface ProgressCallback {
    /**
     * @param completed number of items finished so far, including this one
     * @param total number of items in the batch
     * @param result the result of the item which just finished
     */
    void onProgress(int completed, int total, EvaluationResult result);
}
