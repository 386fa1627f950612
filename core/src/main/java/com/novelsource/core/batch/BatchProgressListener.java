package com.novelsource.core.batch;

/**
 * Live progress of a batch. Called on the batch's worker thread.
 */
public interface BatchProgressListener {

    BatchProgressListener NONE = new BatchProgressListener() {
    };

    default void onItemStarted(BatchProgress progress) {
    }

    default void onItemFinished(ItemOutcome outcome, BatchProgress progress) {
    }
}
