package io.shieldedchain.core.params;

/** Receives progress for one download or verification, in whole percent. */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (label, percent) -> {};

    /** Called at most once per 10% step with a value in 1..99, then once with 100 on completion. */
    void onProgress(String label, int percent);
}
