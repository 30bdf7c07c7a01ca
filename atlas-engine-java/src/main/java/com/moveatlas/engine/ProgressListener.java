package com.moveatlas.engine;

/**
 * Receives analysis progress as a percentage in [0, 100].
 *
 * Throwing {@link AnalysisCancelledException} from {@link #onProgress(int)} aborts the
 * analysis; it is never caught by the engine's per-type, per-object or per-branch recovery.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = percent -> {};

    void onProgress(int percent);

    class AnalysisCancelledException extends RuntimeException {
        public AnalysisCancelledException(String msg) { super(msg); }
        public AnalysisCancelledException(String msg, Throwable cause) { super(msg, cause); }
    }
}
