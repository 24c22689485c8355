package eu.virtualparadox.retrieval.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // prevent instantiation
    }

    /**
     * Session options for query embedding: fully optimized graph, sequential execution and a
     * bounded intra-op pool.
     *
     * @param intraThreads intra-op threads, at least 1 is used
     * @throws IllegalStateException if ONNX Runtime rejects the options
     */
    public static OrtSession.SessionOptions initializeOrt(final int intraThreads) {
        final int threads = Math.max(1, intraThreads);
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            opts.setExecutionMode(OrtSession.SessionOptions.ExecutionMode.SEQUENTIAL);
            opts.setIntraOpNumThreads(threads);
            opts.setInterOpNumThreads(1);

            log.info("ONNX session options: {} intra-op thread(s), sequential execution", threads);
            return opts;
        } catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
