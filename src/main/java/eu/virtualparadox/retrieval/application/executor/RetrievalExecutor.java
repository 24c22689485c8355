package eu.virtualparadox.retrieval.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for the per-query fan-out: lexical scoring, embedding + semantic scoring
 * and time-bounded segmenter calls.
 */
public class RetrievalExecutor extends ThreadPoolTaskExecutor {
}
