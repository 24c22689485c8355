package eu.virtualparadox.retrieval.application.config;

import eu.virtualparadox.retrieval.application.executor.RetrievalExecutor;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "retrieval.executor")
@Getter @Setter
public class ExecutorConfig {

    private int poolSize = 4;

    @Bean
    public RetrievalExecutor retrievalExecutor() {
        RetrievalExecutor executor = new RetrievalExecutor();
        // a query occupies up to two workers plus one segmenter call
        executor.setCorePoolSize(Math.max(2, poolSize));
        executor.setMaxPoolSize(Math.max(2, poolSize));
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("retrieval-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
