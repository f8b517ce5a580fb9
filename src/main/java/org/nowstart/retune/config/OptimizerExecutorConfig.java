package org.nowstart.retune.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.nowstart.retune.data.property.OptimizerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class OptimizerExecutorConfig {

    // one worker per horizon in flight
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(OptimizerProperties optimizerProperties) {
        return Executors.newFixedThreadPool(
                optimizerProperties.parallelism(),
                new CustomizableThreadFactory("retune-pipeline-")
        );
    }

    // unbounded: a timed-out evaluation keeps its thread until the upstream call returns
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService candidateEvaluationExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("retune-evaluation-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }
}
