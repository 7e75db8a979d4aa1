package me.golemcore.bridge.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bridge.domain.service.ResultAggregator;
import me.golemcore.bridge.domain.service.SchemaTranslator;
import me.golemcore.bridge.domain.service.ToolSession;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.ModelBackendPort;
import me.golemcore.bridge.port.outbound.ToolHostFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/** Spring wiring for the orchestration loop (domain services + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public SchemaTranslator schemaTranslator() {
        return new SchemaTranslator();
    }

    @Bean
    public ResultAggregator resultAggregator(ObjectMapper objectMapper) {
        return new ResultAggregator(objectMapper);
    }

    @Bean
    public ToolSession toolSession(ToolHostFactory toolHostFactory, SchemaTranslator schemaTranslator,
            BridgeProperties properties) {
        // One shared session: tool calls are multiplexed by the host adapters
        return new ToolSession(toolHostFactory, schemaTranslator,
                Duration.ofSeconds(properties.getToolHost().getToolCallTimeoutSeconds()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestrationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tool-loop-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public OrchestrationLoop orchestrationLoop(ModelBackendPort modelBackend, ToolSession toolSession,
            ResultAggregator resultAggregator, BridgeProperties properties,
            @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor) {
        BridgeProperties.ToolLoopProperties settings = properties.getToolLoop();
        return new DefaultOrchestrationLoop(modelBackend, toolSession, resultAggregator, settings.getMaxRounds(),
                Duration.ofSeconds(settings.getGenerateTimeoutSeconds()), orchestrationExecutor);
    }
}
