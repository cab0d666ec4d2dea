package com.planwright.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the {@link CheckpointStore} bean.
 * <p>
 * With {@code planwright.checkpoint.type=memory} checkpoints are held in
 * memory only, which suits tests but is not durable across restarts.
 * Otherwise a {@link FileCheckpointStore} writes under
 * {@code planwright.checkpoint.directory}.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "planwright.checkpoint", name = "type", havingValue = "memory")
    public CheckpointStore memoryCheckpointStore(Clock clock) {
        log.info("Using in-memory checkpoint store (state will not persist across restarts)");
        return new InMemoryCheckpointStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    public CheckpointStore fileCheckpointStore(CheckpointProperties properties, Clock clock) {
        Path directory = Path.of(properties.getDirectory()).toAbsolutePath().normalize();
        log.info("Using file checkpoint store at {}", directory);
        return new FileCheckpointStore(directory, clock);
    }
}
