package net.javahippie.inflo.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables scheduled tasks. Set {@code inflo.scheduler.auto-complete.enabled=false} to turn the sweep off,
 * for example on instances that should only serve requests.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "inflo.scheduler.auto-complete.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfiguration {
}
