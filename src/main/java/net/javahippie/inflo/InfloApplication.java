package net.javahippie.inflo;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Main Spring Boot application class for Inflo.
 * Runs the intervention period completion pipeline and its nightly auto-completion sweep.
 */
@SpringBootApplication
@Slf4j
public class InfloApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfloApplication.class, args);
        log.info("Inflo application started successfully!");
    }

    /**
     * System clock used for completion timestamps and the sweep cutoff date.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
