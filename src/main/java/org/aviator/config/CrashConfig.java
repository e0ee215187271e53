package org.aviator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CrashConfig {

    // horloge unique du moteur ; remplacée par une horloge fixe dans les tests
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
