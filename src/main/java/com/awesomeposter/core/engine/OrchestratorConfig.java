package com.awesomeposter.core.engine;

import com.awesomeposter.core.hitl.HitlGate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OrchestratorConfig {

    @Bean
    public HitlGate hitlGate(OrchestratorProperties properties) {
        return new HitlGate(properties.getMaxHitlRequestsPerRun());
    }
}
