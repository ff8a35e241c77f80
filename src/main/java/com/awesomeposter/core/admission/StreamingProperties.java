package com.awesomeposter.core.admission;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "awesomeposter.streaming")
public class StreamingProperties {

    /** Open-or-queued streams allowed before new ones are rejected; 0 rejects every stream. */
    private int maxPending = 32;

    /** Runs executing at once; further admitted streams wait for a slot. */
    private int concurrency = 4;

    private Duration heartbeatInterval = Duration.ofSeconds(15);

    /** Value of the Retry-After header on a busy response. */
    private int retryAfterSeconds = 2;

    private Duration emitterTimeout = Duration.ofMinutes(30);

    public int getMaxPending() { return maxPending; }
    public void setMaxPending(int maxPending) { this.maxPending = maxPending; }

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

    public int getRetryAfterSeconds() { return retryAfterSeconds; }
    public void setRetryAfterSeconds(int retryAfterSeconds) { this.retryAfterSeconds = retryAfterSeconds; }

    public Duration getEmitterTimeout() { return emitterTimeout; }
    public void setEmitterTimeout(Duration emitterTimeout) { this.emitterTimeout = emitterTimeout; }
}
