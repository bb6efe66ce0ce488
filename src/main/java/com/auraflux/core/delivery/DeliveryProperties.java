package com.auraflux.core.delivery;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "auraflux.delivery")
public class DeliveryProperties {

    private int streamBufferSize = 256;
    private int stateBufferSize = 16;
    private int deliveryThreads = 4;
    private long emitterTimeoutMs = 30 * 60 * 1000L;
    private long heartbeatIntervalSeconds = 30;

    public int getStreamBufferSize() {
        return streamBufferSize;
    }

    public void setStreamBufferSize(int streamBufferSize) {
        this.streamBufferSize = streamBufferSize;
    }

    public int getStateBufferSize() {
        return stateBufferSize;
    }

    public void setStateBufferSize(int stateBufferSize) {
        this.stateBufferSize = stateBufferSize;
    }

    public int getDeliveryThreads() {
        return deliveryThreads;
    }

    public void setDeliveryThreads(int deliveryThreads) {
        this.deliveryThreads = deliveryThreads;
    }

    public long getEmitterTimeoutMs() {
        return emitterTimeoutMs;
    }

    public void setEmitterTimeoutMs(long emitterTimeoutMs) {
        this.emitterTimeoutMs = emitterTimeoutMs;
    }

    public long getHeartbeatIntervalSeconds() {
        return heartbeatIntervalSeconds;
    }

    public void setHeartbeatIntervalSeconds(long heartbeatIntervalSeconds) {
        this.heartbeatIntervalSeconds = heartbeatIntervalSeconds;
    }
}
