package com.agentmanager.gateway;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agentmanager.gateway")
public class GatewayProperties {

    private String path = "/ws";
    private String[] allowedOrigins = {"*"};
    private long heartbeatIntervalMs = 30_000;
    private int missedHeartbeatLimit = 3;
    private int sendTimeLimitMs = 10_000;
    private int sendBufferSizeLimit = 512 * 1024;

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public String[] getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(String[] allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    public long getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }
    public int getMissedHeartbeatLimit() { return missedHeartbeatLimit; }
    public void setMissedHeartbeatLimit(int missedHeartbeatLimit) { this.missedHeartbeatLimit = missedHeartbeatLimit; }
    public int getSendTimeLimitMs() { return sendTimeLimitMs; }
    public void setSendTimeLimitMs(int sendTimeLimitMs) { this.sendTimeLimitMs = sendTimeLimitMs; }
    public int getSendBufferSizeLimit() { return sendBufferSizeLimit; }
    public void setSendBufferSizeLimit(int sendBufferSizeLimit) { this.sendBufferSizeLimit = sendBufferSizeLimit; }
}
