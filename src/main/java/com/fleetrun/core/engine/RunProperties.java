package com.fleetrun.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "fleetrun.run")
public class RunProperties {

    private int deadlineSeconds = 300;
    private long pollIntervalMillis = 100;
    private int terminationGraceSeconds = 5;
    private int summaryMaxChars = 1000;
    private int shortErrorMaxChars = 120;

    /** Configuration snapshot forwarded to every worker with each execute message. */
    private Map<String, String> config = new LinkedHashMap<>();

    public int getDeadlineSeconds() { return deadlineSeconds; }
    public void setDeadlineSeconds(int deadlineSeconds) { this.deadlineSeconds = deadlineSeconds; }
    public long getPollIntervalMillis() { return pollIntervalMillis; }
    public void setPollIntervalMillis(long pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }
    public int getTerminationGraceSeconds() { return terminationGraceSeconds; }
    public void setTerminationGraceSeconds(int terminationGraceSeconds) { this.terminationGraceSeconds = terminationGraceSeconds; }
    public int getSummaryMaxChars() { return summaryMaxChars; }
    public void setSummaryMaxChars(int summaryMaxChars) { this.summaryMaxChars = summaryMaxChars; }
    public int getShortErrorMaxChars() { return shortErrorMaxChars; }
    public void setShortErrorMaxChars(int shortErrorMaxChars) { this.shortErrorMaxChars = shortErrorMaxChars; }
    public Map<String, String> getConfig() { return config; }
    public void setConfig(Map<String, String> config) { this.config = config; }

    public Duration getDeadline() {
        return Duration.ofSeconds(deadlineSeconds);
    }

    public Duration getPollInterval() {
        return Duration.ofMillis(pollIntervalMillis);
    }

    public Duration getTerminationGrace() {
        return Duration.ofSeconds(terminationGraceSeconds);
    }
}
