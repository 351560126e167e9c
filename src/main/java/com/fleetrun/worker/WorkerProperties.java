package com.fleetrun.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "fleetrun.worker")
public class WorkerProperties {

    private String provider = "process";
    private int maxWorkers = 0;
    private int spawnTimeoutSeconds = 30;
    private List<String> command = new ArrayList<>();
    private Map<String, String> environment = new LinkedHashMap<>();

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public int getMaxWorkers() { return maxWorkers; }
    public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
    public int getSpawnTimeoutSeconds() { return spawnTimeoutSeconds; }
    public void setSpawnTimeoutSeconds(int spawnTimeoutSeconds) { this.spawnTimeoutSeconds = spawnTimeoutSeconds; }
    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment; }

    public Duration getSpawnTimeout() {
        return Duration.ofSeconds(spawnTimeoutSeconds);
    }
}
