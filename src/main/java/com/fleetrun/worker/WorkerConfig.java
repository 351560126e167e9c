package com.fleetrun.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetrun.worker.local.InProcessWorkerChannelFactory;
import com.fleetrun.worker.process.ProcessWorkerChannelFactory;
import com.fleetrun.worker.protocol.MessageCodec;
import com.fleetrun.worker.runtime.ScenarioExecutors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerConfig {

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean
    public WorkerChannelFactory processWorkerChannelFactory(WorkerProperties properties, MessageCodec codec) {
        return new ProcessWorkerChannelFactory(properties.getCommand(), codec);
    }

    /**
     * Each in-process worker gets its own executor, looked up the same way a child process would.
     */
    @Bean
    public WorkerChannelFactory inProcessWorkerChannelFactory() {
        return new InProcessWorkerChannelFactory(() -> ScenarioExecutors.load(WorkerConfig.class.getClassLoader()));
    }
}
