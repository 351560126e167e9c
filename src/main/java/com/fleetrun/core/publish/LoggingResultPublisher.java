package com.fleetrun.core.publish;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default publisher: writes each logical scenario outcome to the log.
 */
@Component
public class LoggingResultPublisher implements ResultPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingResultPublisher.class);

    @Override
    public void publish(PublishRequest request) {
        if (request.isConsolidated()) {
            log.info("Published {} :: {} - {} over {} iterations ({}ms)\n{}",
                    request.featureName(), request.scenarioName(), request.status().label(),
                    request.iterationData().size(), request.durationMs(), request.summaryComment());
        } else {
            log.info("Published {} :: {} - {} ({}ms){}",
                    request.featureName(), request.scenarioName(), request.status().label(),
                    request.durationMs(), request.error() != null ? " " + request.error() : "");
        }
    }
}
