package fr.imt.shellbridge.shellbridge.infrastructure.logging;

import fr.imt.shellbridge.shellbridge.business.port.SessionEventPublisherPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default publisher when Redis events are off: session events only reach the log.
 */
@Component
@ConditionalOnProperty(name = "shellbridge.events.redis.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class LoggingSessionEventPublisherAdapter implements SessionEventPublisherPort {

    @Override
    public void publish(String connectionId, String event) {
        log.debug("[EVENT] {} {}", connectionId, event);
    }
}
