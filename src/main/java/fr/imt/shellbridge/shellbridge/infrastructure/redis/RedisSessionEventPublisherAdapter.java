package fr.imt.shellbridge.shellbridge.infrastructure.redis;

import fr.imt.shellbridge.shellbridge.business.port.SessionEventPublisherPort;
import fr.imt.shellbridge.shellbridge.configuration.RedisConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes session events on a Redis pub/sub topic as {@code connectionId|event}.
 */
@Component
@ConditionalOnProperty(name = "shellbridge.events.redis.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RedisSessionEventPublisherAdapter implements SessionEventPublisherPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publish(String connectionId, String event) {
        try {
            String payload = connectionId + "|" + event;
            redisTemplate.convertAndSend(RedisConfiguration.SESSION_EVENTS_TOPIC, payload);
        } catch (Exception e) {
            log.error("Failed to publish session event {} for {}", event, connectionId, e);
        }
    }
}
