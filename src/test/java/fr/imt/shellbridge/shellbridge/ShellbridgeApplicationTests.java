package fr.imt.shellbridge.shellbridge;

import fr.imt.shellbridge.shellbridge.business.port.SessionEventPublisherPort;
import fr.imt.shellbridge.shellbridge.business.service.identity.ConnectionIdStrategy;
import fr.imt.shellbridge.shellbridge.business.service.identity.UniqueConnectionIdStrategy;
import fr.imt.shellbridge.shellbridge.infrastructure.logging.LoggingSessionEventPublisherAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@SpringBootTest(properties = "shellbridge.registry.id-strategy=UNIQUE")
class ShellbridgeApplicationTests {

    @Autowired
    SessionEventPublisherPort eventPublisher;

    @Autowired
    ConnectionIdStrategy connectionIdStrategy;

    @Test
    void contextLoads() {
        assertInstanceOf(LoggingSessionEventPublisherAdapter.class, eventPublisher);
        assertInstanceOf(UniqueConnectionIdStrategy.class, connectionIdStrategy);
    }
}
