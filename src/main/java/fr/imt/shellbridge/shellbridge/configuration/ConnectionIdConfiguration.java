package fr.imt.shellbridge.shellbridge.configuration;

import fr.imt.shellbridge.shellbridge.business.service.identity.ConnectionIdStrategy;
import fr.imt.shellbridge.shellbridge.business.service.identity.UniqueConnectionIdStrategy;
import fr.imt.shellbridge.shellbridge.business.service.identity.UserHostPortIdStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ConnectionIdConfiguration {

    @Bean
    public ConnectionIdStrategy connectionIdStrategy(ShellbridgeProperties properties) {
        log.info("[REGISTRY] Connection id strategy: {}", properties.getRegistry().getIdStrategy());
        return switch (properties.getRegistry().getIdStrategy()) {
            case USER_HOST_PORT -> new UserHostPortIdStrategy();
            case UNIQUE -> new UniqueConnectionIdStrategy(new UserHostPortIdStrategy());
        };
    }
}
