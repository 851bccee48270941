package fr.imt.shellbridge.shellbridge.business.service.identity;

import fr.imt.shellbridge.shellbridge.business.model.ConnectionConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ConnectionIdStrategyTest {

    private final ConnectionConfig config = ConnectionConfig.builder()
            .host("10.0.0.5")
            .port(2222)
            .username("alice")
            .password("secret")
            .build();

    @Test
    void userHostPort_isStableForSameEndpoint() {
        UserHostPortIdStrategy strategy = new UserHostPortIdStrategy();

        assertEquals("alice@10.0.0.5:2222", strategy.derive(config).value());
        assertEquals(strategy.derive(config), strategy.derive(config));
    }

    @Test
    void userHostPort_ignoresCredentials() {
        ConnectionConfig withKey = ConnectionConfig.builder()
                .host("10.0.0.5").port(2222).username("alice").privateKeyPath("/keys/id_ed25519")
                .build();

        UserHostPortIdStrategy strategy = new UserHostPortIdStrategy();

        assertEquals(strategy.derive(config), strategy.derive(withKey));
    }

    @Test
    void unique_appendsIncreasingSuffix() {
        UniqueConnectionIdStrategy strategy = new UniqueConnectionIdStrategy(new UserHostPortIdStrategy());

        String first = strategy.derive(config).value();
        String second = strategy.derive(config).value();

        assertEquals("alice@10.0.0.5:2222#1", first);
        assertEquals("alice@10.0.0.5:2222#2", second);
        assertNotEquals(first, second);
    }
}
