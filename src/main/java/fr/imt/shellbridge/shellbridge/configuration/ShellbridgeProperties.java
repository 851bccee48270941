package fr.imt.shellbridge.shellbridge.configuration;

import fr.imt.shellbridge.shellbridge.business.model.IdStrategyType;
import fr.imt.shellbridge.shellbridge.business.model.QuotingMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "shellbridge")
public class ShellbridgeProperties {

    private final Ssh ssh = new Ssh();
    private final Command command = new Command();
    private final Registry registry = new Registry();
    private final Events events = new Events();

    @Data
    public static class Ssh {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration authTimeout = Duration.ofSeconds(30);
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        // Zero disables MINA's idle disconnect; sessions live until disconnected
        private Duration idleTimeout = Duration.ZERO;
        // Unset means every server key is accepted
        private String knownHostsFile;
    }

    @Data
    public static class Command {
        private String ptyType = "xterm";
        private Duration channelOpenTimeout = Duration.ofSeconds(30);
        // Zero waits forever
        private Duration timeout = Duration.ZERO;
        private QuotingMode quoting = QuotingMode.LITERAL;
    }

    @Data
    public static class Registry {
        // Zero waits forever
        private Duration lockTimeout = Duration.ZERO;
        private IdStrategyType idStrategy = IdStrategyType.USER_HOST_PORT;
    }

    @Data
    public static class Events {
        private final Redis redis = new Redis();

        @Data
        public static class Redis {
            private boolean enabled = false;
        }
    }
}
