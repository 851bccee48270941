package fr.imt.shellbridge.shellbridge.configuration;

import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.keyverifier.KnownHostsServerKeyVerifier;
import org.apache.sshd.client.keyverifier.RejectAllServerKeyVerifier;
import org.apache.sshd.client.keyverifier.ServerKeyVerifier;
import org.apache.sshd.core.CoreModuleProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Shared Apache MINA SSHD client. One client multiplexes every session; stopping it at
 * shutdown tears down whatever sessions are still open.
 */
@Configuration
@Slf4j
public class SshClientConfiguration {

    @Bean(destroyMethod = "stop")
    public SshClient sshClient(ShellbridgeProperties properties) {
        ShellbridgeProperties.Ssh ssh = properties.getSsh();

        SshClient client = SshClient.setUpDefaultClient();
        client.setServerKeyVerifier(serverKeyVerifier(ssh));
        CoreModuleProperties.TCP_NODELAY.set(client, true);
        CoreModuleProperties.HEARTBEAT_INTERVAL.set(client, ssh.getHeartbeatInterval());
        CoreModuleProperties.IDLE_TIMEOUT.set(client, ssh.getIdleTimeout());
        client.start();

        log.info("[SSH] Client started (heartbeat {}, idle timeout {})",
                ssh.getHeartbeatInterval(), ssh.getIdleTimeout());
        return client;
    }

    private ServerKeyVerifier serverKeyVerifier(ShellbridgeProperties.Ssh ssh) {
        if (ssh.getKnownHostsFile() == null || ssh.getKnownHostsFile().isBlank()) {
            log.warn("[SSH] No known_hosts file configured, server host keys will not be verified");
            return AcceptAllServerKeyVerifier.INSTANCE;
        }
        log.info("[SSH] Verifying server host keys against {}", ssh.getKnownHostsFile());
        return new KnownHostsServerKeyVerifier(RejectAllServerKeyVerifier.INSTANCE, Path.of(ssh.getKnownHostsFile()));
    }
}
