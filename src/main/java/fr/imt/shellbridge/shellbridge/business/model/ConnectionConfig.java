package fr.imt.shellbridge.shellbridge.business.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Everything needed to open and authenticate one SSH connection.
 * Exactly one of {@code password} and {@code privateKeyPath} must be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionConfig {

    private String host;
    private int port;
    private String username;

    @ToString.Exclude
    private String password;

    private String privateKeyPath;

    @ToString.Exclude
    private String passphrase;

    public boolean usesPassword() {
        return password != null;
    }

    public boolean usesPrivateKey() {
        return privateKeyPath != null && !privateKeyPath.isBlank();
    }

    /**
     * @return the passphrase, or null when none was given or it is blank
     */
    public String effectivePassphrase() {
        return passphrase == null || passphrase.isBlank() ? null : passphrase;
    }
}
