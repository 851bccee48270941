package fr.imt.shellbridge.shellbridge.business.model;

import fr.imt.shellbridge.shellbridge.business.port.TransportSession;
import lombok.Getter;
import lombok.Setter;

/**
 * An authenticated transport plus the working directory tracked on top of it.
 * The directory is empty until the initial probe has run.
 */
@Getter
public class ShellSession implements AutoCloseable {

    private final TransportSession transport;

    @Setter
    private String currentDirectory = "";

    public ShellSession(TransportSession transport) {
        this.transport = transport;
    }

    @Override
    public void close() {
        transport.close();
    }
}
