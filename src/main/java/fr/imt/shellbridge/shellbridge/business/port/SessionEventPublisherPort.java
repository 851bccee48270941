package fr.imt.shellbridge.shellbridge.business.port;

public interface SessionEventPublisherPort {
    void publish(String connectionId, String event);
}
