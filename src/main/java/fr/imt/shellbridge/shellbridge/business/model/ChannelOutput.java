package fr.imt.shellbridge.shellbridge.business.model;

/**
 * Raw output of a single exec channel.
 */
public record ChannelOutput(String stdout, String stderr, int exitStatus) {

    public boolean isSuccess() {
        return exitStatus == 0;
    }
}
