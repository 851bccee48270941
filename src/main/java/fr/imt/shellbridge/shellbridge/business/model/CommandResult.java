package fr.imt.shellbridge.shellbridge.business.model;

/**
 * Outcome of one command run against a session.
 *
 * @param stdout           captured standard output (empty after a successful cd)
 * @param stderr           captured standard error
 * @param exitStatus       remote exit status, or {@link #DISPATCH_FAILURE}
 * @param currentDirectory the session's tracked directory after the command ran
 */
public record CommandResult(String stdout, String stderr, int exitStatus, String currentDirectory) {

    /** Exit status used when the command could not be dispatched at all. */
    public static final int DISPATCH_FAILURE = -1;

    public static CommandResult dispatchFailure(String reason, String currentDirectory) {
        return new CommandResult("", "Command execution failed: " + reason, DISPATCH_FAILURE, currentDirectory);
    }

    public boolean success() {
        return exitStatus == 0;
    }
}
