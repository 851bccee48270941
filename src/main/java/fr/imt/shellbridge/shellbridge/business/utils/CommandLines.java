package fr.imt.shellbridge.shellbridge.business.utils;

import fr.imt.shellbridge.shellbridge.business.model.QuotingMode;
import lombok.experimental.UtilityClass;

/**
 * Command line rewriting used to emulate a persistent working directory over
 * stateless exec channels.
 * <p>
 * Neither the cd argument nor, in {@link QuotingMode#LITERAL} mode, the tracked directory is
 * escaped: a directory containing {@code '} or an argument containing {@code &&} changes what
 * the remote shell runs.
 */
@UtilityClass
public class CommandLines {

    public static final String PWD = "pwd";

    private static final String CD = "cd";
    private static final String CD_PREFIX = "cd ";

    /**
     * A command is a directory change when, stripped, it is {@code cd} or starts with {@code "cd "}.
     */
    public static boolean isDirectoryChange(String rawCommand) {
        String stripped = rawCommand.strip();
        return stripped.equals(CD) || stripped.startsWith(CD_PREFIX);
    }

    /**
     * {@code cd <argument> && pwd}, argument inserted verbatim.
     */
    public static String directoryChange(String rawCommand) {
        String argument = rawCommand.strip().substring(CD.length()).strip();
        return CD + " " + argument + " && " + PWD;
    }

    /**
     * {@code cd '<directory>' && <command>}, or the command untouched while no directory is known.
     */
    public static String inDirectory(String directory, String rawCommand, QuotingMode quoting) {
        if (directory == null || directory.isEmpty()) {
            return rawCommand;
        }
        return CD + " " + quote(directory, quoting) + " && " + rawCommand;
    }

    static String quote(String directory, QuotingMode quoting) {
        if (quoting == QuotingMode.POSIX) {
            return "'" + directory.replace("'", "'\\''") + "'";
        }
        return "'" + directory + "'";
    }
}
