package fr.imt.shellbridge.shellbridge.business.model;

/**
 * How the tracked directory is interpolated into the rewritten command line.
 */
public enum QuotingMode {
    /** {@code cd '<dir>' && cmd}, directory inserted as is. */
    LITERAL,
    /** Same form, with embedded single quotes escaped as {@code '\''}. */
    POSIX
}
