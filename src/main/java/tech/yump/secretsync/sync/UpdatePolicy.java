package tech.yump.secretsync.sync;

/**
 * How pushes treat secrets that already exist remotely.
 */
public enum UpdatePolicy {
    REPLACE,
    /** Skip remote keys that already exist. */
    IF_NOT_EXISTS
}
