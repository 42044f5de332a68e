package tech.yump.secretsync.sync;

/**
 * What happens to remote secrets a definition no longer pushes.
 */
public enum DeletionPolicy {
    /** Leave them in the backend. */
    NONE,
    /** Delete them from the backend, including when the definition itself is removed. */
    DELETE
}
