package tech.yump.secretsync.provider;

/**
 * Operations a provider supports, declared once and fixed for the backend's lifetime.
 */
public enum Capabilities {
    READ_ONLY,
    WRITE_ONLY,
    READ_WRITE;

    public boolean canRead() {
        return this != WRITE_ONLY;
    }

    public boolean canWrite() {
        return this != READ_ONLY;
    }
}
