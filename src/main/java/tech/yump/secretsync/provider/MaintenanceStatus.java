package tech.yump.secretsync.provider;

public enum MaintenanceStatus {
    MAINTAINED,
    NOT_MAINTAINED
}
