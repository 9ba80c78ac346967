package fpt.com.ehraccess.domain.accesslog.entity;

public enum PendingAuditStatus {
    PENDING,
    APPLIED
}
