package fpt.com.ehraccess.domain.accesslog.entity;

public enum AccessAction {
    VIEW,
    CREATE,
    UPDATE,
    ARCHIVE
}
