package br.com.coursesync.api.model.enums;

public enum OperationType {
    CREATE,
    UPDATE,
    DELETE
}
