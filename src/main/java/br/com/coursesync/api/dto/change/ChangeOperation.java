package br.com.coursesync.api.dto.change;

import br.com.coursesync.api.model.enums.EntityType;
import br.com.coursesync.api.model.enums.OperationType;

/**
 * Uma instrução CREATE/UPDATE/DELETE sobre uma entidade, gerada pelo diff
 * e consumida uma única vez pelo processador. Nunca é persistida como entidade.
 */
public record ChangeOperation(
        OperationType operation,
        EntityType entityType,
        String entityId,
        ChangeData data
) {

    public static ChangeOperation create(EntityType entityType, String entityId, ChangeData data) {
        return new ChangeOperation(OperationType.CREATE, entityType, entityId, data);
    }

    public static ChangeOperation update(EntityType entityType, String entityId, ChangeData data) {
        return new ChangeOperation(OperationType.UPDATE, entityType, entityId, data);
    }

    public static ChangeOperation delete(EntityType entityType, String entityId) {
        return new ChangeOperation(OperationType.DELETE, entityType, entityId, null);
    }

    public String describe() {
        return operation + " " + entityType + " " + entityId;
    }
}
