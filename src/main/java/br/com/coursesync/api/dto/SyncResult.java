package br.com.coursesync.api.dto;

import br.com.coursesync.api.dto.change.ChangeOperation;

import java.util.List;

/**
 * Resultado de um ciclo: todas as operações calculadas e o subconjunto
 * que falhou (na ordem original), para replay no próximo ciclo.
 */
public record SyncResult(
        List<ChangeOperation> changes,
        List<ChangeOperation> failedChanges
) {
    public boolean hasFailures() {
        return !failedChanges.isEmpty();
    }
}
