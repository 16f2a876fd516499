package br.com.coursesync.api.dto;

import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.model.SyncTask;
import br.com.coursesync.api.model.enums.SyncStatus;

import java.time.LocalDateTime;
import java.util.List;

public record SyncTaskDTO(
        Long id,
        String courseId,
        SyncStatus status,
        LocalDateTime startTime,
        LocalDateTime endTime,
        Integer totalChanges,
        Integer failedChanges,
        String currentLog,
        String errorMessage,
        List<ChangeOperation> failedOperations
) {
    // Construtor de conveniência para mapear da Entidade
    public SyncTaskDTO(SyncTask task, List<ChangeOperation> failedOperations) {
        this(
                task.getId(),
                task.getCourseExternalId(),
                task.getStatus(),
                task.getStartTime(),
                task.getEndTime(),
                task.getTotalChanges(),
                task.getFailedChanges(),
                task.getCurrentLog(),
                task.getErrorMessage(),
                failedOperations
        );
    }
}
