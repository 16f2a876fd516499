package br.com.coursesync.api.service;

import br.com.coursesync.api.dto.SyncResult;
import br.com.coursesync.api.dto.SyncTaskDTO;
import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.exception.ResourceNotFoundException;
import br.com.coursesync.api.model.SyncTask;
import br.com.coursesync.api.model.enums.SyncStatus;
import br.com.coursesync.api.repository.SyncTaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Registro das execuções de sincronização. Cada método roda em sua própria
 * transação e faz o COMMIT ao terminar, mesmo que a transação do ciclo seja desfeita.
 */
@Service
public class SyncTaskService {

    private static final Logger logger = LoggerFactory.getLogger(SyncTaskService.class);

    private final SyncTaskRepository syncTaskRepository;
    private final ObjectMapper objectMapper;

    public SyncTaskService(SyncTaskRepository syncTaskRepository, ObjectMapper objectMapper) {
        this.syncTaskRepository = syncTaskRepository;
        this.objectMapper = objectMapper;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncTask openTask(String courseExternalId) {
        SyncTask task = new SyncTask();
        task.setCourseExternalId(courseExternalId);
        task.setStatus(SyncStatus.PROCESSING);
        task.setCurrentLog("Sincronização iniciada...");
        return syncTaskRepository.save(task);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncTask completeTask(Long taskId, SyncResult result) {
        SyncTask task = findTask(taskId);
        task.setTotalChanges(result.changes().size());
        task.setFailedChanges(result.failedChanges().size());
        task.setEndTime(LocalDateTime.now());

        if (result.hasFailures()) {
            task.setStatus(SyncStatus.COMPLETED_WITH_FAILURES);
            task.setCurrentLog(result.failedChanges().size() + " de " + result.changes().size()
                    + " operações falharam; serão reprocessadas no próximo ciclo.");
            task.setFailedOperations(writeOperations(result.failedChanges()));
        } else {
            task.setStatus(SyncStatus.COMPLETED);
            task.setCurrentLog("Sincronização concluída com " + result.changes().size() + " operações.");
        }
        return syncTaskRepository.save(task);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncTask failTask(Long taskId, Exception error) {
        SyncTask task = findTask(taskId);
        task.setStatus(SyncStatus.FAILED);
        task.setCurrentLog("Sincronização abortada; nenhuma alteração foi gravada.");
        task.setErrorMessage(error.getMessage());
        task.setEndTime(LocalDateTime.now());
        return syncTaskRepository.save(task);
    }

    @Transactional(readOnly = true)
    public SyncTaskDTO getTask(Long taskId) {
        return toDTO(findTask(taskId));
    }

    public SyncTaskDTO toDTO(SyncTask task) {
        return new SyncTaskDTO(task, readOperations(task.getFailedOperations()));
    }

    private SyncTask findTask(Long taskId) {
        return syncTaskRepository.findById(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Tarefa de sincronização não encontrada: " + taskId));
    }

    private String writeOperations(List<ChangeOperation> operations) {
        try {
            return objectMapper.writeValueAsString(operations);
        } catch (JsonProcessingException e) {
            logger.error("Falha ao serializar as operações que falharam", e);
            throw new IllegalStateException("Falha ao serializar as operações que falharam", e);
        }
    }

    private List<ChangeOperation> readOperations(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<ChangeOperation>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Operações gravadas estão corrompidas", e);
        }
    }
}
