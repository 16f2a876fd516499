package br.com.coursesync.api.service;

import br.com.coursesync.api.dto.CourseSyncRequest;
import br.com.coursesync.api.dto.SyncPreviewDTO;
import br.com.coursesync.api.dto.SyncResult;
import br.com.coursesync.api.dto.SyncTaskDTO;
import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.exception.StorageUnavailableException;
import br.com.coursesync.api.model.SyncTask;
import br.com.coursesync.api.service.sync.StorageRetryTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ponto de entrada de um ciclo de sincronização: abre a tarefa, executa o
 * ciclo transacional no {@link CourseSyncWorker} e fecha a tarefa com o resultado.
 *
 * <p>Quando o banco está travado o ciclo inteiro é repetido, cada tentativa em uma
 * transação nova. Esgotadas as tentativas, todas as operações do diff voltam como
 * falhas para o próximo ciclo, pois nada foi gravado.
 */
@Service
public class CourseSyncService {

    private static final Logger logger = LoggerFactory.getLogger(CourseSyncService.class);

    private final SyncTaskService syncTaskService;
    private final CourseSyncWorker courseSyncWorker;
    private final StorageRetryTemplate storageRetryTemplate;

    public CourseSyncService(SyncTaskService syncTaskService,
                             CourseSyncWorker courseSyncWorker,
                             StorageRetryTemplate storageRetryTemplate) {
        this.syncTaskService = syncTaskService;
        this.courseSyncWorker = courseSyncWorker;
        this.storageRetryTemplate = storageRetryTemplate;
    }

    public SyncTaskDTO synchronize(String courseExternalId, CourseSyncRequest request) {
        SyncTask task = syncTaskService.openTask(courseExternalId);
        try {
            SyncResult result = runCycle(courseExternalId, request);
            return syncTaskService.toDTO(syncTaskService.completeTask(task.getId(), result));
        } catch (RuntimeException e) {
            // A transação do ciclo já foi desfeita; só a tarefa registra a falha
            logger.error("Falha na sincronização do curso " + courseExternalId, e);
            syncTaskService.failTask(task.getId(), e);
            throw e;
        }
    }

    private SyncResult runCycle(String courseExternalId, CourseSyncRequest request) {
        try {
            return storageRetryTemplate.execute("sincronizar o curso " + courseExternalId,
                    () -> courseSyncWorker.synchronize(courseExternalId, request));
        } catch (StorageUnavailableException e) {
            List<ChangeOperation> changes = courseSyncWorker.preview(courseExternalId, request);
            logger.warn("Banco indisponível para o curso {}; {} operações ficam para o próximo ciclo",
                    courseExternalId, changes.size(), e);
            return new SyncResult(changes, changes);
        }
    }

    public SyncPreviewDTO preview(String courseExternalId, CourseSyncRequest request) {
        List<ChangeOperation> changes = courseSyncWorker.preview(courseExternalId, request);
        return new SyncPreviewDTO(courseExternalId, !courseSyncWorker.hasSnapshot(courseExternalId), changes);
    }
}
