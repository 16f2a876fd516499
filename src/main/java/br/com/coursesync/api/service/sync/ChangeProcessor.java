package br.com.coursesync.api.service.sync;

import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.exception.ChangeBatchAbortedException;
import br.com.coursesync.api.exception.ResourceNotFoundException;
import br.com.coursesync.api.model.enums.ProcessingMode;
import br.com.coursesync.api.repository.CourseRepository;
import br.com.coursesync.api.repository.SubTopicRepository;
import br.com.coursesync.api.repository.TopicRepository;
import br.com.coursesync.api.service.sync.strategy.ChangeStrategy;
import br.com.coursesync.api.service.sync.strategy.CreateStrategy;
import br.com.coursesync.api.service.sync.strategy.DeleteStrategy;
import br.com.coursesync.api.service.sync.strategy.UpdateStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;

/**
 * Aplica as operações geradas pelo {@link DiffEngine}, uma de cada vez e na ordem recebida,
 * escolhendo a estratégia pelo tipo de operação.
 *
 * <p>No modo {@link ProcessingMode#BEST_EFFORT} uma operação que falha é registrada e o lote
 * continua; o chamador recebe a lista de falhas para replay. Nada do que já foi aplicado é desfeito.
 * No modo {@link ProcessingMode#STRICT} a primeira falha lança {@link ChangeBatchAbortedException}
 * para que a transação do chamador seja desfeita.
 *
 * <p>Payload incompatível com a entidade ({@link br.com.coursesync.api.exception.InvalidChangeDataTypeException})
 * sempre propaga, em qualquer modo.
 *
 * <p>Cada operação aplicada é enviada ao banco (flush) antes da próxima, para que um erro de banco
 * apareça na operação que o causou. Erros de banco ({@link DataAccessException}) não são tratados aqui:
 * a transação do chamador já está comprometida e precisa ser desfeita por inteiro.
 *
 * <p>Não é thread-safe: um processador por ciclo de sincronização.
 */
public class ChangeProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ChangeProcessor.class);

    private final ChangeStrategy createStrategy;
    private final ChangeStrategy updateStrategy;
    private final ChangeStrategy deleteStrategy;
    private final Runnable flusher;
    private final ProcessingMode mode;

    public ChangeProcessor(CourseContext context,
                           CourseRepository courseRepository,
                           TopicRepository topicRepository,
                           SubTopicRepository subTopicRepository,
                           ProcessingMode mode) {
        this(new CreateStrategy(context, topicRepository, subTopicRepository),
                new UpdateStrategy(courseRepository, topicRepository, subTopicRepository),
                new DeleteStrategy(courseRepository, topicRepository, subTopicRepository),
                courseRepository::flush,
                mode);
    }

    ChangeProcessor(ChangeStrategy createStrategy,
                    ChangeStrategy updateStrategy,
                    ChangeStrategy deleteStrategy,
                    Runnable flusher,
                    ProcessingMode mode) {
        this.createStrategy = createStrategy;
        this.updateStrategy = updateStrategy;
        this.deleteStrategy = deleteStrategy;
        this.flusher = flusher;
        this.mode = mode == null ? ProcessingMode.BEST_EFFORT : mode;
    }

    /**
     * Processa uma lista de operações.
     *
     * @param changes operações na ordem gerada pelo diff
     * @return as operações que falharam, na ordem original
     */
    public List<ChangeOperation> process(List<ChangeOperation> changes) {
        List<ChangeOperation> failedChanges = new ArrayList<>();

        for (ChangeOperation change : changes) {
            logger.info("Processando: Operação={}, Entidade={}, ID={}",
                    change.operation(), change.entityType(), change.entityId());

            ChangeStrategy strategy = strategyFor(change);
            if (strategy == null) {
                logger.error("Nenhuma estratégia para a operação: {}", change.describe());
                recordFailure(failedChanges, change, null);
                continue;
            }

            try {
                if (strategy.process(change)) {
                    flusher.run();
                } else {
                    logger.error("Falha ao processar a operação: {}", change.describe());
                    recordFailure(failedChanges, change, null);
                }
            } catch (ResourceNotFoundException e) {
                logger.error("Entidade não encontrada ao processar {}: {}", change.describe(), e.getMessage());
                recordFailure(failedChanges, change, e);
            } catch (DataAccessException e) {
                logger.warn("Erro de banco na operação {}; o lote será desfeito: {}", change.describe(), e.getMessage());
                throw e;
            }
        }

        if (!failedChanges.isEmpty()) {
            logger.warn("{} de {} operações falharam", failedChanges.size(), changes.size());
        }
        return failedChanges;
    }

    public ProcessingMode getMode() {
        return mode;
    }

    private ChangeStrategy strategyFor(ChangeOperation change) {
        if (change.operation() == null || change.entityType() == null) {
            return null;
        }
        switch (change.operation()) {
            case CREATE:
                return createStrategy;
            case UPDATE:
                return updateStrategy;
            case DELETE:
                return deleteStrategy;
            default:
                return null;
        }
    }

    private void recordFailure(List<ChangeOperation> failedChanges, ChangeOperation change, Exception cause) {
        if (mode == ProcessingMode.STRICT) {
            throw new ChangeBatchAbortedException(change, cause);
        }
        failedChanges.add(change);
    }
}
