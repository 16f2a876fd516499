package br.com.coursesync.api.service.sync;

import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.dto.change.CourseChangeData;
import br.com.coursesync.api.dto.change.SubTopicChangeData;
import br.com.coursesync.api.dto.outline.CourseOutline;
import br.com.coursesync.api.dto.outline.OutlineSubTopic;
import br.com.coursesync.api.dto.outline.OutlineTopic;
import br.com.coursesync.api.model.enums.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compara duas versões do outline de um curso e gera as operações de mudança.
 *
 * A comparação é uma sequência fixa de estágios (curso, tópico, subtópico),
 * cada um responsável por um único tipo de entidade. A montagem final coloca
 * CREATEs e UPDATEs na ordem dos estágios e DELETEs na ordem inversa:
 * tópicos são criados antes dos seus subtópicos, e subtópicos são removidos
 * antes dos seus tópicos.
 */
@Service
public class DiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiffEngine.class);

    @FunctionalInterface
    interface DiffStage {
        /**
         * @param previous versão anterior, ou null na primeira sincronização
         * @param current  versão atual
         */
        StageChanges compare(CourseOutline previous, CourseOutline current);
    }

    record StageChanges(
            List<ChangeOperation> creates,
            List<ChangeOperation> updates,
            List<ChangeOperation> deletes
    ) {
        static StageChanges empty() {
            return new StageChanges(List.of(), List.of(), List.of());
        }
    }

    // Ordem: Curso -> Tópico -> Subtópico
    private static final List<DiffStage> STAGES = List.of(
            DiffEngine::diffCourse,
            DiffEngine::diffTopics,
            DiffEngine::diffSubTopics
    );

    /**
     * Compara a versão anterior e a atual de um curso.
     *
     * @param previous outline anterior (null se for um curso novo)
     * @param current  outline atual
     * @return as operações que transformam previous em current
     */
    public List<ChangeOperation> diff(CourseOutline previous, CourseOutline current) {
        Objects.requireNonNull(current, "O outline atual é obrigatório");

        logger.info("Iniciando diff do curso: {}", current.courseId());
        if (previous != null) {
            logger.debug("Versão anterior: título='{}', {} tópicos, {} subtópicos",
                    previous.title(), previous.structure().topicIds().size(), previous.structure().subTopicCount());
        } else {
            logger.debug("Sem versão anterior: primeira sincronização");
        }
        logger.debug("Versão atual: título='{}', {} tópicos, {} subtópicos",
                current.title(), current.structure().topicIds().size(), current.structure().subTopicCount());

        List<StageChanges> results = new ArrayList<>();
        for (DiffStage stage : STAGES) {
            results.add(stage.compare(previous, current));
        }

        List<ChangeOperation> changes = new ArrayList<>();
        for (StageChanges result : results) {
            changes.addAll(result.creates());
            changes.addAll(result.updates());
        }
        // Filhos antes dos pais
        for (int i = results.size() - 1; i >= 0; i--) {
            changes.addAll(results.get(i).deletes());
        }

        logger.info("Diff concluído com {} operações", changes.size());
        for (int i = 0; i < changes.size(); i++) {
            logger.debug("Operação {}: {}", i + 1, changes.get(i).describe());
        }
        return changes;
    }

    static StageChanges diffCourse(CourseOutline previous, CourseOutline current) {
        // O curso já existe antes da primeira sincronização; não há CREATE de curso
        if (previous == null) {
            return StageChanges.empty();
        }
        if (Objects.equals(previous.title(), current.title())
                && Objects.equals(previous.courseOutline(), current.courseOutline())) {
            return StageChanges.empty();
        }
        ChangeOperation update = ChangeOperation.update(EntityType.COURSE, current.courseId(),
                new CourseChangeData(current.title(), current.courseOutline()));
        return new StageChanges(List.of(), List.of(update), List.of());
    }

    static StageChanges diffTopics(CourseOutline previous, CourseOutline current) {
        Set<String> oldIds = previous == null ? Set.of() : previous.structure().topicIds();
        Set<String> newIds = current.structure().topicIds();

        List<ChangeOperation> creates = new ArrayList<>();
        List<ChangeOperation> updates = new ArrayList<>();
        List<ChangeOperation> deletes = new ArrayList<>();

        for (String topicId : minus(newIds, oldIds)) {
            creates.add(ChangeOperation.create(EntityType.TOPIC, topicId,
                    SubTopicChangeData.forTopic(topicName(current, topicId))));
        }

        for (String topicId : intersection(newIds, oldIds)) {
            String newName = topicName(current, topicId);
            if (!Objects.equals(topicName(previous, topicId), newName)) {
                updates.add(ChangeOperation.update(EntityType.TOPIC, topicId, SubTopicChangeData.forTopic(newName)));
            }
        }

        for (String topicId : minus(oldIds, newIds)) {
            deletes.add(ChangeOperation.delete(EntityType.TOPIC, topicId));
        }

        logger.debug("Estágio de tópicos: {} novos, {} alterados, {} removidos",
                creates.size(), updates.size(), deletes.size());
        return new StageChanges(creates, updates, deletes);
    }

    static StageChanges diffSubTopics(CourseOutline previous, CourseOutline current) {
        Set<String> oldIds = previous == null ? Set.of() : previous.structure().subTopicIds();
        Set<String> newIds = current.structure().subTopicIds();

        List<ChangeOperation> creates = new ArrayList<>();
        List<ChangeOperation> updates = new ArrayList<>();
        List<ChangeOperation> deletes = new ArrayList<>();

        for (String subTopicId : minus(newIds, oldIds)) {
            creates.add(ChangeOperation.create(EntityType.SUBTOPIC, subTopicId, subTopicData(current, subTopicId)));
        }

        for (String subTopicId : intersection(newIds, oldIds)) {
            SubTopicChangeData before = subTopicData(previous, subTopicId);
            SubTopicChangeData after = subTopicData(current, subTopicId);
            // Mudança de tópico pai é um UPDATE com o novo topicId, não uma operação de "mover"
            if (!before.equals(after)) {
                updates.add(ChangeOperation.update(EntityType.SUBTOPIC, subTopicId, after));
            }
        }

        for (String subTopicId : minus(oldIds, newIds)) {
            deletes.add(ChangeOperation.delete(EntityType.SUBTOPIC, subTopicId));
        }

        logger.debug("Estágio de subtópicos: {} novos, {} alterados, {} removidos",
                creates.size(), updates.size(), deletes.size());
        return new StageChanges(creates, updates, deletes);
    }

    private static String topicName(CourseOutline outline, String topicId) {
        return outline.findTopic(topicId)
                .map(OutlineTopic::name)
                .orElse(null);
    }

    private static SubTopicChangeData subTopicData(CourseOutline outline, String subTopicId) {
        String name = outline.findSubTopic(subTopicId)
                .map(OutlineSubTopic::name)
                .orElse(null);
        String topicId = outline.structure().topicOf(subTopicId);
        if (topicId == null) {
            topicId = outline.findSubTopic(subTopicId)
                    .map(OutlineSubTopic::topicId)
                    .orElse(null);
        }
        return new SubTopicChangeData(name, topicId);
    }

    private static Set<String> minus(Set<String> left, Set<String> right) {
        Set<String> result = new LinkedHashSet<>(left);
        result.removeAll(right);
        return result;
    }

    private static Set<String> intersection(Set<String> left, Set<String> right) {
        Set<String> result = new LinkedHashSet<>(left);
        result.retainAll(right);
        return result;
    }
}
