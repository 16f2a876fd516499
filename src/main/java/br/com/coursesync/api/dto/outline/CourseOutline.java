package br.com.coursesync.api.dto.outline;

import java.util.List;
import java.util.Optional;

/**
 * Uma versão imutável do outline de um curso. Uma nova instância é criada
 * a cada ciclo de sincronização.
 */
public record CourseOutline(
        String courseId,
        String title,
        String courseOutline,
        CourseStructure structure,
        List<OutlineTopic> topics
) {
    public CourseOutline {
        structure = (structure == null) ? CourseStructure.empty() : structure;
        topics = (topics == null) ? List.of() : List.copyOf(topics);
    }

    public Optional<OutlineTopic> findTopic(String topicId) {
        return topics.stream()
                .filter(topic -> topic.id().equals(topicId))
                .findFirst();
    }

    public Optional<OutlineSubTopic> findSubTopic(String subTopicId) {
        return topics.stream()
                .flatMap(topic -> topic.subTopics().stream())
                .filter(subTopic -> subTopic.id().equals(subTopicId))
                .findFirst();
    }
}
