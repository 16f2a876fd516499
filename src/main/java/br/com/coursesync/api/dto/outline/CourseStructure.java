package br.com.coursesync.api.dto.outline;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Esqueleto de uma versão do outline: ids de tópicos, ids de subtópicos
 * e o mapa subtópico -> tópico. A ordem de inserção é preservada.
 */
public record CourseStructure(
        @JsonDeserialize(as = LinkedHashSet.class) Set<String> topicIds,
        @JsonDeserialize(as = LinkedHashSet.class) Set<String> subTopicIds,
        @JsonDeserialize(as = LinkedHashMap.class) Map<String, String> subTopicToTopic
) {
    public CourseStructure {
        topicIds = Collections.unmodifiableSet(new LinkedHashSet<>(topicIds == null ? Set.of() : topicIds));
        subTopicIds = Collections.unmodifiableSet(new LinkedHashSet<>(subTopicIds == null ? Set.of() : subTopicIds));
        subTopicToTopic = Collections.unmodifiableMap(
                new LinkedHashMap<>(subTopicToTopic == null ? Map.of() : subTopicToTopic));

        for (Map.Entry<String, String> entry : subTopicToTopic.entrySet()) {
            if (!subTopicIds.contains(entry.getKey())) {
                throw new IllegalArgumentException("Subtópico mapeado não pertence à estrutura: " + entry.getKey());
            }
            if (!topicIds.contains(entry.getValue())) {
                throw new IllegalArgumentException("Tópico mapeado não pertence à estrutura: " + entry.getValue());
            }
        }
    }

    public static CourseStructure empty() {
        return new CourseStructure(Set.of(), Set.of(), Map.of());
    }

    public String topicOf(String subTopicId) {
        return subTopicToTopic.get(subTopicId);
    }

    public int subTopicCount() {
        return subTopicIds.size();
    }
}
