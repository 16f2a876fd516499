package br.com.coursesync.api.dto.outline;

import java.util.List;

public record OutlineTopic(
        String id,
        String name,
        List<OutlineSubTopic> subTopics // Visão de conveniência dos filhos
) {
    public OutlineTopic {
        subTopics = (subTopics == null) ? List.of() : List.copyOf(subTopics);
    }
}
