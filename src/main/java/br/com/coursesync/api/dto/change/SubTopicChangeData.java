package br.com.coursesync.api.dto.change;

// Também usado para tópicos, sem topicId
public record SubTopicChangeData(
        String name,
        String topicId
) implements ChangeData {

    public static SubTopicChangeData forTopic(String name) {
        return new SubTopicChangeData(name, null);
    }
}
