package br.com.coursesync.api.dto.outline;

/**
 * Subtópico de uma versão do outline. A ligação com o tópico é por
 * identificador, não por contenção.
 */
public record OutlineSubTopic(
        String id,
        String name,
        String topicId
) {
}
