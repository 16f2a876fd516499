package br.com.coursesync.api.dto.change;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Payload de uma {@link ChangeOperation}. A variante precisa corresponder
 * ao tipo de entidade da operação.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CourseChangeData.class, name = "course"),
        @JsonSubTypes.Type(value = SubTopicChangeData.class, name = "subtopic")
})
public interface ChangeData {

    String name();
}
