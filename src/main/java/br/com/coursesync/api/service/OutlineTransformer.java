package br.com.coursesync.api.service;

import br.com.coursesync.api.dto.outline.CourseOutline;
import br.com.coursesync.api.dto.outline.CourseStructure;
import br.com.coursesync.api.dto.outline.OutlineSubTopic;
import br.com.coursesync.api.dto.outline.OutlineTopic;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converte o documento aninhado da plataforma externa (formato edX) no nosso outline.
 *
 * Formato esperado:
 * <pre>
 * { "course_structure": { "child_info": { "children": [
 *     { "id": "...", "display_name": "...", "has_children": true,
 *       "child_info": { "children": [ { "id": "...", "display_name": "..." } ] } } ] } } }
 * </pre>
 * Estruturas ausentes ou malformadas resultam em coleções vazias, nunca em exceção.
 */
@Component
public class OutlineTransformer {

    private static final Logger logger = LoggerFactory.getLogger(OutlineTransformer.class);

    private record Transformed(CourseStructure structure, List<OutlineTopic> topics) {
    }

    public CourseOutline transformToCourseOutline(JsonNode structure, String courseId, String title, String courseOutline) {
        Transformed transformed = transformAll(structure);
        return new CourseOutline(courseId, title, courseOutline, transformed.structure(), transformed.topics());
    }

    public CourseStructure transformStructure(JsonNode structure) {
        return transformAll(structure).structure();
    }

    public List<OutlineTopic> transformTopics(JsonNode structure) {
        return transformAll(structure).topics();
    }

    // Uma única passada monta a estrutura e a lista de tópicos
    private Transformed transformAll(JsonNode structure) {
        Set<String> topicIds = new LinkedHashSet<>();
        Set<String> subTopicIds = new LinkedHashSet<>();
        Map<String, String> subTopicToTopic = new LinkedHashMap<>();
        List<OutlineTopic> topics = new ArrayList<>();

        for (JsonNode topicNode : courseChildren(structure)) {
            String topicId = text(topicNode, "id");
            if (topicId.isEmpty()) {
                continue;
            }
            if (!topicIds.add(topicId)) {
                logger.warn("Tópico duplicado ignorado: {}", topicId);
                continue;
            }

            List<OutlineSubTopic> subTopics = new ArrayList<>();
            if (topicNode.path("has_children").asBoolean(false)) {
                for (JsonNode subTopicNode : children(topicNode)) {
                    String subTopicId = text(subTopicNode, "id");
                    if (subTopicId.isEmpty() || subTopicIds.contains(subTopicId)) {
                        continue;
                    }
                    subTopics.add(new OutlineSubTopic(subTopicId, text(subTopicNode, "display_name"), topicId));
                    subTopicIds.add(subTopicId);
                    subTopicToTopic.put(subTopicId, topicId);
                }
            }

            topics.add(new OutlineTopic(topicId, text(topicNode, "display_name"), subTopics));
        }

        return new Transformed(new CourseStructure(topicIds, subTopicIds, subTopicToTopic), topics);
    }

    private List<JsonNode> courseChildren(JsonNode structure) {
        if (structure == null) {
            return List.of();
        }
        JsonNode courseStructure = structure.path("course_structure");
        if (!courseStructure.isObject()) {
            logger.warn("Formato inválido de course_structure");
            return List.of();
        }
        return children(courseStructure);
    }

    private List<JsonNode> children(JsonNode node) {
        JsonNode children = node.path("child_info").path("children");
        List<JsonNode> result = new ArrayList<>();
        if (children.isArray()) {
            children.forEach(child -> {
                if (child.isObject()) {
                    result.add(child);
                }
            });
        }
        return result;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() ? value.asText("") : "";
    }
}
