package br.com.coursesync.api.service.sync.strategy;

import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.exception.ResourceNotFoundException;
import br.com.coursesync.api.model.Course;
import br.com.coursesync.api.model.SubTopic;
import br.com.coursesync.api.model.Topic;
import br.com.coursesync.api.model.enums.EntityType;
import br.com.coursesync.api.repository.CourseRepository;
import br.com.coursesync.api.repository.SubTopicRepository;
import br.com.coursesync.api.repository.TopicRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DeleteStrategy implements ChangeStrategy {

    private static final Logger logger = LoggerFactory.getLogger(DeleteStrategy.class);

    private final CourseRepository courseRepository;
    private final TopicRepository topicRepository;
    private final SubTopicRepository subTopicRepository;

    public DeleteStrategy(CourseRepository courseRepository, TopicRepository topicRepository,
                          SubTopicRepository subTopicRepository) {
        this.courseRepository = courseRepository;
        this.topicRepository = topicRepository;
        this.subTopicRepository = subTopicRepository;
    }

    @Override
    public boolean process(ChangeOperation change) {
        EntityType entityType = change.entityType();
        logger.info("Removendo {} com ID {}", entityType, change.entityId());

        switch (entityType) {
            case COURSE:
                return deleteCourse(change.entityId());
            case TOPIC:
                return deleteTopic(change.entityId());
            case SUBTOPIC:
                return deleteSubTopic(change.entityId());
            default:
                logger.error("Tipo de entidade não suportado para DELETE: {}", entityType);
                return false;
        }
    }

    private boolean deleteCourse(String courseId) {
        Course course = courseRepository.findByExternalId(courseId)
                .orElseThrow(() -> new ResourceNotFoundException("Curso não encontrado: " + courseId));
        courseRepository.delete(course);
        return true;
    }

    // Os subtópicos restantes são removidos em cascata pelo JPA
    private boolean deleteTopic(String blockId) {
        Topic topic = topicRepository.findByBlockId(blockId)
                .orElseThrow(() -> new ResourceNotFoundException("Tópico não encontrado: " + blockId));
        if (topic.getCourse() != null) {
            topic.getCourse().getTopics().remove(topic);
        }
        topicRepository.delete(topic);
        return true;
    }

    private boolean deleteSubTopic(String blockId) {
        SubTopic subTopic = subTopicRepository.findByBlockId(blockId)
                .orElseThrow(() -> new ResourceNotFoundException("Subtópico não encontrado: " + blockId));
        if (subTopic.getTopic() != null) {
            subTopic.getTopic().removeSubTopic(subTopic);
        }
        subTopicRepository.delete(subTopic);
        return true;
    }
}
