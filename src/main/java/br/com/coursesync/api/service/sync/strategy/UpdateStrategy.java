package br.com.coursesync.api.service.sync.strategy;

import br.com.coursesync.api.dto.change.ChangeData;
import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.dto.change.CourseChangeData;
import br.com.coursesync.api.dto.change.SubTopicChangeData;
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

public class UpdateStrategy implements ChangeStrategy {

    private static final Logger logger = LoggerFactory.getLogger(UpdateStrategy.class);

    private final CourseRepository courseRepository;
    private final TopicRepository topicRepository;
    private final SubTopicRepository subTopicRepository;

    public UpdateStrategy(CourseRepository courseRepository, TopicRepository topicRepository,
                          SubTopicRepository subTopicRepository) {
        this.courseRepository = courseRepository;
        this.topicRepository = topicRepository;
        this.subTopicRepository = subTopicRepository;
    }

    @Override
    public boolean process(ChangeOperation change) {
        EntityType entityType = change.entityType();
        logger.info("Atualizando {} com ID {}", entityType, change.entityId());

        switch (entityType) {
            case COURSE:
                return updateCourse(change.entityId(), change.data());
            case TOPIC:
                return updateTopic(change.entityId(), change.data());
            case SUBTOPIC:
                return updateSubTopic(change.entityId(), change.data());
            default:
                logger.error("Tipo de entidade não suportado para UPDATE: {}", entityType);
                return false;
        }
    }

    private boolean updateCourse(String courseId, ChangeData changeData) {
        CourseChangeData data = ChangeDataTypes.require(changeData, CourseChangeData.class, "atualizar um curso");

        Course course = courseRepository.findByExternalId(courseId)
                .orElseThrow(() -> new ResourceNotFoundException("Curso não encontrado: " + courseId));
        course.setName(data.name());
        course.setCourseOutline(data.courseOutline());
        courseRepository.save(course);
        return true;
    }

    private boolean updateTopic(String blockId, ChangeData changeData) {
        ChangeData data = ChangeDataTypes.require(changeData, ChangeData.class, "atualizar um tópico");

        Topic topic = topicRepository.findByBlockId(blockId)
                .orElseThrow(() -> new ResourceNotFoundException("Tópico não encontrado: " + blockId));
        topic.setName(data.name());
        topicRepository.save(topic);
        return true;
    }

    private boolean updateSubTopic(String blockId, ChangeData changeData) {
        SubTopicChangeData data = ChangeDataTypes.require(changeData, SubTopicChangeData.class, "atualizar um subtópico");

        SubTopic subTopic = subTopicRepository.findByBlockId(blockId)
                .orElseThrow(() -> new ResourceNotFoundException("Subtópico não encontrado: " + blockId));

        // O novo tópico é resolvido antes de qualquer alteração na entidade
        Topic currentTopic = subTopic.getTopic();
        if (data.topicId() != null && (currentTopic == null || !data.topicId().equals(currentTopic.getBlockId()))) {
            Topic newTopic = topicRepository.findByBlockId(data.topicId())
                    .orElseThrow(() -> new ResourceNotFoundException("Tópico não encontrado: " + data.topicId()));
            logger.info("Subtópico {} movido para o tópico {}", blockId, data.topicId());
            if (currentTopic != null) {
                currentTopic.removeSubTopic(subTopic);
            }
            newTopic.addSubTopic(subTopic);
        }

        subTopic.setName(data.name());
        subTopicRepository.save(subTopic);
        return true;
    }
}
