package br.com.coursesync.api.service.sync.strategy;

import br.com.coursesync.api.dto.change.ChangeData;
import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.dto.change.SubTopicChangeData;
import br.com.coursesync.api.exception.ResourceNotFoundException;
import br.com.coursesync.api.model.SubTopic;
import br.com.coursesync.api.model.Topic;
import br.com.coursesync.api.model.enums.EntityType;
import br.com.coursesync.api.repository.SubTopicRepository;
import br.com.coursesync.api.repository.TopicRepository;
import br.com.coursesync.api.service.sync.CourseContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * CREATE idempotente: se já existe uma linha com o mesmo block id, ela é mantida como está.
 * Uma linha com o mesmo block id que pertence a outro curso não conta como criada.
 */
public class CreateStrategy implements ChangeStrategy {

    private static final Logger logger = LoggerFactory.getLogger(CreateStrategy.class);

    private final CourseContext context;
    private final TopicRepository topicRepository;
    private final SubTopicRepository subTopicRepository;

    public CreateStrategy(CourseContext context, TopicRepository topicRepository, SubTopicRepository subTopicRepository) {
        this.context = context;
        this.topicRepository = topicRepository;
        this.subTopicRepository = subTopicRepository;
    }

    @Override
    public boolean process(ChangeOperation change) {
        EntityType entityType = change.entityType();
        logger.info("Criando {} com ID {}", entityType, change.entityId());

        if (entityType == EntityType.TOPIC) {
            return createTopic(change.entityId(), change.data());
        }
        if (entityType == EntityType.SUBTOPIC) {
            return createSubTopic(change.entityId(), change.data());
        }

        logger.error("Tipo de entidade não suportado para CREATE: {}", entityType);
        return false;
    }

    private boolean createTopic(String blockId, ChangeData topicData) {
        ChangeData data = ChangeDataTypes.require(topicData, ChangeData.class, "criar um tópico");

        Optional<Topic> existing = topicRepository.findByBlockId(blockId);
        if (existing.isPresent()) {
            return ownedByCourse(existing.get(), "Tópico", blockId);
        }

        Topic topic = new Topic();
        topic.setBlockId(blockId);
        topic.setName(data.name());
        topic.setCourse(context.course());
        topic.setExaminationLevel(context.examinationLevel());
        topic.setAcademicClass(context.academicClass());
        context.course().getTopics().add(topic);
        topicRepository.save(topic);
        return true;
    }

    private boolean createSubTopic(String blockId, ChangeData changeData) {
        SubTopicChangeData data = ChangeDataTypes.require(changeData, SubTopicChangeData.class, "criar um subtópico");

        Topic topic = topicRepository.findByBlockId(data.topicId())
                .filter(context::owns)
                .orElseThrow(() -> new ResourceNotFoundException("Tópico não encontrado: " + data.topicId()));

        Optional<SubTopic> existing = subTopicRepository.findByBlockId(blockId);
        if (existing.isPresent()) {
            return ownedByCourse(existing.get().getTopic(), "Subtópico", blockId);
        }

        SubTopic subTopic = new SubTopic();
        subTopic.setBlockId(blockId);
        subTopic.setName(data.name());
        topic.addSubTopic(subTopic);
        subTopicRepository.save(subTopic);
        return true;
    }

    private boolean ownedByCourse(Topic topic, String label, String blockId) {
        if (context.owns(topic)) {
            return true;
        }
        logger.error("{} {} já pertence a outro curso; nada foi criado em {}",
                label, blockId, context.course().getExternalId());
        return false;
    }
}
