package br.com.coursesync.api.service.sync;

import br.com.coursesync.api.dto.outline.CourseOutline;
import br.com.coursesync.api.dto.outline.CourseStructure;
import br.com.coursesync.api.dto.outline.OutlineSubTopic;
import br.com.coursesync.api.dto.outline.OutlineTopic;
import br.com.coursesync.api.model.Course;
import br.com.coursesync.api.model.SubTopic;
import br.com.coursesync.api.model.Topic;
import br.com.coursesync.api.repository.TopicRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Monta um {@link CourseOutline} a partir do que está gravado no banco para um curso.
 * Reflete o estado real após um lote aplicado parcialmente.
 */
@Service
public class StoredOutlineReader {

    private final TopicRepository topicRepository;

    public StoredOutlineReader(TopicRepository topicRepository) {
        this.topicRepository = topicRepository;
    }

    @Transactional(readOnly = true)
    public CourseOutline read(Course course) {
        Set<String> topicIds = new LinkedHashSet<>();
        Set<String> subTopicIds = new LinkedHashSet<>();
        Map<String, String> subTopicToTopic = new LinkedHashMap<>();
        List<OutlineTopic> topics = new ArrayList<>();

        for (Topic topic : topicRepository.findByCourseOrderByIdAsc(course)) {
            List<OutlineSubTopic> subTopics = new ArrayList<>();
            for (SubTopic subTopic : topic.getSubTopics()) {
                subTopics.add(new OutlineSubTopic(subTopic.getBlockId(), subTopic.getName(), topic.getBlockId()));
                subTopicIds.add(subTopic.getBlockId());
                subTopicToTopic.put(subTopic.getBlockId(), topic.getBlockId());
            }
            topicIds.add(topic.getBlockId());
            topics.add(new OutlineTopic(topic.getBlockId(), topic.getName(), subTopics));
        }

        return new CourseOutline(course.getExternalId(), course.getName(), course.getCourseOutline(),
                new CourseStructure(topicIds, subTopicIds, subTopicToTopic), topics);
    }
}
