package br.com.coursesync.api.service.sync;

import br.com.coursesync.api.model.Course;
import br.com.coursesync.api.model.enums.ProcessingMode;
import br.com.coursesync.api.repository.CourseRepository;
import br.com.coursesync.api.repository.SubTopicRepository;
import br.com.coursesync.api.repository.TopicRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class ChangeProcessorFactory {

    private final CourseRepository courseRepository;
    private final TopicRepository topicRepository;
    private final SubTopicRepository subTopicRepository;
    private final ProcessingMode defaultMode;

    public ChangeProcessorFactory(CourseRepository courseRepository,
                                  TopicRepository topicRepository,
                                  SubTopicRepository subTopicRepository,
                                  @Value("${coursesync.processing.mode:BEST_EFFORT}") ProcessingMode defaultMode) {
        this.courseRepository = courseRepository;
        this.topicRepository = topicRepository;
        this.subTopicRepository = subTopicRepository;
        this.defaultMode = defaultMode;
    }

    public ChangeProcessor forCourse(Course course) {
        return forCourse(course, defaultMode);
    }

    public ChangeProcessor forCourse(Course course, ProcessingMode mode) {
        return new ChangeProcessor(CourseContext.of(course), courseRepository, topicRepository,
                subTopicRepository, mode);
    }
}
