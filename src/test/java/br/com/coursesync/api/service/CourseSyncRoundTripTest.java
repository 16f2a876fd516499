package br.com.coursesync.api.service;

import br.com.coursesync.api.dto.CourseRequestDTO;
import br.com.coursesync.api.dto.CourseSyncRequest;
import br.com.coursesync.api.dto.SyncResult;
import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.dto.outline.CourseOutline;
import br.com.coursesync.api.model.Course;
import br.com.coursesync.api.model.SubTopic;
import br.com.coursesync.api.model.Topic;
import br.com.coursesync.api.model.enums.EntityType;
import br.com.coursesync.api.model.enums.OperationType;
import br.com.coursesync.api.repository.CourseRepository;
import br.com.coursesync.api.repository.SubTopicRepository;
import br.com.coursesync.api.repository.TopicRepository;
import br.com.coursesync.api.service.sync.ChangeProcessorFactory;
import br.com.coursesync.api.service.sync.DiffEngine;
import br.com.coursesync.api.service.sync.OutlineFixtures;
import br.com.coursesync.api.service.sync.StoredOutlineReader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({
        DiffEngine.class,
        ChangeProcessorFactory.class,
        StoredOutlineReader.class,
        OutlineTransformer.class,
        CourseSnapshotService.class,
        CourseSyncWorker.class,
        CourseAdminService.class
})
class CourseSyncRoundTripTest {

    @Autowired
    private DiffEngine diffEngine;

    @Autowired
    private ChangeProcessorFactory changeProcessorFactory;

    @Autowired
    private StoredOutlineReader storedOutlineReader;

    @Autowired
    private CourseSyncWorker courseSyncWorker;

    @Autowired
    private CourseAdminService courseAdminService;

    @Autowired
    private CourseRepository courseRepository;

    @Autowired
    private TopicRepository topicRepository;

    @Autowired
    private SubTopicRepository subTopicRepository;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void registerCourse() {
        courseAdminService.createCourse(new CourseRequestDTO("C1", "Matemática", "v1", "ENEM", "3º Ano"));
    }

    @Test
    void applyingDiff_convergesStoreToCurrentOutline() {
        CourseOutline previous = OutlineFixtures.course("C1", "Matemática").outline("v1")
                .topic("T1", "Álgebra")
                .topic("T2", "Geometria")
                .subTopic("S1", "Equações", "T1")
                .subTopic("S2", "Polinômios", "T1")
                .subTopic("S3", "Triângulos", "T2")
                .build();
        CourseOutline current = OutlineFixtures.course("C1", "Matemática I").outline("v2")
                .topic("T1", "Álgebra I")
                .topic("T3", "Álgebra Linear")
                .subTopic("S1", "Equações", "T1")
                .subTopic("S2", "Polinômios", "T3")
                .subTopic("S4", "Inequações", "T1")
                .build();

        assertThat(changeProcessorFactory.forCourse(course()).process(diffEngine.diff(null, previous))).isEmpty();
        flushAndClear();
        assertThat(diffEngine.diff(storedOutlineReader.read(course()), previous)).isEmpty();

        List<ChangeOperation> failed = changeProcessorFactory.forCourse(course()).process(diffEngine.diff(previous, current));
        flushAndClear();

        assertThat(failed).isEmpty();
        assertThat(diffEngine.diff(storedOutlineReader.read(course()), current)).isEmpty();
        assertThat(topicRepository.findByBlockId("T2")).isEmpty();
        assertThat(subTopicRepository.findByBlockId("S3")).isEmpty();
        assertThat(subTopicRepository.findByBlockId("S2")).get()
                .extracting(subTopic -> subTopic.getTopic().getBlockId())
                .isEqualTo("T3");
    }

    @Test
    void deletingTopic_cascadesToItsSubTopics() {
        CourseOutline outline = OutlineFixtures.course("C1", "Matemática").outline("v1")
                .topic("T1", "Álgebra")
                .subTopic("S1", "Equações", "T1")
                .subTopic("S2", "Polinômios", "T1")
                .build();
        changeProcessorFactory.forCourse(course()).process(diffEngine.diff(null, outline));
        flushAndClear();

        List<ChangeOperation> failed = changeProcessorFactory.forCourse(course())
                .process(List.of(ChangeOperation.delete(EntityType.TOPIC, "T1")));
        flushAndClear();

        assertThat(failed).isEmpty();
        assertThat(subTopicRepository.count()).isZero();
    }

    @Test
    void worker_firstSyncThenResync_isIdempotent() throws IOException {
        CourseSyncRequest request = new CourseSyncRequest("Matemática Básica", "Ementa", fixture());

        SyncResult first = courseSyncWorker.synchronize("C1", request);
        flushAndClear();

        assertThat(first.failedChanges()).isEmpty();
        assertThat(first.changes()).extracting(ChangeOperation::operation).containsOnly(OperationType.CREATE);
        assertThat(first.changes()).hasSize(6);
        assertThat(topicRepository.findByCourseOrderByIdAsc(course())).extracting(Topic::getBlockId)
                .containsExactly("chapter-algebra", "chapter-geometry", "chapter-stats");

        SyncResult second = courseSyncWorker.synchronize("C1", request);
        assertThat(second.changes()).isEmpty();
    }

    @Test
    void worker_appliesCourseFieldsFromPayload() throws IOException {
        courseSyncWorker.synchronize("C1", new CourseSyncRequest("Matemática", "v1", fixture()));
        flushAndClear();

        SyncResult result = courseSyncWorker.synchronize("C1", new CourseSyncRequest("Matemática Básica", "v2", fixture()));
        flushAndClear();

        assertThat(result.changes()).extracting(ChangeOperation::describe).containsExactly("UPDATE COURSE C1");
        Course course = course();
        assertThat(course.getName()).isEqualTo("Matemática Básica");
        assertThat(course.getCourseOutline()).isEqualTo("v2");
    }

    @Test
    void worker_afterPartialFailure_nextCycleReplaysMissingOperations() throws IOException {
        JsonNode payload = fixture();
        courseSyncWorker.synchronize("C1", new CourseSyncRequest("Matemática", "v1", payload));
        flushAndClear();

        // Alguém removeu o tópico direto no banco, fora da sincronização
        changeProcessorFactory.forCourse(course()).process(List.of(ChangeOperation.delete(EntityType.TOPIC, "chapter-algebra")));
        flushAndClear();

        JsonNode renamed = payload.deepCopy();
        ArrayNode chapters = (ArrayNode) renamed.path("course_structure").path("child_info").path("children");
        ((ObjectNode) chapters.get(0)).put("display_name", "Álgebra I");

        SyncResult partial = courseSyncWorker.synchronize("C1", new CourseSyncRequest("Matemática", "v1", renamed));
        flushAndClear();

        assertThat(partial.failedChanges()).extracting(ChangeOperation::describe)
                .containsExactly("UPDATE TOPIC chapter-algebra");

        SyncResult replay = courseSyncWorker.synchronize("C1", new CourseSyncRequest("Matemática", "v1", renamed));
        flushAndClear();

        assertThat(replay.failedChanges()).isEmpty();
        assertThat(replay.changes()).extracting(ChangeOperation::describe).containsExactly(
                "CREATE TOPIC chapter-algebra",
                "CREATE SUBTOPIC seq-linear",
                "CREATE SUBTOPIC seq-quadratic");
        assertThat(topicRepository.findByBlockId("chapter-algebra")).get()
                .extracting(Topic::getName)
                .isEqualTo("Álgebra I");
        assertThat(subTopicRepository.findByBlockId("seq-linear")).get()
                .extracting(SubTopic::getName)
                .isEqualTo("Equações Lineares");
    }

    @Test
    void worker_topicsOwnedByAnotherCourse_areNotTakenOver() throws IOException {
        courseAdminService.createCourse(new CourseRequestDTO("C2", "Matemática II", "v1", "ENEM", "3º Ano"));
        JsonNode payload = fixture();
        courseSyncWorker.synchronize("C1", new CourseSyncRequest("Matemática", "v1", payload));
        flushAndClear();

        SyncResult second = courseSyncWorker.synchronize("C2", new CourseSyncRequest("Matemática II", "v1", payload));
        flushAndClear();

        assertThat(second.failedChanges()).containsExactlyElementsOf(second.changes()).hasSize(6);
        Course other = courseRepository.findByExternalId("C2").orElseThrow();
        assertThat(topicRepository.findByCourseOrderByIdAsc(other)).isEmpty();
        assertThat(topicRepository.findByCourseOrderByIdAsc(course())).hasSize(3);
        assertThat(courseSyncWorker.preview("C2", new CourseSyncRequest("Matemática II", "v1", payload))).hasSize(6);
    }

    private Course course() {
        return courseRepository.findByExternalId("C1").orElseThrow();
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    private JsonNode fixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/course-structure.json")) {
            return objectMapper.readTree(in);
        }
    }
}
