package br.com.coursesync.api.service;

import br.com.coursesync.api.dto.CourseRequestDTO;
import br.com.coursesync.api.dto.CourseSyncRequest;
import br.com.coursesync.api.dto.outline.OutlineTopic;
import br.com.coursesync.api.exception.ChangeBatchAbortedException;
import br.com.coursesync.api.model.SyncTask;
import br.com.coursesync.api.model.Topic;
import br.com.coursesync.api.model.enums.SyncStatus;
import br.com.coursesync.api.repository.SyncTaskRepository;
import br.com.coursesync.api.repository.TopicRepository;
import br.com.coursesync.api.service.sync.ChangeProcessorFactory;
import br.com.coursesync.api.service.sync.DiffEngine;
import br.com.coursesync.api.service.sync.StorageRetryTemplate;
import br.com.coursesync.api.service.sync.StoredOutlineReader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// Sem transação de teste, para que o rollback do ciclo seja o que fica no banco
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@TestPropertySource(properties = "coursesync.processing.mode=STRICT")
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({
        DiffEngine.class,
        ChangeProcessorFactory.class,
        StorageRetryTemplate.class,
        StoredOutlineReader.class,
        OutlineTransformer.class,
        CourseSnapshotService.class,
        CourseSyncWorker.class,
        CourseAdminService.class,
        SyncTaskService.class,
        CourseSyncService.class
})
class CourseSyncStrictModeTest {

    @Autowired
    private CourseSyncService courseSyncService;

    @Autowired
    private CourseAdminService courseAdminService;

    @Autowired
    private CourseSnapshotService courseSnapshotService;

    @Autowired
    private TopicRepository topicRepository;

    @Autowired
    private SyncTaskRepository syncTaskRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @AfterEach
    void cleanDatabase() {
        jdbcTemplate.update("DELETE FROM sub_topics");
        jdbcTemplate.update("DELETE FROM topics");
        jdbcTemplate.update("DELETE FROM course_snapshots");
        jdbcTemplate.update("DELETE FROM sync_tasks");
        jdbcTemplate.update("DELETE FROM courses");
        jdbcTemplate.update("DELETE FROM examination_levels");
        jdbcTemplate.update("DELETE FROM academic_classes");
    }

    @Test
    void failureMidBatch_rollsBackAppliedOperationsAndKeepsSnapshot() throws IOException {
        courseAdminService.createCourse(new CourseRequestDTO("C1", "Matemática", "v1", "ENEM", "3º Ano"));
        JsonNode payload = fixture();
        courseSyncService.synchronize("C1", new CourseSyncRequest("Matemática", "v1", payload));

        // Tópico removido fora da sincronização: a segunda operação do lote vai falhar
        jdbcTemplate.update("DELETE FROM topics WHERE block_id = ?", "chapter-geometry");

        JsonNode renamed = payload.deepCopy();
        ArrayNode chapters = (ArrayNode) renamed.path("course_structure").path("child_info").path("children");
        ((ObjectNode) chapters.get(0)).put("display_name", "Álgebra I");
        ((ObjectNode) chapters.get(1)).put("display_name", "Geometria Plana");

        assertThatThrownBy(() -> courseSyncService.synchronize("C1", new CourseSyncRequest("Matemática", "v1", renamed)))
                .isInstanceOf(ChangeBatchAbortedException.class)
                .satisfies(e -> assertThat(((ChangeBatchAbortedException) e).getFailedChange().describe())
                        .isEqualTo("UPDATE TOPIC chapter-geometry"));

        // A primeira operação (UPDATE TOPIC chapter-algebra) foi desfeita
        assertThat(topicRepository.findByBlockId("chapter-algebra")).get()
                .extracting(Topic::getName)
                .isEqualTo("Álgebra");
        assertThat(courseSnapshotService.findPrevious("C1")).get()
                .satisfies(outline -> assertThat(outline.findTopic("chapter-algebra"))
                        .get()
                        .extracting(OutlineTopic::name)
                        .isEqualTo("Álgebra"));

        SyncTask lastTask = syncTaskRepository.findAll().stream()
                .max(Comparator.comparing(SyncTask::getId))
                .orElseThrow();
        assertThat(lastTask.getStatus()).isEqualTo(SyncStatus.FAILED);
    }

    private JsonNode fixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/course-structure.json")) {
            return objectMapper.readTree(in);
        }
    }
}
