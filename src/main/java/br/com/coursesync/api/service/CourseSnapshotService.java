package br.com.coursesync.api.service;

import br.com.coursesync.api.dto.outline.CourseOutline;
import br.com.coursesync.api.model.CourseSnapshot;
import br.com.coursesync.api.repository.CourseSnapshotRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Guarda o último outline sincronizado de cada curso, em JSON.
 */
@Service
public class CourseSnapshotService {

    private static final Logger logger = LoggerFactory.getLogger(CourseSnapshotService.class);

    private final CourseSnapshotRepository courseSnapshotRepository;
    private final ObjectMapper objectMapper;

    public CourseSnapshotService(CourseSnapshotRepository courseSnapshotRepository, ObjectMapper objectMapper) {
        this.courseSnapshotRepository = courseSnapshotRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * @return o outline anterior, ou vazio na primeira sincronização
     */
    @Transactional(readOnly = true)
    public Optional<CourseOutline> findPrevious(String courseExternalId) {
        return courseSnapshotRepository.findByCourseExternalId(courseExternalId)
                .map(snapshot -> readOutline(snapshot.getOutlineJson()));
    }

    @Transactional
    public void save(CourseOutline outline) {
        CourseSnapshot snapshot = courseSnapshotRepository.findByCourseExternalId(outline.courseId())
                .orElseGet(() -> {
                    CourseSnapshot created = new CourseSnapshot();
                    created.setCourseExternalId(outline.courseId());
                    return created;
                });
        snapshot.setOutlineJson(writeOutline(outline));
        snapshot.setUpdatedAt(LocalDateTime.now());
        courseSnapshotRepository.save(snapshot);
        logger.debug("Snapshot do curso {} atualizado", outline.courseId());
    }

    private CourseOutline readOutline(String json) {
        try {
            return objectMapper.readValue(json, CourseOutline.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot corrompido: " + e.getOriginalMessage(), e);
        }
    }

    private String writeOutline(CourseOutline outline) {
        try {
            return objectMapper.writeValueAsString(outline);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar o outline do curso " + outline.courseId(), e);
        }
    }
}
