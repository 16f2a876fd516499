package br.com.coursesync.api.service;

import br.com.coursesync.api.dto.CourseSyncRequest;
import br.com.coursesync.api.dto.SyncResult;
import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.dto.outline.CourseOutline;
import br.com.coursesync.api.exception.ResourceNotFoundException;
import br.com.coursesync.api.model.Course;
import br.com.coursesync.api.repository.CourseRepository;
import br.com.coursesync.api.service.sync.ChangeProcessor;
import br.com.coursesync.api.service.sync.ChangeProcessorFactory;
import br.com.coursesync.api.service.sync.DiffEngine;
import br.com.coursesync.api.service.sync.StoredOutlineReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Executa um ciclo de sincronização dentro de uma única transação.
 * Deve existir no máximo um ciclo por curso ao mesmo tempo.
 */
@Service
public class CourseSyncWorker {

    private static final Logger logger = LoggerFactory.getLogger(CourseSyncWorker.class);

    private final CourseRepository courseRepository;
    private final OutlineTransformer outlineTransformer;
    private final CourseSnapshotService courseSnapshotService;
    private final DiffEngine diffEngine;
    private final ChangeProcessorFactory changeProcessorFactory;
    private final StoredOutlineReader storedOutlineReader;

    public CourseSyncWorker(CourseRepository courseRepository,
                            OutlineTransformer outlineTransformer,
                            CourseSnapshotService courseSnapshotService,
                            DiffEngine diffEngine,
                            ChangeProcessorFactory changeProcessorFactory,
                            StoredOutlineReader storedOutlineReader) {
        this.courseRepository = courseRepository;
        this.outlineTransformer = outlineTransformer;
        this.courseSnapshotService = courseSnapshotService;
        this.diffEngine = diffEngine;
        this.changeProcessorFactory = changeProcessorFactory;
        this.storedOutlineReader = storedOutlineReader;
    }

    @Transactional
    public SyncResult synchronize(String courseExternalId, CourseSyncRequest request) {
        Course course = findCourse(courseExternalId);
        CourseOutline current = toOutline(courseExternalId, request);
        CourseOutline previous = courseSnapshotService.findPrevious(courseExternalId).orElse(null);

        List<ChangeOperation> changes = diffEngine.diff(previous, current);
        if (changes.isEmpty()) {
            logger.info("Curso {} já está sincronizado", courseExternalId);
            if (previous == null) {
                courseSnapshotService.save(current);
            }
            return new SyncResult(changes, List.of());
        }

        ChangeProcessor processor = changeProcessorFactory.forCourse(course);
        List<ChangeOperation> failedChanges = processor.process(changes);

        if (failedChanges.isEmpty()) {
            courseSnapshotService.save(current);
        } else {
            // Parte do lote foi aplicada: a próxima versão anterior é o que realmente está no banco,
            // assim o próximo diff gera de novo apenas o que faltou
            courseSnapshotService.save(storedOutlineReader.read(course));
        }

        logger.info("Ciclo do curso {} concluído: {} operações, {} falhas",
                courseExternalId, changes.size(), failedChanges.size());
        return new SyncResult(changes, failedChanges);
    }

    @Transactional(readOnly = true)
    public List<ChangeOperation> preview(String courseExternalId, CourseSyncRequest request) {
        findCourse(courseExternalId);
        CourseOutline current = toOutline(courseExternalId, request);
        CourseOutline previous = courseSnapshotService.findPrevious(courseExternalId).orElse(null);
        return diffEngine.diff(previous, current);
    }

    @Transactional(readOnly = true)
    public boolean hasSnapshot(String courseExternalId) {
        return courseSnapshotService.findPrevious(courseExternalId).isPresent();
    }

    private Course findCourse(String courseExternalId) {
        return courseRepository.findByExternalId(courseExternalId)
                .orElseThrow(() -> new ResourceNotFoundException("Curso não encontrado: " + courseExternalId));
    }

    private CourseOutline toOutline(String courseExternalId, CourseSyncRequest request) {
        return outlineTransformer.transformToCourseOutline(
                request.structure(), courseExternalId, request.title(), request.courseOutline());
    }
}
