package br.com.coursesync.api.controller;

import br.com.coursesync.api.dto.CourseDTO;
import br.com.coursesync.api.dto.CourseRequestDTO;
import br.com.coursesync.api.dto.CourseSyncRequest;
import br.com.coursesync.api.dto.SyncPreviewDTO;
import br.com.coursesync.api.dto.SyncTaskDTO;
import br.com.coursesync.api.service.CourseAdminService;
import br.com.coursesync.api.service.CourseSyncService;
import br.com.coursesync.api.service.SyncTaskService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/api/admin")
public class CourseSyncController {

    private static final Logger logger = LoggerFactory.getLogger(CourseSyncController.class);

    private final CourseAdminService courseAdminService;
    private final CourseSyncService courseSyncService;
    private final SyncTaskService syncTaskService;

    public CourseSyncController(CourseAdminService courseAdminService,
                                CourseSyncService courseSyncService,
                                SyncTaskService syncTaskService) {
        this.courseAdminService = courseAdminService;
        this.courseSyncService = courseSyncService;
        this.syncTaskService = syncTaskService;
    }

    // === Cursos ===

    @PostMapping("/courses")
    public ResponseEntity<CourseDTO> createCourse(@Valid @RequestBody CourseRequestDTO dto) {
        CourseDTO created = courseAdminService.createCourse(dto);
        return ResponseEntity.created(URI.create("/api/admin/courses/" + created.externalId())).body(created);
    }

    @GetMapping("/courses/{courseId}")
    public ResponseEntity<CourseDTO> getCourse(@PathVariable String courseId) {
        return ResponseEntity.ok(courseAdminService.findCourse(courseId));
    }

    // === Sincronização ===

    @PostMapping("/courses/{courseId}/sync")
    public ResponseEntity<SyncTaskDTO> synchronize(@PathVariable String courseId,
                                                   @Valid @RequestBody CourseSyncRequest request) {
        logger.info("Sincronização solicitada para o curso {}", courseId);
        return ResponseEntity.ok(courseSyncService.synchronize(courseId, request));
    }

    // Dry-run: calcula o diff sem gravar nada
    @PostMapping("/courses/{courseId}/sync/preview")
    public ResponseEntity<SyncPreviewDTO> preview(@PathVariable String courseId,
                                                 @Valid @RequestBody CourseSyncRequest request) {
        return ResponseEntity.ok(courseSyncService.preview(courseId, request));
    }

    @GetMapping("/sync-tasks/{taskId}")
    public ResponseEntity<SyncTaskDTO> getTask(@PathVariable Long taskId) {
        return ResponseEntity.ok(syncTaskService.getTask(taskId));
    }
}
