package br.com.coursesync.api.controller;

import br.com.coursesync.api.dto.CourseDTO;
import br.com.coursesync.api.dto.CourseSyncRequest;
import br.com.coursesync.api.dto.SyncTaskDTO;
import br.com.coursesync.api.exception.ChangeBatchAbortedException;
import br.com.coursesync.api.exception.ResourceNotFoundException;
import br.com.coursesync.api.dto.change.ChangeOperation;
import br.com.coursesync.api.model.enums.EntityType;
import br.com.coursesync.api.model.enums.SyncStatus;
import br.com.coursesync.api.service.CourseAdminService;
import br.com.coursesync.api.service.CourseSyncService;
import br.com.coursesync.api.service.SyncTaskService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CourseSyncController.class)
class CourseSyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CourseAdminService courseAdminService;

    @MockBean
    private CourseSyncService courseSyncService;

    @MockBean
    private SyncTaskService syncTaskService;

    @Test
    void createCourse_returnsCreatedWithLocation() throws Exception {
        when(courseAdminService.createCourse(any()))
                .thenReturn(new CourseDTO(1L, "C1", "Matemática", null, "ENEM", "3º Ano"));

        mockMvc.perform(post("/api/admin/courses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"externalId": "C1", "name": "Matemática", "examinationLevel": "ENEM", "academicClass": "3º Ano"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/admin/courses/C1"))
                .andExpect(jsonPath("$.externalId").value("C1"));
    }

    @Test
    void createCourse_missingFields_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/admin/courses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"externalId\": \"C1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(courseAdminService);
    }

    @Test
    void synchronize_unknownCourse_isNotFound() throws Exception {
        when(courseSyncService.synchronize(eq("C9"), any(CourseSyncRequest.class)))
                .thenThrow(new ResourceNotFoundException("Curso não encontrado: C9"));

        mockMvc.perform(post("/api/admin/courses/C9/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Matemática\", \"course_outline\": \"v1\", \"structure\": {}}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Curso não encontrado: C9"))
                .andExpect(jsonPath("$.path").value("/api/admin/courses/C9/sync"));
    }

    @Test
    void synchronize_strictAbort_isConflict() throws Exception {
        ChangeOperation failed = ChangeOperation.delete(EntityType.TOPIC, "T1");
        when(courseSyncService.synchronize(eq("C1"), any(CourseSyncRequest.class)))
                .thenThrow(new ChangeBatchAbortedException(failed, null));

        mockMvc.perform(post("/api/admin/courses/C1/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Matemática\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void getTask_returnsFailedOperations() throws Exception {
        ChangeOperation failed = ChangeOperation.delete(EntityType.SUBTOPIC, "S1");
        when(syncTaskService.getTask(7L)).thenReturn(new SyncTaskDTO(7L, "C1", SyncStatus.COMPLETED_WITH_FAILURES,
                LocalDateTime.now(), LocalDateTime.now(), 2, 1, "1 de 2 operações falharam", null, List.of(failed)));

        mockMvc.perform(get("/api/admin/sync-tasks/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED_WITH_FAILURES"))
                .andExpect(jsonPath("$.failedOperations[0].entityId").value("S1"));
    }
}
