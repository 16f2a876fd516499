package br.com.coursesync.api.model;

import br.com.coursesync.api.model.enums.SyncStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "sync_tasks")
@Getter
@Setter
public class SyncTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "course_external_id", nullable = false)
    private String courseExternalId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SyncStatus status;

    @Column(nullable = false)
    private LocalDateTime startTime;

    @Column
    private LocalDateTime endTime;

    @Column
    private Integer totalChanges;

    @Column
    private Integer failedChanges;

    @Column(length = 255)
    private String currentLog;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    // Operações que falharam, serializadas em JSON para replay no próximo ciclo
    @Column(columnDefinition = "TEXT")
    private String failedOperations;

    public SyncTask() {
        this.totalChanges = 0;
        this.failedChanges = 0;
        this.status = SyncStatus.PENDING;
        this.startTime = LocalDateTime.now();
    }
}
