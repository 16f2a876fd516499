package br.com.coursesync.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Último outline conhecido de um curso, usado como "versão anterior"
 * no próximo ciclo de sincronização.
 */
@Entity
@Table(name = "course_snapshots")
@Getter
@Setter
public class CourseSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "course_external_id", nullable = false, unique = true)
    private String courseExternalId;

    @Column(name = "outline_json", columnDefinition = "TEXT", nullable = false)
    private String outlineJson;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
