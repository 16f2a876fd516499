package br.com.coursesync.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "courses")
@Getter
@Setter
public class Course {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Identificador estável vindo da plataforma externa (ex: "course-v1:Org+CS101+2024")
    @Column(name = "external_id", nullable = false, unique = true)
    private String externalId;

    @Column(nullable = false)
    private String name;

    @Column(name = "course_outline", columnDefinition = "TEXT")
    private String courseOutline;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "examination_level_id", nullable = false)
    private ExaminationLevel examinationLevel;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "academic_class_id", nullable = false)
    private AcademicClass academicClass;

    @OneToMany(mappedBy = "course", cascade = CascadeType.REMOVE)
    @OrderBy("id ASC")
    private List<Topic> topics = new ArrayList<>();
}
