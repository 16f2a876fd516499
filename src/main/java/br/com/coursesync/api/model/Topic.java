package br.com.coursesync.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "topics")
@Getter
@Setter
public class Topic {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "block_id", nullable = false, unique = true)
    private String blockId;

    @Column(nullable = false)
    private String name; // Ex: "Álgebra"

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "examination_level_id", nullable = false)
    private ExaminationLevel examinationLevel;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "academic_class_id", nullable = false)
    private AcademicClass academicClass;

    // Remover um tópico remove também os seus subtópicos.
    // Sem orphanRemoval: um subtópico pode trocar de tópico sem ser apagado.
    @OneToMany(mappedBy = "topic", cascade = CascadeType.REMOVE)
    @OrderBy("id ASC")
    private List<SubTopic> subTopics = new ArrayList<>();

    public void addSubTopic(SubTopic subTopic) {
        subTopics.add(subTopic);
        subTopic.setTopic(this);
    }

    public void removeSubTopic(SubTopic subTopic) {
        subTopics.remove(subTopic);
    }
}
