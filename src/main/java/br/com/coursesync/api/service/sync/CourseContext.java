package br.com.coursesync.api.service.sync;

import br.com.coursesync.api.model.AcademicClass;
import br.com.coursesync.api.model.Course;
import br.com.coursesync.api.model.ExaminationLevel;
import br.com.coursesync.api.model.Topic;

// Dados do curso dono necessários para satisfazer as FKs de novos tópicos
public record CourseContext(
        Course course,
        ExaminationLevel examinationLevel,
        AcademicClass academicClass
) {
    public static CourseContext of(Course course) {
        return new CourseContext(course, course.getExaminationLevel(), course.getAcademicClass());
    }

    // O block id é único no banco inteiro, então um tópico pode já existir em outro curso
    public boolean owns(Topic topic) {
        Course owner = topic.getCourse();
        if (owner == null) {
            return false;
        }
        return owner == course || (owner.getId() != null && owner.getId().equals(course.getId()));
    }
}
