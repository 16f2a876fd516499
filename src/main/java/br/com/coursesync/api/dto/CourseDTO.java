package br.com.coursesync.api.dto;

import br.com.coursesync.api.model.Course;

public record CourseDTO(
        Long id,
        String externalId,
        String name,
        String courseOutline,
        String examinationLevel,
        String academicClass
) {
    public CourseDTO(Course course) {
        this(
                course.getId(),
                course.getExternalId(),
                course.getName(),
                course.getCourseOutline(),
                course.getExaminationLevel().getName(),
                course.getAcademicClass().getName()
        );
    }
}
