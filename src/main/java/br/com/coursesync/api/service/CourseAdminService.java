package br.com.coursesync.api.service;

import br.com.coursesync.api.dto.CourseDTO;
import br.com.coursesync.api.dto.CourseRequestDTO;
import br.com.coursesync.api.exception.ResourceNotFoundException;
import br.com.coursesync.api.model.AcademicClass;
import br.com.coursesync.api.model.Course;
import br.com.coursesync.api.model.ExaminationLevel;
import br.com.coursesync.api.repository.AcademicClassRepository;
import br.com.coursesync.api.repository.CourseRepository;
import br.com.coursesync.api.repository.ExaminationLevelRepository;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class CourseAdminService {

    private final CourseRepository courseRepository;
    private final ExaminationLevelRepository examinationLevelRepository;
    private final AcademicClassRepository academicClassRepository;

    public CourseAdminService(CourseRepository courseRepository,
                              ExaminationLevelRepository examinationLevelRepository,
                              AcademicClassRepository academicClassRepository) {
        this.courseRepository = courseRepository;
        this.examinationLevelRepository = examinationLevelRepository;
        this.academicClassRepository = academicClassRepository;
    }

    // O curso precisa existir antes da primeira sincronização
    @Transactional
    public CourseDTO createCourse(CourseRequestDTO dto) {
        if (courseRepository.existsByExternalId(dto.externalId())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Curso já cadastrado: " + dto.externalId());
        }

        Course course = new Course();
        course.setExternalId(dto.externalId());
        course.setName(dto.name());
        course.setCourseOutline(dto.courseOutline());
        course.setExaminationLevel(findOrCreateExaminationLevel(dto.examinationLevel()));
        course.setAcademicClass(findOrCreateAcademicClass(dto.academicClass()));
        return new CourseDTO(courseRepository.save(course));
    }

    @Transactional(readOnly = true)
    public CourseDTO findCourse(String externalId) {
        return courseRepository.findByExternalId(externalId)
                .map(CourseDTO::new)
                .orElseThrow(() -> new ResourceNotFoundException("Curso não encontrado: " + externalId));
    }

    private ExaminationLevel findOrCreateExaminationLevel(String name) {
        return examinationLevelRepository.findByName(name).orElseGet(() -> {
            ExaminationLevel level = new ExaminationLevel();
            level.setName(name);
            return examinationLevelRepository.save(level);
        });
    }

    private AcademicClass findOrCreateAcademicClass(String name) {
        return academicClassRepository.findByName(name).orElseGet(() -> {
            AcademicClass academicClass = new AcademicClass();
            academicClass.setName(name);
            return academicClassRepository.save(academicClass);
        });
    }
}
