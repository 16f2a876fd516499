package br.com.coursesync.api.repository;

import br.com.coursesync.api.model.AcademicClass;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AcademicClassRepository extends JpaRepository<AcademicClass, Long> {
    Optional<AcademicClass> findByName(String name);
}
