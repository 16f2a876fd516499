package br.com.coursesync.api.repository;

import br.com.coursesync.api.model.ExaminationLevel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ExaminationLevelRepository extends JpaRepository<ExaminationLevel, Long> {
    Optional<ExaminationLevel> findByName(String name);
}
