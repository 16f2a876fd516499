package br.com.coursesync.api.repository;

import br.com.coursesync.api.model.CourseSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CourseSnapshotRepository extends JpaRepository<CourseSnapshot, Long> {

    Optional<CourseSnapshot> findByCourseExternalId(String courseExternalId);
}
