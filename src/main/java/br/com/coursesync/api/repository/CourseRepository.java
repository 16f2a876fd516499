package br.com.coursesync.api.repository;

import br.com.coursesync.api.model.Course;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CourseRepository extends JpaRepository<Course, Long> {

    /**
     * Busca um curso pelo identificador da plataforma externa.
     * @param externalId O id externo (ex: "course-v1:Org+CS101+2024").
     * @return um Optional contendo o Course se encontrado.
     */
    Optional<Course> findByExternalId(String externalId);

    boolean existsByExternalId(String externalId);
}
