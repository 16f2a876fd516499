package br.com.coursesync.api.repository;

import br.com.coursesync.api.model.Course;
import br.com.coursesync.api.model.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TopicRepository extends JpaRepository<Topic, Long> {

    Optional<Topic> findByBlockId(String blockId);

    List<Topic> findByCourseOrderByIdAsc(Course course);
}
