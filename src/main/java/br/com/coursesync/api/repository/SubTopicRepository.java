package br.com.coursesync.api.repository;

import br.com.coursesync.api.model.SubTopic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SubTopicRepository extends JpaRepository<SubTopic, Long> {

    Optional<SubTopic> findByBlockId(String blockId);
}
