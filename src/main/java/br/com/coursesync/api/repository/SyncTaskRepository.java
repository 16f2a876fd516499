package br.com.coursesync.api.repository;

import br.com.coursesync.api.model.SyncTask;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncTaskRepository extends JpaRepository<SyncTask, Long> {
    // Spring Data JPA cuida de tudo
}
