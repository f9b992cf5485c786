package dev.gitfeed.repository;

import dev.gitfeed.domain.entity.StoredEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface StoredEventRepository extends JpaRepository<StoredEvent, Long>,
        JpaSpecificationExecutor<StoredEvent> {
}
