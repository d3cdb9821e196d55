package com.example.signage.shared.repository;

import com.example.signage.shared.model.Display;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface DisplayRepository extends CrudRepository<Display, Long> {

    @Query("SELECT * FROM displays ORDER BY name")
    List<Display> findAllOrderedByName();

    @Query("SELECT * FROM displays WHERE status = 'ONLINE' AND (last_seen IS NULL OR last_seen < :threshold)")
    List<Display> findStaleOnlineDisplays(@Param("threshold") OffsetDateTime threshold);

    @Query("SELECT COUNT(*) FROM displays WHERE status = :status")
    long countByStatus(@Param("status") String status);
}
