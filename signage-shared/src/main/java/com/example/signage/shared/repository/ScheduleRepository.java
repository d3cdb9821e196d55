package com.example.signage.shared.repository;

import com.example.signage.shared.model.Schedule;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScheduleRepository extends CrudRepository<Schedule, Long> {

    @Query("SELECT * FROM schedules ORDER BY priority DESC, start_time DESC, id DESC")
    List<Schedule> findAllOrderedByPriority();

    // Direct assignments plus assignments to any group the display belongs to
    @Query("SELECT * FROM schedules WHERE display_id = :displayId " +
           "OR display_group_id IN (SELECT group_id FROM display_group_members WHERE display_id = :displayId) " +
           "ORDER BY priority DESC, start_time DESC, id DESC")
    List<Schedule> findAllForDisplay(@Param("displayId") Long displayId);

    @Query("SELECT * FROM schedules WHERE is_active = TRUE AND (display_id = :displayId " +
           "OR display_group_id IN (SELECT group_id FROM display_group_members WHERE display_id = :displayId))")
    List<Schedule> findActiveCandidatesForDisplay(@Param("displayId") Long displayId);

    @Query("SELECT * FROM schedules WHERE is_active = TRUE")
    List<Schedule> findAllActive();

    @Query("SELECT * FROM schedules WHERE display_group_id = :groupId")
    List<Schedule> findByDisplayGroupId(@Param("groupId") Long groupId);

    @Query("SELECT COUNT(*) FROM schedules WHERE display_group_id = :groupId")
    long countByDisplayGroupId(@Param("groupId") Long groupId);

    @Query("SELECT COUNT(*) FROM schedules WHERE is_active = :active")
    long countByActive(@Param("active") boolean active);
}
