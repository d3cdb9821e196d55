package com.example.signage.shared.repository;

import com.example.signage.shared.model.DisplayGroup;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DisplayGroupRepository extends CrudRepository<DisplayGroup, Long> {

    @Query("SELECT * FROM display_groups ORDER BY name")
    List<DisplayGroup> findAllOrderedByName();

    @Query("SELECT display_id FROM display_group_members WHERE group_id = :groupId ORDER BY display_id")
    List<Long> findMemberDisplayIds(@Param("groupId") Long groupId);

    @Query("SELECT group_id FROM display_group_members WHERE display_id = :displayId ORDER BY group_id")
    List<Long> findGroupIdsByDisplayId(@Param("displayId") Long displayId);

    @Query("SELECT COUNT(*) FROM display_group_members WHERE group_id = :groupId AND display_id = :displayId")
    int countMembership(@Param("groupId") Long groupId, @Param("displayId") Long displayId);

    @Modifying
    @Query("INSERT INTO display_group_members (group_id, display_id) VALUES (:groupId, :displayId)")
    int addMember(@Param("groupId") Long groupId, @Param("displayId") Long displayId);

    @Modifying
    @Query("DELETE FROM display_group_members WHERE group_id = :groupId AND display_id = :displayId")
    int removeMember(@Param("groupId") Long groupId, @Param("displayId") Long displayId);

    @Modifying
    @Query("DELETE FROM display_group_members WHERE group_id = :groupId")
    int removeAllMembers(@Param("groupId") Long groupId);
}
