package com.example.signage.service.admin.mapper;

import com.example.signage.service.admin.dto.ScheduleRequest;
import com.example.signage.service.admin.dto.ScheduleResponse;
import com.example.signage.shared.model.Schedule;
import com.example.signage.shared.util.JsonUtils;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring", imports = { JsonUtils.class })
public interface ScheduleMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "contentIds", expression = "java(JsonUtils.toJsonArray(request.getContentIds()))")
    @Mapping(target = "priority", expression = "java(request.getPriority() == null ? 0 : request.getPriority())")
    @Mapping(target = "active", expression = "java(request.getIsActive() == null || request.getIsActive())")
    Schedule toSchedule(ScheduleRequest request);

    @Mapping(source = "schedule.id", target = "id")
    @Mapping(target = "contentIds", expression = "java(schedule.getContentIds() == null ? null : JsonUtils.parseIdList(schedule.getContentIds()))")
    ScheduleResponse toResponse(Schedule schedule, String displayName, String displayGroupName, List<Long> groupMemberIds);
}
