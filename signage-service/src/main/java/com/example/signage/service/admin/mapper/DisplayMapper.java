package com.example.signage.service.admin.mapper;

import com.example.signage.service.admin.dto.DisplayGroupRequest;
import com.example.signage.service.admin.dto.DisplayGroupResponse;
import com.example.signage.service.admin.dto.DisplayResponse;
import com.example.signage.shared.model.Display;
import com.example.signage.shared.model.DisplayGroup;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface DisplayMapper {

    @Mapping(source = "display.id", target = "id")
    DisplayResponse toDisplayResponse(Display display, List<Long> groupIds);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    DisplayGroup toDisplayGroup(DisplayGroupRequest request);

    @Mapping(source = "group.id", target = "id")
    DisplayGroupResponse toDisplayGroupResponse(DisplayGroup group, List<Long> displayIds);
}
