package com.example.signage.service.admin.service;

import com.example.signage.service.admin.dto.DisplayGroupRequest;
import com.example.signage.service.admin.dto.DisplayGroupResponse;
import com.example.signage.service.admin.event.DisplayGroupMembershipChangedEvent;
import com.example.signage.service.admin.mapper.DisplayMapper;
import com.example.signage.shared.exception.ResourceConflictException;
import com.example.signage.shared.exception.ResourceNotFoundException;
import com.example.signage.shared.exception.ScheduleValidationException;
import com.example.signage.shared.model.DisplayGroup;
import com.example.signage.shared.repository.DisplayGroupRepository;
import com.example.signage.shared.repository.DisplayRepository;
import com.example.signage.shared.repository.ScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Display group CRUD and membership. Any membership change re-arms the jobs of every
 * schedule that targets the group once the change has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisplayGroupService {

    private final DisplayGroupRepository displayGroupRepository;
    private final DisplayRepository displayRepository;
    private final ScheduleRepository scheduleRepository;
    private final DisplayMapper displayMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public DisplayGroupResponse createGroup(DisplayGroupRequest request) {
        DisplayGroup group = displayMapper.toDisplayGroup(request);
        OffsetDateTime now = OffsetDateTime.now(clock);
        group.setCreatedAt(now);
        group.setUpdatedAt(now);
        DisplayGroup saved = displayGroupRepository.save(group);

        if (request.getDisplayIds() != null) {
            for (Long displayId : distinctExisting(request.getDisplayIds())) {
                displayGroupRepository.addMember(saved.getId(), displayId);
            }
        }
        log.info("Created display group {} '{}'", saved.getId(), saved.getName());
        return toResponse(saved);
    }

    @Transactional
    public DisplayGroupResponse updateGroup(Long id, DisplayGroupRequest request) {
        DisplayGroup group = findGroup(id);
        group.setName(request.getName());
        group.setDescription(request.getDescription());
        group.setUpdatedAt(OffsetDateTime.now(clock));
        DisplayGroup saved = displayGroupRepository.save(group);

        if (request.getDisplayIds() != null) {
            Set<Long> wanted = distinctExisting(request.getDisplayIds());
            Set<Long> current = new LinkedHashSet<>(displayGroupRepository.findMemberDisplayIds(id));
            if (!wanted.equals(current)) {
                displayGroupRepository.removeAllMembers(id);
                for (Long displayId : wanted) {
                    displayGroupRepository.addMember(id, displayId);
                }
                log.info("Display group {} membership replaced: {} -> {}", id, current, wanted);
                eventPublisher.publishEvent(new DisplayGroupMembershipChangedEvent(id));
            }
        }
        return toResponse(saved);
    }

    /**
     * @throws ResourceConflictException while schedules still target the group
     */
    @Transactional
    public void deleteGroup(Long id) {
        findGroup(id);
        long referencing = scheduleRepository.countByDisplayGroupId(id);
        if (referencing > 0) {
            throw new ResourceConflictException("Display group " + id + " is targeted by " + referencing
                    + " schedule(s); delete or retarget them first");
        }
        displayGroupRepository.removeAllMembers(id);
        displayGroupRepository.deleteById(id);
        log.info("Deleted display group {}", id);
    }

    @Transactional(readOnly = true)
    public DisplayGroupResponse getGroup(Long id) {
        return toResponse(findGroup(id));
    }

    @Transactional(readOnly = true)
    public List<DisplayGroupResponse> getGroups() {
        return displayGroupRepository.findAllOrderedByName().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public DisplayGroupResponse addMember(Long groupId, Long displayId) {
        DisplayGroup group = findGroup(groupId);
        if (!displayRepository.existsById(displayId)) {
            throw new ResourceNotFoundException("Display not found with ID: " + displayId);
        }
        if (displayGroupRepository.countMembership(groupId, displayId) == 0) {
            displayGroupRepository.addMember(groupId, displayId);
            log.info("Display {} joined group {}", displayId, groupId);
            eventPublisher.publishEvent(new DisplayGroupMembershipChangedEvent(groupId));
        }
        return toResponse(group);
    }

    @Transactional
    public DisplayGroupResponse removeMember(Long groupId, Long displayId) {
        DisplayGroup group = findGroup(groupId);
        if (displayGroupRepository.removeMember(groupId, displayId) > 0) {
            log.info("Display {} left group {}", displayId, groupId);
            // The departed display's jobs are found through the live keys of each schedule
            eventPublisher.publishEvent(new DisplayGroupMembershipChangedEvent(groupId));
        }
        return toResponse(group);
    }

    private DisplayGroup findGroup(Long id) {
        return displayGroupRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Display group not found with ID: " + id));
    }

    private Set<Long> distinctExisting(List<Long> displayIds) {
        Set<Long> ids = new LinkedHashSet<>();
        for (Long displayId : displayIds) {
            if (displayId == null || !displayRepository.existsById(displayId)) {
                throw new ScheduleValidationException("Display not found with ID: " + displayId);
            }
            ids.add(displayId);
        }
        return ids;
    }

    private DisplayGroupResponse toResponse(DisplayGroup group) {
        return displayMapper.toDisplayGroupResponse(group, displayGroupRepository.findMemberDisplayIds(group.getId()));
    }
}
