package com.example.signage.service.admin.service;

import com.example.signage.service.admin.dto.DisplayGroupRequest;
import com.example.signage.service.admin.dto.DisplayGroupResponse;
import com.example.signage.service.admin.event.DisplayGroupMembershipChangedEvent;
import com.example.signage.service.admin.mapper.DisplayMapper;
import com.example.signage.shared.exception.ResourceConflictException;
import com.example.signage.shared.exception.ResourceNotFoundException;
import com.example.signage.shared.model.DisplayGroup;
import com.example.signage.shared.repository.DisplayGroupRepository;
import com.example.signage.shared.repository.DisplayRepository;
import com.example.signage.shared.repository.ScheduleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DisplayGroupServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-10-19T08:00:00Z");

    @Mock
    private DisplayGroupRepository displayGroupRepository;
    @Mock
    private DisplayRepository displayRepository;
    @Mock
    private ScheduleRepository scheduleRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private DisplayGroupService service;
    private final DisplayGroup group = DisplayGroup.builder().id(5L).name("Floor 1").createdAt(NOW).updatedAt(NOW).build();

    @BeforeEach
    void setUp() {
        service = new DisplayGroupService(displayGroupRepository, displayRepository, scheduleRepository,
                Mappers.getMapper(DisplayMapper.class), eventPublisher, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        lenient().when(displayGroupRepository.findById(5L)).thenReturn(Optional.of(group));
        lenient().when(displayRepository.existsById(anyLong())).thenReturn(true);
    }

    @Test
    void createStoresGroupAndMembers() {
        when(displayGroupRepository.save(any(DisplayGroup.class))).thenAnswer(invocation ->
                ((DisplayGroup) invocation.getArgument(0)).withId(5L));
        when(displayGroupRepository.findMemberDisplayIds(5L)).thenReturn(List.of(10L, 11L));

        DisplayGroupResponse response = service.createGroup(DisplayGroupRequest.builder()
                .name("Floor 1")
                .displayIds(List.of(10L, 11L, 10L))
                .build());

        verify(displayGroupRepository).addMember(5L, 10L);
        verify(displayGroupRepository).addMember(5L, 11L);
        assertThat(response.getId()).isEqualTo(5L);
        assertThat(response.getDisplayIds()).containsExactly(10L, 11L);
        assertThat(response.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void addingAMemberRearmsTheGroupsSchedules() {
        when(displayGroupRepository.countMembership(5L, 12L)).thenReturn(0);

        service.addMember(5L, 12L);

        verify(displayGroupRepository).addMember(5L, 12L);
        verify(eventPublisher).publishEvent(new DisplayGroupMembershipChangedEvent(5L));
    }

    @Test
    void addingAnExistingMemberChangesNothing() {
        when(displayGroupRepository.countMembership(5L, 10L)).thenReturn(1);

        service.addMember(5L, 10L);

        verify(displayGroupRepository, never()).addMember(5L, 10L);
        verify(eventPublisher, never()).publishEvent(any(DisplayGroupMembershipChangedEvent.class));
    }

    @Test
    void addingAnUnknownDisplayIsNotFound() {
        when(displayRepository.existsById(99L)).thenReturn(false);

        assertThatThrownBy(() -> service.addMember(5L, 99L)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void removingAMemberRearmsTheGroupsSchedules() {
        when(displayGroupRepository.removeMember(5L, 10L)).thenReturn(1);

        service.removeMember(5L, 10L);

        verify(eventPublisher).publishEvent(new DisplayGroupMembershipChangedEvent(5L));
    }

    @Test
    void updateReplacesMembershipOnlyWhenItChanged() {
        when(displayGroupRepository.save(any(DisplayGroup.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(displayGroupRepository.findMemberDisplayIds(5L)).thenReturn(List.of(10L, 11L));

        service.updateGroup(5L, DisplayGroupRequest.builder().name("Floor 1").displayIds(List.of(11L, 10L)).build());
        verify(eventPublisher, never()).publishEvent(any(DisplayGroupMembershipChangedEvent.class));

        service.updateGroup(5L, DisplayGroupRequest.builder().name("Floor 1").displayIds(List.of(12L)).build());
        verify(displayGroupRepository).removeAllMembers(5L);
        verify(displayGroupRepository).addMember(5L, 12L);
        verify(eventPublisher).publishEvent(new DisplayGroupMembershipChangedEvent(5L));
    }

    @Test
    void deletingAGroupInUseIsAConflict() {
        when(scheduleRepository.countByDisplayGroupId(5L)).thenReturn(2L);

        assertThatThrownBy(() -> service.deleteGroup(5L))
                .isInstanceOf(ResourceConflictException.class)
                .hasMessageContaining("2 schedule(s)");
        verify(displayGroupRepository, never()).deleteById(5L);
    }

    @Test
    void deletingAnUnusedGroupRemovesMembersAndGroup() {
        when(scheduleRepository.countByDisplayGroupId(5L)).thenReturn(0L);

        service.deleteGroup(5L);

        verify(displayGroupRepository).removeAllMembers(5L);
        verify(displayGroupRepository).deleteById(5L);
    }
}
