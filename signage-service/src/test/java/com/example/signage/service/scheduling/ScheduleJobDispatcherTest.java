package com.example.signage.service.scheduling;

import com.example.signage.shared.model.Schedule;
import com.example.signage.shared.repository.DisplayGroupRepository;
import com.example.signage.shared.repository.ScheduleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleJobDispatcherTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-10-19T08:00:00Z");

    @Mock
    private JobScheduler jobScheduler;
    @Mock
    private ScheduleRepository scheduleRepository;
    @Mock
    private DisplayGroupRepository displayGroupRepository;

    private ScheduleJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ScheduleJobDispatcher(jobScheduler, scheduleRepository, displayGroupRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    private static Schedule.ScheduleBuilder displaySchedule() {
        return Schedule.builder()
                .id(1L)
                .displayId(10L)
                .contentId(100L)
                .startTime(NOW.plusHours(1));
    }

    @Test
    void armsOneShotJobForADisplayTarget() {
        int displays = dispatcher.arm(displaySchedule().build());

        assertThat(displays).isEqualTo(1);
        verify(jobScheduler).scheduleOnce("1-10", Duration.ofHours(1),
                new ScheduleJobPayload(1L, 10L, 100L, null, null));
        verify(jobScheduler, never()).scheduleRepeating(anyString(), anyString(), any(), any(), any());
    }

    @Test
    void pastStartFiresImmediately() {
        dispatcher.arm(displaySchedule().startTime(NOW.minusHours(2)).build());

        verify(jobScheduler).scheduleOnce(eq("1-10"), eq(Duration.ZERO), any());
    }

    @Test
    void recurringScheduleAlsoGetsARepeatingJob() {
        OffsetDateTime end = NOW.plusDays(30);
        Schedule schedule = displaySchedule().recurrenceRule("0 9 * * 1-5").endTime(end).build();

        dispatcher.arm(schedule);

        ScheduleJobPayload payload = new ScheduleJobPayload(1L, 10L, 100L, null, null);
        verify(jobScheduler).scheduleOnce("1-10", Duration.ofHours(1), payload);
        verify(jobScheduler).scheduleRepeating("1-10-recurring", "0 9 * * 1-5", NOW.plusHours(1), end, payload);
    }

    @Test
    void groupTargetExpandsToEveryMember() {
        Schedule schedule = Schedule.builder()
                .id(2L)
                .displayGroupId(5L)
                .contentIds("[7,8]")
                .startTime(NOW)
                .build();
        when(displayGroupRepository.existsById(5L)).thenReturn(true);
        when(displayGroupRepository.findMemberDisplayIds(5L)).thenReturn(List.of(10L, 11L, 12L));

        int displays = dispatcher.arm(schedule);

        assertThat(displays).isEqualTo(3);
        verify(jobScheduler).scheduleOnce("2-10", Duration.ZERO, new ScheduleJobPayload(2L, 10L, null, List.of(7L, 8L), null));
        verify(jobScheduler).scheduleOnce("2-11", Duration.ZERO, new ScheduleJobPayload(2L, 11L, null, List.of(7L, 8L), null));
        verify(jobScheduler).scheduleOnce("2-12", Duration.ZERO, new ScheduleJobPayload(2L, 12L, null, List.of(7L, 8L), null));
    }

    @Test
    void missingGroupSkipsJobCreation() {
        Schedule schedule = Schedule.builder().id(2L).displayGroupId(5L).contentId(1L).startTime(NOW).build();
        when(displayGroupRepository.existsById(5L)).thenReturn(false);

        assertThat(dispatcher.arm(schedule)).isZero();
        verifyNoInteractions(jobScheduler);
    }

    @Test
    void inactiveAndExpiredSchedulesAreNotArmed() {
        assertThat(dispatcher.arm(displaySchedule().active(false).build())).isZero();
        assertThat(dispatcher.arm(displaySchedule().startTime(NOW.minusDays(2)).endTime(NOW.minusDays(1)).build())).isZero();

        verifyNoInteractions(jobScheduler);
    }

    @Test
    void cancelCoversCurrentTargetsAndLeftoverKeys() {
        Schedule schedule = Schedule.builder().id(2L).displayGroupId(5L).contentId(1L).startTime(NOW).build();
        when(displayGroupRepository.existsById(5L)).thenReturn(true);
        when(displayGroupRepository.findMemberDisplayIds(5L)).thenReturn(List.of(10L));
        // 2-99 belongs to a display that has since left the group; 21-10 is another schedule
        when(jobScheduler.liveJobKeys()).thenReturn(Set.of("2-10", "2-99", "2-99-recurring", "21-10"));
        when(jobScheduler.cancel(anyString())).thenReturn(true);

        int cancelled = dispatcher.cancel(schedule);

        assertThat(cancelled).isEqualTo(4);
        verify(jobScheduler).cancel("2-10");
        verify(jobScheduler).cancel("2-10-recurring");
        verify(jobScheduler).cancel("2-99");
        verify(jobScheduler).cancel("2-99-recurring");
        verify(jobScheduler, never()).cancel("21-10");
    }

    @Test
    void rearmCancelsTheOldTargetBeforeArmingTheNewOne() {
        Schedule previous = displaySchedule().build();
        Schedule current = displaySchedule().displayId(11L).build();
        when(jobScheduler.liveJobKeys()).thenReturn(Set.of());

        dispatcher.rearm(previous, current);

        InOrder inOrder = inOrder(jobScheduler);
        inOrder.verify(jobScheduler).cancel("1-10");
        inOrder.verify(jobScheduler).cancel("1-10-recurring");
        inOrder.verify(jobScheduler).scheduleOnce(eq("1-11"), any(), any());
    }

    @Test
    void armAllContinuesPastAFailingSchedule() {
        Schedule bad = displaySchedule().id(1L).recurrenceRule("0 9 * * *").build();
        Schedule good = displaySchedule().id(2L).build();
        when(scheduleRepository.findAllActive()).thenReturn(List.of(bad, good));
        doThrow(new IllegalStateException("boom")).when(jobScheduler)
                .scheduleRepeating(eq("1-10-recurring"), anyString(), any(), any(), any());

        int armed = dispatcher.armAll();

        assertThat(armed).isEqualTo(1);
        verify(jobScheduler).scheduleOnce(eq("2-10"), any(), any());
    }

    @Test
    void reconcileGroupRearmsEveryTargetingSchedule() {
        Schedule schedule = Schedule.builder().id(3L).displayGroupId(5L).contentId(1L).startTime(NOW).build();
        when(scheduleRepository.findByDisplayGroupId(5L)).thenReturn(List.of(schedule));
        when(displayGroupRepository.existsById(5L)).thenReturn(true);
        when(displayGroupRepository.findMemberDisplayIds(5L)).thenReturn(List.of(10L, 11L));
        when(jobScheduler.liveJobKeys()).thenReturn(Set.of());

        dispatcher.reconcileGroup(5L);

        verify(jobScheduler).cancel("3-10");
        verify(jobScheduler).cancel("3-11");
        verify(jobScheduler).scheduleOnce(eq("3-10"), any(), any());
        verify(jobScheduler).scheduleOnce(eq("3-11"), any(), any());
    }
}
