package com.my.weatherbot.adapter.in.scheduler;

import com.my.weatherbot.domain.model.DispatchReport;
import com.my.weatherbot.domain.model.FiringEvent;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.port.in.DetectFiringsUseCase;
import com.my.weatherbot.domain.port.in.DispatchNotificationUseCase;
import com.my.weatherbot.domain.port.out.ClockPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationTickLoopTest {

    private DetectFiringsUseCase detect;
    private DispatchNotificationUseCase dispatch;
    private ClockPort clock;
    private ExecutorService dispatchPool;
    private DeliveryWorkerPool workerPool;
    private NotificationTickLoop loop;

    @BeforeEach
    void setUp() {
        detect = mock(DetectFiringsUseCase.class);
        dispatch = mock(DispatchNotificationUseCase.class);
        clock = mock(ClockPort.class);
        when(detect.tick(any())).thenReturn(List.of());
        dispatchPool = Executors.newSingleThreadExecutor();
        workerPool = new DeliveryWorkerPool(1);
        loop = new NotificationTickLoop(detect, dispatch, clock, workerPool, dispatchPool, 15, 5, 1);
    }

    @AfterEach
    void tearDown() {
        dispatchPool.shutdownNow();
        workerPool.drain(0);
    }

    @Test
    void firstTickEvaluatesOnlyCurrentMinute() {
        when(clock.now()).thenReturn(at("08:00:20"));

        loop.runTick();

        verify(detect).tick(at("08:00:00"));
        assertThat(loop.lastTickAt()).isEqualTo(at("08:00:20"));
    }

    @Test
    void sameMinuteIsNotEvaluatedTwice() {
        when(clock.now()).thenReturn(at("08:00:05"), at("08:00:20"), at("08:00:35"));

        loop.runTick();
        loop.runTick();
        loop.runTick();

        verify(detect, times(1)).tick(any());
    }

    @Test
    void missedMinutesAreCaughtUp() {
        when(clock.now()).thenReturn(at("08:00:10"), at("08:03:05"));

        loop.runTick();
        loop.runTick();

        ArgumentCaptor<OffsetDateTime> minutes = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(detect, times(4)).tick(minutes.capture());
        assertThat(minutes.getAllValues()).containsExactly(
                at("08:00:00"), at("08:01:00"), at("08:02:00"), at("08:03:00"));
    }

    @Test
    void catchUpIsBoundedAfterLongPause() {
        when(clock.now()).thenReturn(at("08:00:10"), at("09:00:10"));

        loop.runTick();
        loop.runTick();

        ArgumentCaptor<OffsetDateTime> minutes = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(detect, times(7)).tick(minutes.capture());
        assertThat(minutes.getAllValues().subList(1, 7)).containsExactly(
                at("08:55:00"), at("08:56:00"), at("08:57:00"), at("08:58:00"), at("08:59:00"), at("09:00:00"));
    }

    @Test
    void clockGoingBackwardsFiresNothing() {
        when(clock.now()).thenReturn(at("08:05:00"), at("08:02:00"));

        loop.runTick();
        loop.runTick();

        verify(detect, times(1)).tick(any());
    }

    @Test
    void firedEventsAreDispatchedOffTheTickThread() {
        FiringEvent event = new FiringEvent(JobType.DAILY_WEATHER, at("08:00:00"));
        when(clock.now()).thenReturn(at("08:00:01"));
        when(detect.tick(at("08:00:00"))).thenReturn(List.of(event));
        when(dispatch.dispatch(event)).thenReturn(DispatchReport.completed(event, List.of()));

        List<FiringEvent> submitted = loop.runTick();

        assertThat(submitted).containsExactly(event);
        verify(detect).acknowledge(event);
        verify(dispatch, timeout(2000)).dispatch(event);
    }

    @Test
    void detectionErrorStillAdvancesToNextMinute() {
        FiringEvent event = new FiringEvent(JobType.DAILY_WEATHER, at("08:01:00"));
        when(clock.now()).thenReturn(at("08:00:01"), at("08:01:01"));
        when(detect.tick(at("08:00:00"))).thenThrow(new IllegalStateException("boom"));
        when(detect.tick(at("08:01:00"))).thenReturn(List.of(event));
        when(dispatch.dispatch(event)).thenReturn(DispatchReport.completed(event, List.of()));

        loop.runTick();
        List<FiringEvent> submitted = loop.runTick();

        assertThat(submitted).containsExactly(event);
        verify(detect, times(1)).tick(at("08:00:00"));
    }

    @Test
    void acknowledgeFailureDoesNotUndoSubmission() {
        FiringEvent event = new FiringEvent(JobType.TYPHOON_WATCH, at("08:00:00"), "TY-2026-05-03");
        when(clock.now()).thenReturn(at("08:00:01"));
        when(detect.tick(at("08:00:00"))).thenReturn(List.of(event));
        doThrow(new IllegalStateException("db locked")).when(detect).acknowledge(event);
        when(dispatch.dispatch(event)).thenReturn(DispatchReport.completed(event, List.of()));

        List<FiringEvent> submitted = loop.runTick();

        assertThat(submitted).containsExactly(event);
        verify(dispatch, timeout(2000)).dispatch(event);
    }

    @Test
    void dispatchFailureDoesNotStopLaterTicks() {
        FiringEvent first = new FiringEvent(JobType.DAILY_WEATHER, at("08:00:00"));
        FiringEvent second = new FiringEvent(JobType.TYPHOON_WATCH, at("08:01:00"));
        when(clock.now()).thenReturn(at("08:00:01"), at("08:01:01"));
        when(detect.tick(at("08:00:00"))).thenReturn(List.of(first));
        when(detect.tick(at("08:01:00"))).thenReturn(List.of(second));
        when(dispatch.dispatch(first)).thenThrow(new IllegalStateException("boom"));
        when(dispatch.dispatch(second)).thenReturn(DispatchReport.completed(second, List.of()));

        loop.runTick();
        loop.runTick();

        verify(dispatch, timeout(2000)).dispatch(second);
    }

    @Test
    void stoppedLoopAcceptsNoNewDispatches() {
        FiringEvent event = new FiringEvent(JobType.DAILY_WEATHER, at("08:00:00"));
        when(clock.now()).thenReturn(at("08:00:01"));
        when(detect.tick(any())).thenReturn(List.of(event));

        loop.stop();
        List<FiringEvent> submitted = loop.runTick();

        assertThat(loop.isRunning()).isFalse();
        assertThat(submitted).isEmpty();
        verify(detect, never()).acknowledge(any());
        verify(dispatch, never()).dispatch(any());
        assertThat(workerPool.workers().isShutdown()).isTrue();
    }

    private static OffsetDateTime at(String localTime) {
        return OffsetDateTime.parse("2026-07-03T" + localTime + "+08:00");
    }
}
