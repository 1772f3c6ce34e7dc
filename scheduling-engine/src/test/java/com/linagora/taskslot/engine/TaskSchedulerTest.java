/********************************************************************
 *  As a subpart of Twake Mail, this file is edited by Linagora.    *
 *                                                                  *
 *  https://twake-mail.com/                                         *
 *  https://linagora.com                                            *
 *                                                                  *
 *  This file is subject to The Affero Gnu Public License           *
 *  version 3.                                                      *
 *                                                                  *
 *  https://www.gnu.org/licenses/agpl-3.0.en.html                   *
 *                                                                  *
 *  This program is distributed in the hope that it will be         *
 *  useful, but WITHOUT ANY WARRANTY; without even the implied      *
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR         *
 *  PURPOSE. See the GNU Affero General Public License for          *
 *  more details.                                                   *
 ********************************************************************/

package com.linagora.taskslot.engine;

import static com.linagora.taskslot.engine.SchedulingEngineFixture.MONDAY_MORNING;
import static com.linagora.taskslot.engine.SchedulingEngineFixture.NOW;
import static com.linagora.taskslot.engine.SchedulingEngineFixture.PRIMARY;
import static com.linagora.taskslot.engine.SchedulingEngineFixture.TUESDAY_MORNING;
import static com.linagora.taskslot.engine.SchedulingEngineFixture.slot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.google.common.base.Strings;
import com.linagora.taskslot.engine.CalendarService.CalendarEntry;
import com.linagora.taskslot.engine.CalendarService.NewCalendarEntry;
import com.linagora.taskslot.engine.TaskScheduler.ScheduleTaskRequest;
import com.linagora.taskslot.engine.TaskScheduler.SessionRequest;
import com.linagora.taskslot.storage.MemoryManagedEventDAO;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.Priority;
import com.linagora.taskslot.storage.model.SchedulingWindow;
import com.linagora.taskslot.storage.model.TaskId;
import com.linagora.taskslot.storage.model.WindowTier;

import reactor.core.publisher.Mono;

class TaskSchedulerTest {
    private static final Duration HALF_HOUR = Duration.ofMinutes(30);
    private static final Duration ONE_HOUR = Duration.ofMinutes(60);
    private static final Instant WEDNESDAY_NOON = Instant.parse("2026-02-25T12:00:00Z");
    private static final SchedulingWindow MONDAY_WORKDAY = SchedulingWindow.active("Monday", DayOfWeek.MONDAY, "09:00", "17:00", WindowTier.ALL);
    private static final TaskId TASK = new TaskId("task-42");

    private static ScheduleTaskRequest request(Optional<Duration> duration, Priority priority, Optional<Instant> deadline) {
        return new ScheduleTaskRequest(TASK, "Review the supplier contract", "Legal", duration, priority, deadline,
            "Contract renewal is due", "Read and sign", false);
    }

    private static ScheduleTaskRequest request(Priority priority) {
        return request(Optional.of(HALF_HOUR), priority, Optional.of(WEDNESDAY_NOON));
    }

    private static SchedulingConfiguration withLeaseMaxWait(Duration leaseMaxWait) {
        SchedulingConfiguration defaults = SchedulingConfiguration.DEFAULT;
        return new SchedulingConfiguration(defaults.zoneId(), defaults.granularity(), defaults.searchHorizon(),
            defaults.relocationHorizon(), defaults.criticalFallbackHorizon(), defaults.criticalDeadlineTime(),
            defaults.primaryCalendarId(), defaults.maxCascadeDepth(), defaults.leaseTtl(), leaseMaxWait,
            defaults.minDuration(), defaults.maxDuration(), defaults.defaultDuration(), defaults.titleMaxLength());
    }

    @Nested
    class ScheduleTask {
        @Test
        void scheduleTaskShouldBookTheFirstFreeSlot() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING);

            ScheduledTask scheduled = fixture.taskScheduler().scheduleTask(request(Priority.NORMAL)).block();

            assertThat(scheduled.scheduled()).isEqualTo(slot("2026-02-23T09:00:00Z", HALF_HOUR));
            assertThat(scheduled.eventUrl()).isEqualTo("memory://primary/" + scheduled.eventId());
            assertThat(scheduled.doubleBookWarning()).isEmpty();
            assertThat(scheduled.relocated()).isEmpty();

            ManagedEvent stored = fixture.managedEventDAO.find(scheduled.managedEventId()).block();
            assertThat(stored.sourceTaskId()).isEqualTo(TASK);
            assertThat(stored.externalEventId()).isEqualTo(scheduled.eventId());
            assertThat(stored.priority()).isEqualTo(Priority.NORMAL);
            assertThat(stored.deadline()).contains(WEDNESDAY_NOON);
            assertThat(stored.original()).contains(scheduled.scheduled());
            assertThat(stored.active()).isTrue();
            assertThat(fixture.memoryCalendarService.entries(PRIMARY))
                .extracting(CalendarEntry::title)
                .containsExactly("[Legal] Review the supplier contract");
        }

        @Test
        void scheduleTaskShouldDescribeTheTaskInTheCalendarEntry() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING);
            MemoryCalendarService calendarService = spy(fixture.memoryCalendarService);
            fixture.calendarService = calendarService;

            fixture.taskScheduler().scheduleTask(request(Priority.NORMAL)).block();

            ArgumentCaptor<NewCalendarEntry> captor = ArgumentCaptor.forClass(NewCalendarEntry.class);
            verify(calendarService).createEvent(eq(PRIMARY), captor.capture());
            assertThat(captor.getValue().description())
                .isEqualTo("**Summary:** Contract renewal is due\n\n**Action:** Read and sign");
        }

        @Test
        void scheduleTaskShouldClampTooLongDurations() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_WORKDAY);

            ScheduledTask scheduled = fixture.taskScheduler()
                .scheduleTask(request(Optional.of(Duration.ofHours(3)), Priority.NORMAL, Optional.of(WEDNESDAY_NOON))).block();

            assertThat(scheduled.scheduled().duration()).isEqualTo(Duration.ofMinutes(120));
        }

        @Test
        void scheduleTaskShouldClampTooShortDurations() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_WORKDAY);

            ScheduledTask scheduled = fixture.taskScheduler()
                .scheduleTask(request(Optional.of(Duration.ofMinutes(1)), Priority.NORMAL, Optional.of(WEDNESDAY_NOON))).block();

            assertThat(scheduled.scheduled().duration()).isEqualTo(Duration.ofMinutes(5));
        }

        @Test
        void scheduleTaskShouldDefaultToHalfAnHour() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_WORKDAY);

            ScheduledTask scheduled = fixture.taskScheduler()
                .scheduleTask(request(Optional.empty(), Priority.NORMAL, Optional.of(WEDNESDAY_NOON))).block();

            assertThat(scheduled.scheduled().duration()).isEqualTo(HALF_HOUR);
        }

        @Test
        void criticalTaskWithoutDeadlineShouldBeDueTodayAtFive() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_WORKDAY);

            ScheduledTask scheduled = fixture.taskScheduler()
                .scheduleTask(request(Optional.empty(), Priority.CRITICAL, Optional.empty())).block();

            assertThat(fixture.managedEventDAO.find(scheduled.managedEventId()).block().deadline())
                .contains(Instant.parse("2026-02-23T17:00:00Z"));
        }

        @Test
        void normalTaskWithoutDeadlineShouldBeDueInAWeek() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_WORKDAY);

            ScheduledTask scheduled = fixture.taskScheduler()
                .scheduleTask(request(Optional.empty(), Priority.NORMAL, Optional.empty())).block();

            assertThat(fixture.managedEventDAO.find(scheduled.managedEventId()).block().deadline())
                .contains(NOW.plus(Duration.ofDays(7)));
        }

        @Test
        void unschedulableTaskShouldYieldNothing() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING);
            fixture.occupy("1", "2026-02-23T09:00:00Z", ONE_HOUR, Priority.NORMAL);

            assertThat(fixture.taskScheduler().scheduleTask(request(Priority.NORMAL)).blockOptional()).isEmpty();
            assertThat(fixture.memoryCalendarService.entries(PRIMARY)).hasSize(1);
        }

        @Test
        void doubleBookingShouldBeReportedAndCounted() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING);
            fixture.occupy("1", "2026-02-23T09:00:00Z", ONE_HOUR, Priority.CRITICAL);

            ScheduledTask scheduled = fixture.taskScheduler().scheduleTask(request(Priority.CRITICAL)).block();

            assertThat(scheduled.scheduled()).isEqualTo(slot("2026-02-23T09:00:00Z", HALF_HOUR));
            assertThat(scheduled.doubleBookWarning()).contains(SlotResult.DOUBLE_BOOK_WARNING);
            assertThat(fixture.metricFactory.countFor(TaskScheduler.DOUBLE_BOOK_METRIC)).isEqualTo(1);
            assertThat(fixture.stored("1").scheduled()).isEqualTo(slot("2026-02-23T09:00:00Z", ONE_HOUR));
        }

        @Test
        void scheduleTaskShouldRelocateBumpedEvents() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING, TUESDAY_MORNING);
            fixture.occupy("1", "2026-02-23T09:00:00Z", HALF_HOUR, Priority.NORMAL);

            ScheduledTask scheduled = fixture.taskScheduler().scheduleTask(request(Priority.HIGH)).block();

            ManagedEvent bumped = fixture.stored("1");
            assertThat(scheduled.scheduled()).isEqualTo(slot("2026-02-23T09:00:00Z", HALF_HOUR));
            assertThat(scheduled.relocated()).containsExactly(bumped);
            assertThat(bumped.scheduled()).isEqualTo(slot("2026-02-23T09:30:00Z", HALF_HOUR));
            assertThat(bumped.bumpedBy()).contains(TASK);
            assertThat(fixture.metricFactory.countFor("taskslot.bump")).isEqualTo(1);
        }

        @Test
        void criticalEventsShouldNeverBeMovedByOtherTasks() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING, TUESDAY_MORNING);
            ManagedEvent critical = fixture.occupy("1", "2026-02-23T09:00:00Z", HALF_HOUR, Priority.CRITICAL);
            TaskScheduler taskScheduler = fixture.taskScheduler();

            taskScheduler.scheduleTask(request(Priority.HIGH)).block();
            taskScheduler.scheduleTask(request(Priority.CRITICAL)).block();

            assertThat(fixture.stored("1")).isEqualTo(critical);
        }

        @Test
        void failingToRecordTheBookingShouldDeleteTheCalendarEntry() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING);
            MemoryManagedEventDAO managedEventDAO = spy(fixture.memoryManagedEventDAO);
            doReturn(Mono.error(new RuntimeException("store down"))).when(managedEventDAO).insert(any());
            fixture.managedEventDAO = managedEventDAO;

            assertThatThrownBy(() -> fixture.taskScheduler().scheduleTask(request(Priority.NORMAL)).block())
                .isInstanceOf(SchedulingServiceUnavailableException.class);
            assertThat(fixture.memoryCalendarService.entries(PRIMARY)).isEmpty();
        }

        @Test
        void failingToRecordTheBookingShouldRevertRelocations() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING, TUESDAY_MORNING);
            ManagedEvent victim = fixture.occupy("1", "2026-02-23T09:00:00Z", HALF_HOUR, Priority.NORMAL);
            MemoryManagedEventDAO managedEventDAO = spy(fixture.memoryManagedEventDAO);
            doReturn(Mono.error(new RuntimeException("store down"))).when(managedEventDAO).insert(any());
            fixture.managedEventDAO = managedEventDAO;

            assertThatThrownBy(() -> fixture.taskScheduler().scheduleTask(request(Priority.HIGH)).block())
                .isInstanceOf(SchedulingServiceUnavailableException.class);
            assertThat(fixture.stored("1")).isEqualTo(victim);
            assertThat(fixture.memoryCalendarService.entries(PRIMARY))
                .extracting(CalendarEntry::slot)
                .containsExactly(victim.scheduled());
        }
    }

    @Nested
    class Titles {
        private final TaskScheduler taskScheduler = new SchedulingEngineFixture().taskScheduler();

        @Test
        void titleShouldBePrefixedByDomain() {
            assertThat(taskScheduler.title("Finance", "Pay invoices")).isEqualTo("[Finance] Pay invoices");
        }

        @Test
        void titleShouldFallBackToDefaultDomain() {
            assertThat(taskScheduler.title(" ", "Pay invoices")).isEqualTo("[Task] Pay invoices");
        }

        @Test
        void titleShouldTruncateLongSubjects() {
            assertThat(taskScheduler.title("Finance", Strings.repeat("a", 60)))
                .isEqualTo("[Finance] " + Strings.repeat("a", 50));
        }

        @Test
        void titleShouldTolerateMissingSubject() {
            assertThat(taskScheduler.title(null, null)).isEqualTo("[Task] ");
        }
    }

    @Nested
    class Sessions {
        @Test
        void sessionsShouldBeSpreadBeforeTheDeadline() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(
                SchedulingWindow.active("Mon", DayOfWeek.MONDAY, "09:00", "10:00", WindowTier.ALL),
                SchedulingWindow.active("Tue", DayOfWeek.TUESDAY, "09:00", "10:00", WindowTier.ALL),
                SchedulingWindow.active("Wed", DayOfWeek.WEDNESDAY, "09:00", "10:00", WindowTier.ALL),
                SchedulingWindow.active("Thu", DayOfWeek.THURSDAY, "09:00", "10:00", WindowTier.ALL),
                SchedulingWindow.active("Fri", DayOfWeek.FRIDAY, "09:00", "10:00", WindowTier.ALL));

            List<ScheduledTask> sessions = fixture.taskScheduler().scheduleSessions(new SessionRequest(TASK, "Tax return", "Finance",
                2, 1, Optional.of(ONE_HOUR), Priority.NORMAL, Optional.of(Instant.parse("2026-02-26T18:00:00Z")),
                "Yearly filing", "Gather receipts")).block();

            assertThat(sessions).extracting(ScheduledTask::scheduled)
                .containsExactly(slot("2026-02-24T09:00:00Z", ONE_HOUR), slot("2026-02-25T09:00:00Z", ONE_HOUR));
            assertThat(sessions).extracting(session -> fixture.managedEventDAO.find(session.managedEventId()).block().priority())
                .containsExactly(Priority.NORMAL, Priority.CRITICAL);
            assertThat(fixture.memoryCalendarService.entries(PRIMARY)).extracting(CalendarEntry::title)
                .containsExactly("[Finance] Session 1 of 2: Tax return", "[Finance] Session 2 of 2: Tax return");
        }

        @Test
        void sessionsThatCannotBePlacedShouldBeSkipped() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING);

            List<ScheduledTask> sessions = fixture.taskScheduler().scheduleSessions(new SessionRequest(TASK, "Tax return", "Finance",
                3, 1, Optional.of(ONE_HOUR), Priority.LOW, Optional.of(Instant.parse("2026-02-26T18:00:00Z")),
                "Yearly filing", "Gather receipts")).block();

            assertThat(sessions).extracting(ScheduledTask::scheduled)
                .containsExactly(slot("2026-02-23T09:00:00Z", ONE_HOUR), slot("2026-03-02T09:00:00Z", ONE_HOUR));
            assertThat(sessions).extracting(ScheduledTask::doubleBookWarning)
                .containsExactly(Optional.empty(), Optional.of(SlotResult.DOUBLE_BOOK_WARNING));
        }
    }

    @Nested
    class Housekeeping {
        @Test
        void clearShouldDeactivateEveryEventOfTheTask() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING, TUESDAY_MORNING);
            TaskScheduler taskScheduler = fixture.taskScheduler();
            ScheduledTask first = taskScheduler.scheduleTask(request(Priority.NORMAL)).block();
            ScheduledTask second = taskScheduler.scheduleTask(request(Priority.NORMAL)).block();

            assertThat(taskScheduler.clearTaskCalendarData(TASK).block()).isEqualTo(2L);

            assertThat(fixture.managedEventDAO.find(first.managedEventId()).block().active()).isFalse();
            assertThat(fixture.managedEventDAO.find(second.managedEventId()).block().active()).isFalse();
        }

        @Test
        void clearShouldReturnZeroForUnknownTask() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_WORKDAY);

            assertThat(fixture.taskScheduler().clearTaskCalendarData(new TaskId("unknown")).block()).isZero();
        }

        @Test
        void bumpHistoryShouldListDisplacedEvents() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING, TUESDAY_MORNING);
            fixture.occupy("1", "2026-02-23T09:00:00Z", HALF_HOUR, Priority.NORMAL);
            TaskScheduler taskScheduler = fixture.taskScheduler();
            taskScheduler.scheduleTask(request(Priority.HIGH)).block();

            assertThat(taskScheduler.bumpHistory().collectList().block())
                .containsExactly(fixture.stored("1"));
        }

        @Test
        void undoBumpShouldRestoreTheDisplacedEvent() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(MONDAY_MORNING, TUESDAY_MORNING);
            ManagedEvent victim = fixture.occupy("1", "2026-02-23T09:00:00Z", HALF_HOUR, Priority.NORMAL);
            TaskScheduler taskScheduler = fixture.taskScheduler();
            taskScheduler.scheduleTask(request(Priority.HIGH)).block();

            assertThat(taskScheduler.undoBump(victim.id()).block()).isTrue();

            assertThat(fixture.stored("1").scheduled()).isEqualTo(victim.scheduled());
            assertThat(taskScheduler.bumpHistory().collectList().block()).isEmpty();
        }
    }

    @Nested
    class Lease {
        @Test
        void heldLeaseShouldMakeSchedulingUnavailable() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(withLeaseMaxWait(Duration.ZERO), MONDAY_MORNING);
            fixture.schedulingLease.acquire(Duration.ofMinutes(1)).block();

            assertThatThrownBy(() -> fixture.taskScheduler().scheduleTask(request(Priority.NORMAL)).block())
                .isInstanceOf(SchedulingServiceUnavailableException.class);
            assertThat(fixture.memoryCalendarService.entries(PRIMARY)).isEmpty();
        }

        @Test
        void leaseShouldBeReleasedAfterEachAttempt() {
            SchedulingEngineFixture fixture = new SchedulingEngineFixture(withLeaseMaxWait(Duration.ZERO), MONDAY_MORNING, TUESDAY_MORNING);
            TaskScheduler taskScheduler = fixture.taskScheduler();

            taskScheduler.scheduleTask(request(Priority.NORMAL)).block();
            taskScheduler.scheduleTask(request(Priority.NORMAL)).block();

            assertThat(fixture.memoryCalendarService.entries(PRIMARY)).hasSize(2);
        }
    }
}
