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

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.apache.james.metrics.tests.RecordingMetricFactory;

import com.linagora.taskslot.engine.CalendarService.CalendarEntry;
import com.linagora.taskslot.engine.CalendarService.CalendarInfo;
import com.linagora.taskslot.storage.ManagedEventDAO;
import com.linagora.taskslot.storage.MemoryManagedEventDAO;
import com.linagora.taskslot.storage.MemoryProtectedCalendarDAO;
import com.linagora.taskslot.storage.MemorySchedulingWindowDAO;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.ManagedEventId;
import com.linagora.taskslot.storage.model.Priority;
import com.linagora.taskslot.storage.model.SchedulingWindow;
import com.linagora.taskslot.storage.model.TaskId;
import com.linagora.taskslot.storage.model.TimeSlot;
import com.linagora.taskslot.storage.model.WindowTier;

/**
 * Engine wired on in-memory collaborators, on Monday 2026-02-23 08:00 UTC.
 */
class SchedulingEngineFixture {
    static final Instant NOW = Instant.parse("2026-02-23T08:00:00Z");
    static final String PRIMARY = "primary";
    static final String ICLOUD = "icloud";
    static final SchedulingWindow MONDAY_MORNING = SchedulingWindow.active("Monday Morning", DayOfWeek.MONDAY, "09:00", "10:00", WindowTier.ALL);
    static final SchedulingWindow TUESDAY_MORNING = SchedulingWindow.active("Tuesday Morning", DayOfWeek.TUESDAY, "09:00", "10:00", WindowTier.ALL);

    static TimeSlot slot(String start, Duration duration) {
        return TimeSlot.of(Instant.parse(start), duration);
    }

    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final MemorySchedulingWindowDAO windowDAO;
    final MemoryProtectedCalendarDAO protectedCalendarDAO = new MemoryProtectedCalendarDAO(List.of("ICLOUD"));
    final MemoryCalendarService memoryCalendarService = new MemoryCalendarService()
        .addCalendar(new CalendarInfo(PRIMARY, "Primary", true))
        .addCalendar(new CalendarInfo(ICLOUD, "iCloud", false));
    final MemoryManagedEventDAO memoryManagedEventDAO = new MemoryManagedEventDAO();
    final RecordingMetricFactory metricFactory = new RecordingMetricFactory();
    final SchedulingConfiguration configuration;

    CalendarService calendarService = memoryCalendarService;
    ManagedEventDAO managedEventDAO = memoryManagedEventDAO;
    SchedulingLease schedulingLease;

    SchedulingEngineFixture(SchedulingWindow... windows) {
        this(SchedulingConfiguration.DEFAULT, windows);
    }

    SchedulingEngineFixture(SchedulingConfiguration configuration, SchedulingWindow... windows) {
        this.configuration = configuration;
        this.windowDAO = new MemorySchedulingWindowDAO(List.of(windows));
        this.schedulingLease = new MemorySchedulingLease(clock);
    }

    ConflictProbe conflictProbe() {
        return new ConflictProbe(calendarService, protectedCalendarDAO);
    }

    SlotSearchEngine slotSearchEngine() {
        return new SlotSearchEngine(clock, new AvailabilityWindows(windowDAO), conflictProbe(), managedEventDAO, configuration);
    }

    BumpCoordinator bumpCoordinator() {
        return new BumpCoordinator(clock, slotSearchEngine(), managedEventDAO, calendarService, configuration, metricFactory);
    }

    TaskScheduler taskScheduler() {
        BumpCoordinator bumpCoordinator = bumpCoordinator();
        return new TaskScheduler(clock,
            slotSearchEngine(),
            new ScheduleCommitter(clock, bumpCoordinator, calendarService, managedEventDAO, configuration),
            bumpCoordinator,
            managedEventDAO,
            new DeadlinePolicy(clock, configuration),
            new SessionPlanner(configuration),
            schedulingLease,
            configuration,
            metricFactory);
    }

    /**
     * Records a managed event and its entry on the primary calendar.
     */
    ManagedEvent occupy(String id, String start, Duration duration, Priority priority, Optional<Instant> deadline) {
        TimeSlot slot = slot(start, duration);
        ManagedEvent event = ManagedEvent.booked(new ManagedEventId(id), new TaskId("task-" + id), "ext-" + id,
            "occupant " + id, slot, priority, deadline, NOW.minus(Duration.ofDays(1)));
        memoryManagedEventDAO.insert(event).block();
        memoryCalendarService.addEntry(PRIMARY, new CalendarEntry(event.externalEventId(), event.title(), slot, false));
        return event;
    }

    ManagedEvent occupy(String id, String start, Duration duration, Priority priority) {
        return occupy(id, start, duration, priority, Optional.empty());
    }

    void external(String calendarId, String id, TimeSlot slot, boolean allDay) {
        memoryCalendarService.addEntry(calendarId, new CalendarEntry(id, "external " + id, slot, allDay));
    }

    ManagedEvent stored(String id) {
        return memoryManagedEventDAO.find(new ManagedEventId(id)).block();
    }
}
