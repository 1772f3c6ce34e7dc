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

import static com.linagora.taskslot.engine.SchedulingEngineFixture.slot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.linagora.taskslot.engine.CalendarService.CalendarEntry;
import com.linagora.taskslot.engine.CalendarService.CalendarInfo;
import com.linagora.taskslot.storage.MemoryProtectedCalendarDAO;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;

class ConflictProbeTest {
    private static final TimeSlot CANDIDATE = slot("2026-02-23T09:00:00Z", Duration.ofMinutes(30));
    private static final TimeSlot WHOLE_DAY = new TimeSlot(Instant.parse("2026-02-23T00:00:00Z"), Instant.parse("2026-02-24T00:00:00Z"));

    private final MemoryCalendarService calendarService = new MemoryCalendarService()
        .addCalendar(new CalendarInfo("work", "Work", true))
        .addCalendar(new CalendarInfo("family", "iCloud", false));
    private final MemoryProtectedCalendarDAO protectedCalendarDAO = new MemoryProtectedCalendarDAO(List.of("ICLOUD"));
    private final ConflictProbe testee = new ConflictProbe(calendarService, protectedCalendarDAO);

    @Test
    void freeSlotShouldHaveNoConflict() {
        calendarService.addEntry("work", new CalendarEntry("standup", "Standup", slot("2026-02-23T08:30:00Z", Duration.ofMinutes(30)), false));

        assertThat(testee.conflictsIn(CANDIDATE).collectList().block()).isEmpty();
    }

    @Test
    void overlappingEntriesShouldBeReportedWithTheirCalendar() {
        TimeSlot meeting = slot("2026-02-23T09:15:00Z", Duration.ofMinutes(30));
        TimeSlot clinic = slot("2026-02-23T08:45:00Z", Duration.ofMinutes(30));
        calendarService.addEntry("work", new CalendarEntry("meeting", "Budget meeting", meeting, false));
        calendarService.addEntry("family", new CalendarEntry("clinic", "Clinic", clinic, false));

        assertThat(testee.conflictsIn(CANDIDATE).collectList().block())
            .containsExactlyInAnyOrder(
                new Conflict("meeting", "Budget meeting", "Work", meeting, false),
                new Conflict("clinic", "Clinic", "iCloud", clinic, true));
    }

    @Test
    void untitledEntriesShouldGetADefaultTitle() {
        calendarService.addEntry("work", new CalendarEntry("blank", " ", CANDIDATE, false));

        assertThat(testee.conflictsIn(CANDIDATE).collectList().block())
            .extracting(Conflict::title)
            .containsExactly("Untitled Event");
    }

    @Test
    void allDayEntriesShouldOnlyCountOnProtectedCalendars() {
        calendarService.addEntry("work", new CalendarEntry("holiday", "Bank holiday", WHOLE_DAY, true));
        calendarService.addEntry("family", new CalendarEntry("trip", "Trip", WHOLE_DAY, true));

        assertThat(testee.conflictsIn(CANDIDATE).collectList().block())
            .extracting(Conflict::externalEventId)
            .containsExactly("trip");
    }

    @Test
    void protectionShouldIgnoreCalendarNameCase() {
        protectedCalendarDAO.add("work").block();
        calendarService.addEntry("work", new CalendarEntry("meeting", "Budget meeting", CANDIDATE, false));

        assertThat(testee.conflictsIn(CANDIDATE).collectList().block())
            .extracting(Conflict::isProtected)
            .containsExactly(true);
    }

    @Test
    void unreachableCalendarServiceShouldYieldNoConflict() {
        CalendarService failing = mock(CalendarService.class);
        when(failing.listCalendars()).thenReturn(Flux.error(new RuntimeException("network down")));

        assertThat(new ConflictProbe(failing, protectedCalendarDAO).conflictsIn(CANDIDATE).collectList().block()).isEmpty();
    }

    @Test
    void failingCalendarShouldNotHideTheOthers() {
        CalendarService partiallyFailing = mock(CalendarService.class);
        when(partiallyFailing.listCalendars()).thenReturn(Flux.just(
            new CalendarInfo("broken", "Broken", false),
            new CalendarInfo("work", "Work", true)));
        when(partiallyFailing.listBusy(eq("broken"), any())).thenReturn(Flux.error(new RuntimeException("timeout")));
        when(partiallyFailing.listBusy(eq("work"), any())).thenReturn(Flux.just(new CalendarEntry("meeting", "Budget meeting", CANDIDATE, false)));

        assertThat(new ConflictProbe(partiallyFailing, protectedCalendarDAO).conflictsIn(CANDIDATE).collectList().block())
            .extracting(Conflict::externalEventId)
            .containsExactly("meeting");
    }
}
