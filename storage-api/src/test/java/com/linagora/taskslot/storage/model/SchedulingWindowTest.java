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

package com.linagora.taskslot.storage.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import org.junit.jupiter.api.Test;

class SchedulingWindowTest {

    @Test
    void weekdayIndexZeroShouldBeSunday() {
        assertThat(SchedulingWindow.weekdayFromIndex(0)).isEqualTo(DayOfWeek.SUNDAY);
        assertThat(SchedulingWindow.weekdayFromIndex(1)).isEqualTo(DayOfWeek.MONDAY);
        assertThat(SchedulingWindow.weekdayFromIndex(6)).isEqualTo(DayOfWeek.SATURDAY);
    }

    @Test
    void weekdayIndexShouldRoundTrip() {
        for (DayOfWeek day : DayOfWeek.values()) {
            assertThat(SchedulingWindow.weekdayFromIndex(SchedulingWindow.weekdayIndex(day))).isEqualTo(day);
        }
    }

    @Test
    void weekdayIndexOutOfRangeShouldBeRejected() {
        assertThatThrownBy(() -> SchedulingWindow.weekdayFromIndex(7))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void criticalOnlyWindowShouldOnlyAdmitCriticalRequests() {
        SchedulingWindow window = SchedulingWindow.active("overflow", DayOfWeek.MONDAY, "19:30", "20:00", WindowTier.CRITICAL_ONLY);

        assertThat(window.admits(true)).isTrue();
        assertThat(window.admits(false)).isFalse();
    }

    @Test
    void inactiveWindowShouldAdmitNothing() {
        SchedulingWindow window = SchedulingWindow.active("evening", DayOfWeek.MONDAY, "20:00", "21:30", WindowTier.ALL)
            .deactivated();

        assertThat(window.admits(true)).isFalse();
    }

    @Test
    void onShouldResolveAbsoluteBoundsInZone() {
        SchedulingWindow window = SchedulingWindow.active("evening", DayOfWeek.MONDAY, "20:00", "21:30", WindowTier.ALL);

        assertThat(window.on(LocalDate.of(2026, 2, 23), ZoneId.of("Australia/Melbourne")))
            .isEqualTo(new TimeSlot(Instant.parse("2026-02-23T09:00:00Z"), Instant.parse("2026-02-23T10:30:00Z")));
    }

    @Test
    void windowEndingAtMidnightShouldCloseAtTheEndOfTheDay() {
        SchedulingWindow window = SchedulingWindow.active("late", DayOfWeek.MONDAY, "23:00", "00:00", WindowTier.ALL);

        assertThat(window.endsAtMidnight()).isTrue();
        assertThat(window.on(LocalDate.of(2026, 2, 23), ZoneId.of("UTC")))
            .isEqualTo(new TimeSlot(Instant.parse("2026-02-23T23:00:00Z"), Instant.parse("2026-02-24T00:00:00Z")));
    }

    @Test
    void windowEndingAtMidnightShouldSortAfterEarlierEnds() {
        SchedulingWindow untilMidnight = SchedulingWindow.active("late", DayOfWeek.MONDAY, "23:00", "00:00", WindowTier.ALL);
        SchedulingWindow shorter = SchedulingWindow.active("late-short", DayOfWeek.MONDAY, "23:00", "23:30", WindowTier.ALL);

        assertThat(SchedulingWindow.BY_START.compare(shorter, untilMidnight)).isNegative();
    }

    @Test
    void windowEndingBeforeItStartsShouldBeRejected() {
        assertThatThrownBy(() -> SchedulingWindow.active("broken", DayOfWeek.MONDAY, "21:00", "20:00", WindowTier.ALL))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onShouldRejectDateOfAnotherWeekday() {
        SchedulingWindow window = SchedulingWindow.active("evening", DayOfWeek.MONDAY, "20:00", "21:30", WindowTier.ALL);

        assertThatThrownBy(() -> window.on(LocalDate.of(2026, 2, 24), ZoneId.of("UTC")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tierShouldAcceptBothSpellings() {
        assertThat(WindowTier.parse("critical_only")).isEqualTo(WindowTier.CRITICAL_ONLY);
        assertThat(WindowTier.parse("Critical-Only")).isEqualTo(WindowTier.CRITICAL_ONLY);
        assertThat(WindowTier.parse("all")).isEqualTo(WindowTier.ALL);
    }
}
