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

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Comparator;

import com.google.common.base.Preconditions;

/**
 * A recurring named interval of a weekday during which tasks may be booked.
 *
 * <p>Weekdays are also addressable through their index, 0 being Sunday and 6 Saturday. An {@code end} of
 * {@code 00:00} stands for the end of the day, so {@code 23:00-00:00} is the last hour of the weekday.</p>
 */
public record SchedulingWindow(String name,
                               DayOfWeek weekday,
                               LocalTime start,
                               LocalTime end,
                               WindowTier tier,
                               boolean active) {

    public static final Comparator<SchedulingWindow> BY_START = Comparator.comparing(SchedulingWindow::start)
        .thenComparing(window -> window.endsAtMidnight() ? LocalTime.MAX : window.end())
        .thenComparing(SchedulingWindow::name);

    public static DayOfWeek weekdayFromIndex(int index) {
        Preconditions.checkArgument(index >= 0 && index <= 6, "'weekday' index must be within 0..6, got %s", index);
        if (index == 0) {
            return DayOfWeek.SUNDAY;
        }
        return DayOfWeek.of(index);
    }

    public static int weekdayIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    public static SchedulingWindow active(String name, DayOfWeek weekday, String start, String end, WindowTier tier) {
        return new SchedulingWindow(name, weekday, LocalTime.parse(start), LocalTime.parse(end), tier, true);
    }

    public SchedulingWindow {
        Preconditions.checkNotNull(name, "'name' must not be null");
        Preconditions.checkNotNull(weekday, "'weekday' must not be null");
        Preconditions.checkNotNull(start, "'start' must not be null");
        Preconditions.checkNotNull(end, "'end' must not be null");
        Preconditions.checkNotNull(tier, "'tier' must not be null");
        Preconditions.checkArgument(start.isBefore(end) || end.equals(LocalTime.MIDNIGHT),
            "'start' must be before 'end' for window '%s'", name);
    }

    public boolean endsAtMidnight() {
        return end.equals(LocalTime.MIDNIGHT);
    }

    public int weekdayIndex() {
        return weekdayIndex(weekday);
    }

    public boolean admits(boolean criticalRequest) {
        return active && tier.admits(criticalRequest);
    }

    public TimeSlot on(LocalDate date, ZoneId zoneId) {
        Preconditions.checkArgument(date.getDayOfWeek() == weekday, "%s is not a %s", date, weekday);
        Instant endInstant = endsAtMidnight()
            ? date.plusDays(1).atStartOfDay(zoneId).toInstant()
            : date.atTime(end).atZone(zoneId).toInstant();
        return new TimeSlot(date.atTime(start).atZone(zoneId).toInstant(), endInstant);
    }

    public SchedulingWindow deactivated() {
        return new SchedulingWindow(name, weekday, start, end, tier, false);
    }
}
