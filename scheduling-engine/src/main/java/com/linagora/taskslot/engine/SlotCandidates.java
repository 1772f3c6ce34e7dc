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

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.google.common.base.Preconditions;
import com.linagora.taskslot.engine.AvailabilityWindows.WeeklyGrid;
import com.linagora.taskslot.storage.model.SchedulingWindow;
import com.linagora.taskslot.storage.model.TimeSlot;

/**
 * Lazy, restartable sequence of candidate slots for a request, computed from a weekly grid snapshot.
 *
 * <p>Each window yields at most one candidate: the earliest slot starting at the window start, or at the search
 * start rounded up to the granularity in forward mode, stepping by the granularity past excluded intervals, and
 * ending before the window closes.</p>
 */
public class SlotCandidates {

    public record Candidate(TimeSlot slot, SchedulingWindow window) {
    }

    public static Instant roundUp(Instant instant, Duration granularity) {
        long step = granularity.toMillis();
        long epochMillis = instant.toEpochMilli();
        long remainder = Math.floorMod(epochMillis, step);
        if (remainder == 0 && instant.getNano() % 1_000_000 == 0) {
            return instant;
        }
        return Instant.ofEpochMilli(epochMillis - remainder + step);
    }

    private final WeeklyGrid grid;
    private final ZoneId zoneId;
    private final Duration granularity;

    public SlotCandidates(WeeklyGrid grid, ZoneId zoneId, Duration granularity) {
        Preconditions.checkArgument(!granularity.isNegative() && !granularity.isZero(), "'granularity' must be strictly positive");
        this.grid = grid;
        this.zoneId = zoneId;
        this.granularity = granularity;
    }

    /**
     * Ascending candidates within {@code [from, until)}.
     */
    public Stream<Candidate> forward(Instant from, Instant until, Duration duration, List<TimeSlot> excluded) {
        Instant cursor = roundUp(from, granularity);
        if (!cursor.isBefore(until)) {
            return Stream.empty();
        }
        LocalDate firstDay = LocalDate.ofInstant(cursor, zoneId);
        LocalDate lastDay = LocalDate.ofInstant(until, zoneId);

        return Stream.iterate(firstDay, day -> !day.isAfter(lastDay), day -> day.plusDays(1))
            .flatMap(day -> grid.windowsFor(day.getDayOfWeek()).stream()
                .map(window -> candidateIn(window, day, cursor, until, duration, excluded))
                .flatMap(Optional::stream));
    }

    /**
     * Ascending candidates anchored on window starts within {@code [from, until)}. Windows already open at
     * {@code from} are skipped.
     */
    public Stream<Candidate> windowStarts(Instant from, Instant until, Duration duration, List<TimeSlot> excluded) {
        LocalDate firstDay = LocalDate.ofInstant(from, zoneId);
        LocalDate lastDay = LocalDate.ofInstant(until, zoneId);

        return Stream.iterate(firstDay, day -> !day.isAfter(lastDay), day -> day.plusDays(1))
            .flatMap(day -> grid.windowsFor(day.getDayOfWeek()).stream()
                .filter(window -> !window.on(day, zoneId).start().isBefore(from))
                .map(window -> candidateIn(window, day, window.on(day, zoneId).start(), until, duration, excluded))
                .flatMap(Optional::stream));
    }

    /**
     * Candidates starting at window starts, from the day before {@code deadline} back to the day of {@code now}.
     * Days are visited latest first, windows of a day in ascending start order. Candidates must start at or
     * after {@code now}.
     */
    public Stream<Candidate> backward(Instant now, Instant deadline, Duration duration, List<TimeSlot> excluded) {
        LocalDate firstDay = LocalDate.ofInstant(deadline, zoneId).minusDays(1);
        LocalDate lastDay = LocalDate.ofInstant(now, zoneId);

        return Stream.iterate(firstDay, day -> !day.isBefore(lastDay), day -> day.minusDays(1))
            .flatMap(day -> grid.windowsFor(day.getDayOfWeek()).stream()
                .map(window -> candidateIn(window, day, window.on(day, zoneId).start(), deadline, duration, excluded))
                .flatMap(Optional::stream))
            .filter(candidate -> !candidate.slot().start().isBefore(now));
    }

    private Optional<Candidate> candidateIn(SchedulingWindow window, LocalDate day, Instant cursor, Instant until,
                                            Duration duration, List<TimeSlot> excluded) {
        TimeSlot bounds = window.on(day, zoneId);
        TimeSlot slot = TimeSlot.of(max(cursor, bounds.start()), duration);
        while (slot.overlapsAny(excluded) && fits(slot, bounds, until)) {
            slot = slot.shiftedBy(granularity);
        }
        if (!fits(slot, bounds, until)) {
            return Optional.empty();
        }
        return Optional.of(new Candidate(slot, window));
    }

    private boolean fits(TimeSlot slot, TimeSlot bounds, Instant until) {
        return !slot.end().isAfter(bounds.end()) && !slot.end().isAfter(until);
    }

    private static Instant max(Instant a, Instant b) {
        if (a.isAfter(b)) {
            return a;
        }
        return b;
    }
}
