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

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

import com.google.common.base.Preconditions;

/**
 * Half-open interval {@code [start, end)}. Two slots that merely touch do not overlap.
 */
public record TimeSlot(Instant start, Instant end) implements Comparable<TimeSlot> {

    public static TimeSlot of(Instant start, Duration duration) {
        Preconditions.checkNotNull(duration, "'duration' must not be null");
        return new TimeSlot(start, start.plus(duration));
    }

    public TimeSlot {
        Preconditions.checkNotNull(start, "'start' must not be null");
        Preconditions.checkNotNull(end, "'end' must not be null");
        Preconditions.checkArgument(end.isAfter(start), "'end' must be after 'start'");
    }

    public boolean overlaps(TimeSlot other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public boolean overlapsAny(Collection<TimeSlot> others) {
        return others.stream().anyMatch(this::overlaps);
    }

    public boolean encloses(TimeSlot other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public TimeSlot shiftedBy(Duration offset) {
        return new TimeSlot(start.plus(offset), end.plus(offset));
    }

    @Override
    public int compareTo(TimeSlot other) {
        int byStart = start.compareTo(other.start);
        if (byStart != 0) {
            return byStart;
        }
        return end.compareTo(other.end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
