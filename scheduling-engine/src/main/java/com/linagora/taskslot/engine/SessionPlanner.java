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

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.IntStream;

import jakarta.inject.Inject;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Spreads the sessions of a multi-session task backward from its deadline.
 *
 * <p>The last session targets the deadline and each earlier one sits one cadence before the next. When the
 * sessions do not fit before the deadline the cadence shrinks, down to a fifth of a day. Targets are aligned to
 * 09:00 for cadences of at least a day, pulled back to Friday when they fall on a weekend, and never lie in the
 * past. The second half of the sessions is escalated to Critical.</p>
 */
public class SessionPlanner {
    public static final double DEFAULT_CADENCE_DAYS = 3;
    public static final double MIN_CADENCE_DAYS = 0.2;
    public static final Duration DEFAULT_DEADLINE_DELAY = Duration.ofDays(30);
    private static final LocalTime SESSION_ALIGNMENT = LocalTime.of(9, 0);
    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    public record SessionTarget(int index, int count, Instant target, boolean escalated) {
        public String label() {
            return "Session " + (index + 1) + " of " + count;
        }
    }

    private final SchedulingConfiguration configuration;

    @Inject
    public SessionPlanner(SchedulingConfiguration configuration) {
        this.configuration = configuration;
    }

    public double effectiveCadence(Instant now, Instant deadline, int count, double cadenceDays) {
        double daysToDeadline = Math.max(0, (double) (deadline.toEpochMilli() - now.toEpochMilli()) / MILLIS_PER_DAY);
        if (count * cadenceDays > daysToDeadline && daysToDeadline > 0) {
            return Math.max(MIN_CADENCE_DAYS, (daysToDeadline - 1) / count);
        }
        return cadenceDays;
    }

    public List<SessionTarget> targets(Instant now, Instant deadline, int count, double cadenceDays) {
        Preconditions.checkArgument(count > 0, "'count' must be strictly positive");
        double requestedCadence = cadenceDays > 0 ? cadenceDays : DEFAULT_CADENCE_DAYS;
        double cadence = effectiveCadence(now, deadline, count, requestedCadence);

        return IntStream.range(0, count)
            .mapToObj(index -> new SessionTarget(index, count, target(now, deadline, cadence, count - 1 - index), index >= count / 2))
            .collect(ImmutableList.toImmutableList());
    }

    private Instant target(Instant now, Instant deadline, double cadence, int cadencesBeforeDeadline) {
        long offsetMillis = Math.round(cadencesBeforeDeadline * cadence * MILLIS_PER_DAY);
        ZonedDateTime target = deadline.minusMillis(offsetMillis).atZone(configuration.zoneId());
        if (cadence >= 1) {
            target = target.with(SESSION_ALIGNMENT);
        }
        if (target.getDayOfWeek() == DayOfWeek.SUNDAY) {
            target = target.minusDays(2);
        } else if (target.getDayOfWeek() == DayOfWeek.SATURDAY) {
            target = target.minusDays(1);
        }
        if (target.toInstant().isBefore(now)) {
            return SlotCandidates.roundUp(now, configuration.granularity()).plus(configuration.granularity());
        }
        return target.toInstant();
    }
}
