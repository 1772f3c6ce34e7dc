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
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.apache.commons.configuration2.Configuration;
import org.apache.james.util.DurationParser;

import com.google.common.base.Preconditions;

public record SchedulingConfiguration(ZoneId zoneId,
                                      Duration granularity,
                                      Duration searchHorizon,
                                      Duration relocationHorizon,
                                      Duration criticalFallbackHorizon,
                                      LocalTime criticalDeadlineTime,
                                      String primaryCalendarId,
                                      int maxCascadeDepth,
                                      Duration leaseTtl,
                                      Duration leaseMaxWait,
                                      Duration minDuration,
                                      Duration maxDuration,
                                      Duration defaultDuration,
                                      int titleMaxLength) {

    public static final String TIMEZONE = "scheduling.timezone";
    public static final String GRANULARITY = "scheduling.granularity";
    public static final String SEARCH_HORIZON = "scheduling.search.horizon";
    public static final String RELOCATION_HORIZON = "scheduling.relocation.horizon";
    public static final String CRITICAL_FALLBACK_HORIZON = "scheduling.critical.fallback.horizon";
    public static final String CRITICAL_DEADLINE_TIME = "scheduling.critical.deadline.time";
    public static final String PRIMARY_CALENDAR = "scheduling.calendar.primary";
    public static final String MAX_CASCADE_DEPTH = "scheduling.bump.max.cascade.depth";
    public static final String LEASE_TTL = "scheduling.lease.ttl";
    public static final String LEASE_MAX_WAIT = "scheduling.lease.max.wait";
    public static final String MIN_DURATION = "scheduling.duration.min";
    public static final String MAX_DURATION = "scheduling.duration.max";
    public static final String DEFAULT_DURATION = "scheduling.duration.default";
    public static final String TITLE_MAX_LENGTH = "scheduling.title.max.length";

    public static final SchedulingConfiguration DEFAULT = new SchedulingConfiguration(
        ZoneId.of("UTC"),
        Duration.ofMinutes(30),
        Duration.ofDays(30),
        Duration.ofDays(14),
        Duration.ofDays(14),
        LocalTime.of(17, 0),
        "primary",
        3,
        Duration.ofSeconds(60),
        Duration.ofSeconds(10),
        Duration.ofMinutes(5),
        Duration.ofMinutes(120),
        Duration.ofMinutes(30),
        50);

    public SchedulingConfiguration {
        Preconditions.checkNotNull(zoneId, "'%s' must not be null", TIMEZONE);
        Preconditions.checkArgument(isPositive(granularity), "'%s' must be strictly positive", GRANULARITY);
        Preconditions.checkArgument(isPositive(searchHorizon), "'%s' must be strictly positive", SEARCH_HORIZON);
        Preconditions.checkArgument(isPositive(relocationHorizon), "'%s' must be strictly positive", RELOCATION_HORIZON);
        Preconditions.checkArgument(isPositive(criticalFallbackHorizon), "'%s' must be strictly positive", CRITICAL_FALLBACK_HORIZON);
        Preconditions.checkNotNull(criticalDeadlineTime, "'%s' must not be null", CRITICAL_DEADLINE_TIME);
        Preconditions.checkNotNull(primaryCalendarId, "'%s' must not be null", PRIMARY_CALENDAR);
        Preconditions.checkArgument(maxCascadeDepth >= 0, "'%s' must not be negative", MAX_CASCADE_DEPTH);
        Preconditions.checkArgument(isPositive(leaseTtl), "'%s' must be strictly positive", LEASE_TTL);
        Preconditions.checkArgument(leaseMaxWait != null && !leaseMaxWait.isNegative(), "'%s' must not be negative", LEASE_MAX_WAIT);
        Preconditions.checkArgument(isPositive(minDuration), "'%s' must be strictly positive", MIN_DURATION);
        Preconditions.checkArgument(maxDuration != null && maxDuration.compareTo(minDuration) >= 0,
            "'%s' must not be lower than '%s'", MAX_DURATION, MIN_DURATION);
        Preconditions.checkArgument(defaultDuration != null && defaultDuration.compareTo(minDuration) >= 0 && defaultDuration.compareTo(maxDuration) <= 0,
            "'%s' must be within '%s' and '%s'", DEFAULT_DURATION, MIN_DURATION, MAX_DURATION);
        Preconditions.checkArgument(titleMaxLength > 0, "'%s' must be strictly positive", TITLE_MAX_LENGTH);
    }

    public static SchedulingConfiguration parse(Configuration configuration) {
        return new SchedulingConfiguration(
            Optional.ofNullable(configuration.getString(TIMEZONE, null)).map(ZoneId::of).orElse(DEFAULT.zoneId),
            duration(configuration, GRANULARITY, ChronoUnit.MINUTES, DEFAULT.granularity),
            duration(configuration, SEARCH_HORIZON, ChronoUnit.DAYS, DEFAULT.searchHorizon),
            duration(configuration, RELOCATION_HORIZON, ChronoUnit.DAYS, DEFAULT.relocationHorizon),
            duration(configuration, CRITICAL_FALLBACK_HORIZON, ChronoUnit.DAYS, DEFAULT.criticalFallbackHorizon),
            Optional.ofNullable(configuration.getString(CRITICAL_DEADLINE_TIME, null)).map(LocalTime::parse).orElse(DEFAULT.criticalDeadlineTime),
            configuration.getString(PRIMARY_CALENDAR, DEFAULT.primaryCalendarId),
            configuration.getInt(MAX_CASCADE_DEPTH, DEFAULT.maxCascadeDepth),
            duration(configuration, LEASE_TTL, ChronoUnit.SECONDS, DEFAULT.leaseTtl),
            duration(configuration, LEASE_MAX_WAIT, ChronoUnit.SECONDS, DEFAULT.leaseMaxWait),
            duration(configuration, MIN_DURATION, ChronoUnit.MINUTES, DEFAULT.minDuration),
            duration(configuration, MAX_DURATION, ChronoUnit.MINUTES, DEFAULT.maxDuration),
            duration(configuration, DEFAULT_DURATION, ChronoUnit.MINUTES, DEFAULT.defaultDuration),
            configuration.getInt(TITLE_MAX_LENGTH, DEFAULT.titleMaxLength));
    }

    private static Duration duration(Configuration configuration, String key, ChronoUnit defaultUnit, Duration defaultValue) {
        return Optional.ofNullable(configuration.getString(key, null))
            .map(value -> DurationParser.parse(value, defaultUnit))
            .orElse(defaultValue);
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    /**
     * Clamps a requested duration into the configured bounds. Absent or non-positive requests get the default.
     */
    public Duration clampDuration(Optional<Duration> requested) {
        return requested
            .filter(SchedulingConfiguration::isPositive)
            .map(value -> value.compareTo(minDuration) < 0 ? minDuration : value)
            .map(value -> value.compareTo(maxDuration) > 0 ? maxDuration : value)
            .orElse(defaultDuration);
    }
}
