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
import java.time.Instant;
import java.time.ZonedDateTime;

import jakarta.inject.Inject;

import com.linagora.taskslot.storage.model.Priority;

/**
 * Deadline applied when a task comes without one: Critical is due today at the configured time (17:00 by
 * default), High in 3 days, Normal in 7 days and Low in 14 days.
 */
public class DeadlinePolicy {
    private final Clock clock;
    private final SchedulingConfiguration configuration;

    @Inject
    public DeadlinePolicy(Clock clock, SchedulingConfiguration configuration) {
        this.clock = clock;
        this.configuration = configuration;
    }

    public Instant defaultDeadline(Priority priority) {
        ZonedDateTime now = clock.instant().atZone(configuration.zoneId());
        return switch (priority) {
            case CRITICAL -> now.toLocalDate()
                .atTime(configuration.criticalDeadlineTime())
                .atZone(configuration.zoneId())
                .toInstant();
            case HIGH -> now.plusDays(3).toInstant();
            case NORMAL -> now.plusDays(7).toInstant();
            case LOW -> now.plusDays(14).toInstant();
        };
    }
}
