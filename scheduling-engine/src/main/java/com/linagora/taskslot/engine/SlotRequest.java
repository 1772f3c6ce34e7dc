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
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.Priority;
import com.linagora.taskslot.storage.model.TimeSlot;

/**
 * @param searchDeadline upper bound of the search, and anchor of backward searches
 * @param deadline the requester's own deadline, compared against occupants' deadlines
 * @param excluded intervals no candidate may overlap
 * @param vacating managed events about to move away, whose current slots do not count as occupied
 */
public record SlotRequest(Duration duration,
                          Priority priority,
                          Instant searchDeadline,
                          Optional<Instant> deadline,
                          boolean criticalHint,
                          Optional<Instant> searchStart,
                          List<TimeSlot> excluded,
                          SearchDirection direction,
                          List<ManagedEvent> vacating) {

    public enum SearchDirection {
        FORWARD,
        BACKWARD
    }

    public static SlotRequest forward(Duration duration, Priority priority, Instant deadline) {
        return new SlotRequest(duration, priority, deadline, Optional.of(deadline), false, Optional.empty(),
            ImmutableList.of(), SearchDirection.FORWARD, ImmutableList.of());
    }

    public SlotRequest {
        Preconditions.checkNotNull(duration, "'duration' must not be null");
        Preconditions.checkArgument(!duration.isNegative() && !duration.isZero(), "'duration' must be strictly positive");
        Preconditions.checkNotNull(priority, "'priority' must not be null");
        Preconditions.checkNotNull(searchDeadline, "'searchDeadline' must not be null");
        Preconditions.checkNotNull(deadline, "'deadline' must not be null");
        Preconditions.checkNotNull(searchStart, "'searchStart' must not be null");
        Preconditions.checkNotNull(direction, "'direction' must not be null");
        excluded = ImmutableList.copyOf(excluded);
        vacating = ImmutableList.copyOf(vacating);
    }

    public boolean critical() {
        return priority.isCritical() || criticalHint;
    }

    public Set<String> vacatingExternalIds() {
        return vacating.stream()
            .map(ManagedEvent::externalEventId)
            .collect(ImmutableSet.toImmutableSet());
    }

    public SlotRequest withDeadline(Optional<Instant> deadline) {
        return new SlotRequest(duration, priority, searchDeadline, deadline, criticalHint, searchStart, excluded, direction, vacating);
    }

    public SlotRequest withCriticalHint(boolean criticalHint) {
        return new SlotRequest(duration, priority, searchDeadline, deadline, criticalHint, searchStart, excluded, direction, vacating);
    }

    public SlotRequest withSearchStart(Instant searchStart) {
        return new SlotRequest(duration, priority, searchDeadline, deadline, criticalHint, Optional.of(searchStart), excluded, direction, vacating);
    }

    public SlotRequest withExcluded(List<TimeSlot> excluded) {
        return new SlotRequest(duration, priority, searchDeadline, deadline, criticalHint, searchStart, excluded, direction, vacating);
    }

    public SlotRequest withDirection(SearchDirection direction) {
        return new SlotRequest(duration, priority, searchDeadline, deadline, criticalHint, searchStart, excluded, direction, vacating);
    }

    public SlotRequest withVacating(List<ManagedEvent> vacating) {
        return new SlotRequest(duration, priority, searchDeadline, deadline, criticalHint, searchStart, excluded, direction, vacating);
    }
}
