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

import java.time.Instant;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

public record ManagedEvent(ManagedEventId id,
                           TaskId sourceTaskId,
                           String externalEventId,
                           String title,
                           TimeSlot scheduled,
                           Priority priority,
                           Optional<Instant> deadline,
                           Optional<TimeSlot> original,
                           Optional<TaskId> bumpedBy,
                           int bumpCount,
                           boolean active,
                           Instant updatedAt) {

    public static ManagedEvent booked(ManagedEventId id, TaskId sourceTaskId, String externalEventId, String title,
                                      TimeSlot scheduled, Priority priority, Optional<Instant> deadline, Instant now) {
        return new ManagedEvent(id, sourceTaskId, externalEventId, title, scheduled, priority, deadline,
            Optional.of(scheduled), Optional.empty(), 0, true, now);
    }

    public ManagedEvent {
        Preconditions.checkNotNull(id, "'id' must not be null");
        Preconditions.checkNotNull(sourceTaskId, "'sourceTaskId' must not be null");
        Preconditions.checkNotNull(externalEventId, "'externalEventId' must not be null");
        Preconditions.checkNotNull(title, "'title' must not be null");
        Preconditions.checkNotNull(scheduled, "'scheduled' must not be null");
        Preconditions.checkNotNull(priority, "'priority' must not be null");
        Preconditions.checkNotNull(deadline, "'deadline' must not be null");
        Preconditions.checkNotNull(original, "'original' must not be null");
        Preconditions.checkNotNull(bumpedBy, "'bumpedBy' must not be null");
        Preconditions.checkArgument(bumpCount >= 0, "'bumpCount' must not be negative");
        Preconditions.checkNotNull(updatedAt, "'updatedAt' must not be null");
    }

    public boolean isCritical() {
        return priority.isCritical();
    }

    public boolean overlaps(TimeSlot slot) {
        return scheduled.overlaps(slot);
    }

    public ManagedEvent relocatedTo(TimeSlot newSlot, TaskId bumper, Instant now) {
        return new ManagedEvent(id, sourceTaskId, externalEventId, title, newSlot, priority, deadline,
            original, Optional.of(bumper), bumpCount + 1, active, now);
    }

    public ManagedEvent restoreOriginal(Instant now) {
        TimeSlot originalSlot = original.orElseThrow(() -> new IllegalStateException(
            "No original interval recorded for managed event " + id.value()));
        return new ManagedEvent(id, sourceTaskId, externalEventId, title, originalSlot, priority, deadline,
            original, Optional.empty(), Math.max(0, bumpCount - 1), active, now);
    }

    public ManagedEvent deactivated(Instant now) {
        return new ManagedEvent(id, sourceTaskId, externalEventId, title, scheduled, priority, deadline,
            original, bumpedBy, bumpCount, false, now);
    }

    public String toShortString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id.value())
            .add("task", sourceTaskId.value())
            .add("priority", priority.value())
            .add("scheduled", scheduled)
            .toString();
    }
}
