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

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.TimeSlot;

public sealed interface SlotResult {
    String DOUBLE_BOOK_WARNING = "No slot available before deadline, forced overlap";

    static String cascadeWarning(int bumpedCount) {
        return "This will bump " + bumpedCount + " existing tasks";
    }

    /**
     * No known conflict in the slot.
     */
    record Free(TimeSlot value) implements SlotResult {
        public Free {
            Preconditions.checkNotNull(value, "'value' must not be null");
        }
    }

    /**
     * The slot is claimed over occupants. Managed occupants listed in {@code eventsToBump} are to be relocated,
     * other overlapping entries stay where they are. The list is empty when a High or Critical request claims a
     * slot that only overlaps unmanaged entries.
     */
    record Claimed(TimeSlot value, List<ManagedEvent> eventsToBump, Optional<String> cascadeWarning) implements SlotResult {
        public static Claimed of(TimeSlot value, List<ManagedEvent> eventsToBump) {
            return new Claimed(value, eventsToBump, Optional.of(eventsToBump.size())
                .filter(count -> count > 1)
                .map(SlotResult::cascadeWarning));
        }

        public Claimed {
            Preconditions.checkNotNull(value, "'value' must not be null");
            eventsToBump = ImmutableList.copyOf(eventsToBump);
            Preconditions.checkNotNull(cascadeWarning, "'cascadeWarning' must not be null");
        }

        @Override
        public boolean requiresBumping() {
            return !eventsToBump.isEmpty();
        }
    }

    /**
     * Critical fallback: the first window start, regardless of conflicts.
     */
    record DoubleBooked(TimeSlot value, String warning) implements SlotResult {
        public DoubleBooked {
            Preconditions.checkNotNull(value, "'value' must not be null");
            Preconditions.checkNotNull(warning, "'warning' must not be null");
        }
    }

    record NotFound() implements SlotResult {
    }

    NotFound NOT_FOUND = new NotFound();

    default Optional<TimeSlot> slot() {
        if (this instanceof Free free) {
            return Optional.of(free.value());
        }
        if (this instanceof Claimed claimed) {
            return Optional.of(claimed.value());
        }
        if (this instanceof DoubleBooked doubleBooked) {
            return Optional.of(doubleBooked.value());
        }
        return Optional.empty();
    }

    default boolean requiresBumping() {
        return false;
    }

    default List<ManagedEvent> eventsToBump() {
        if (this instanceof Claimed claimed) {
            return claimed.eventsToBump();
        }
        return ImmutableList.of();
    }

    default Optional<String> cascadeWarning() {
        if (this instanceof Claimed claimed) {
            return claimed.cascadeWarning();
        }
        return Optional.empty();
    }

    default Optional<String> doubleBookWarning() {
        if (this instanceof DoubleBooked doubleBooked) {
            return Optional.of(doubleBooked.warning());
        }
        return Optional.empty();
    }
}
