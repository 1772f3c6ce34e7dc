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

import java.time.Instant;
import java.util.Optional;

import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.Priority;

/**
 * Who may displace whom.
 *
 * <p>Critical events are never displaced. Any other occupant may be displaced by a requester of strictly higher
 * priority, or, when both carry a deadline, by a requester whose deadline is strictly earlier whatever the
 * priorities are.</p>
 */
public final class BumpPolicy {

    public static boolean mayBump(Priority requesterPriority, Optional<Instant> requesterDeadline, ManagedEvent occupant) {
        if (occupant.isCritical()) {
            return false;
        }
        return occupant.priority().isLowerThan(requesterPriority)
            || hasEarlierDeadline(requesterDeadline, occupant.deadline());
    }

    private static boolean hasEarlierDeadline(Optional<Instant> requesterDeadline, Optional<Instant> occupantDeadline) {
        return requesterDeadline.isPresent()
            && occupantDeadline.isPresent()
            && occupantDeadline.get().isAfter(requesterDeadline.get());
    }

    private BumpPolicy() {
    }
}
