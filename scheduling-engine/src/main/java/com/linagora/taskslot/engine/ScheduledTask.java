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

import com.google.common.collect.ImmutableList;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.ManagedEventId;
import com.linagora.taskslot.storage.model.TimeSlot;

/**
 * Outcome of a successful booking.
 *
 * @param relocated managed events moved out of the way
 * @param leftInPlace managed events that could not be moved and now overlap the booking
 */
public record ScheduledTask(ManagedEventId managedEventId,
                            String eventId,
                            String eventUrl,
                            TimeSlot scheduled,
                            Optional<String> doubleBookWarning,
                            Optional<String> cascadeWarning,
                            List<ManagedEvent> relocated,
                            List<ManagedEvent> leftInPlace) {

    public ScheduledTask {
        relocated = ImmutableList.copyOf(relocated);
        leftInPlace = ImmutableList.copyOf(leftInPlace);
    }
}
