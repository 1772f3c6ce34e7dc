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

import com.google.common.base.Preconditions;
import com.linagora.taskslot.storage.model.TimeSlot;

/**
 * An external calendar entry overlapping a candidate slot.
 */
public record Conflict(String externalEventId, String title, String calendarName, TimeSlot slot, boolean isProtected) {
    public Conflict {
        Preconditions.checkNotNull(externalEventId, "'externalEventId' must not be null");
        Preconditions.checkNotNull(slot, "'slot' must not be null");
    }
}
