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

import java.time.ZoneId;

import com.google.common.base.Preconditions;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * External calendar holding the single source of truth for occupancy.
 */
public interface CalendarService {

    record CalendarInfo(String id, String name, boolean primary) {
        public CalendarInfo {
            Preconditions.checkNotNull(id, "'id' must not be null");
            Preconditions.checkNotNull(name, "'name' must not be null");
        }
    }

    /**
     * @param allDay true for date-only entries, whose slot then spans whole days
     */
    record CalendarEntry(String id, String title, TimeSlot slot, boolean allDay) {
        public CalendarEntry {
            Preconditions.checkNotNull(id, "'id' must not be null");
            Preconditions.checkNotNull(slot, "'slot' must not be null");
        }
    }

    record NewCalendarEntry(String title, String description, TimeSlot slot, ZoneId zoneId) {
        public NewCalendarEntry {
            Preconditions.checkNotNull(title, "'title' must not be null");
            Preconditions.checkNotNull(description, "'description' must not be null");
            Preconditions.checkNotNull(slot, "'slot' must not be null");
            Preconditions.checkNotNull(zoneId, "'zoneId' must not be null");
        }
    }

    record CreatedEntry(String id, String url) {
    }

    Flux<CalendarInfo> listCalendars();

    /**
     * Entries of the calendar overlapping the given range.
     */
    Flux<CalendarEntry> listBusy(String calendarId, TimeSlot range);

    Mono<CreatedEntry> createEvent(String calendarId, NewCalendarEntry entry);

    Mono<Void> patchEvent(String calendarId, String eventId, TimeSlot slot);

    Mono<CalendarEntry> getEvent(String calendarId, String eventId);

    /**
     * Deleting an entry that does not exist completes normally.
     */
    Mono<Void> deleteEvent(String calendarId, String eventId);
}
