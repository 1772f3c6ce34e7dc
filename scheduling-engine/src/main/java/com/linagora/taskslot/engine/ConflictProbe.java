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

import jakarta.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.taskslot.engine.CalendarService.CalendarEntry;
import com.linagora.taskslot.engine.CalendarService.CalendarInfo;
import com.linagora.taskslot.storage.ProtectedCalendarDAO;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lists the external entries overlapping a candidate slot, across every known calendar.
 *
 * <p>Reads fail open: an unreachable calendar service, or a single calendar failing to answer, contributes no
 * conflicts.</p>
 */
public class ConflictProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConflictProbe.class);
    private static final String UNTITLED = "Untitled Event";

    private final CalendarService calendarService;
    private final ProtectedCalendarDAO protectedCalendarDAO;

    @Inject
    public ConflictProbe(CalendarService calendarService, ProtectedCalendarDAO protectedCalendarDAO) {
        this.calendarService = calendarService;
        this.protectedCalendarDAO = protectedCalendarDAO;
    }

    public Flux<Conflict> conflictsIn(TimeSlot candidate) {
        return calendarService.listCalendars()
            .onErrorResume(error -> {
                LOGGER.warn("Could not list calendars while probing {}, assuming no conflicts", candidate, error);
                return Flux.empty();
            })
            .concatMap(calendar -> conflictsIn(calendar, candidate));
    }

    private Flux<Conflict> conflictsIn(CalendarInfo calendar, TimeSlot candidate) {
        return protectedCalendarDAO.isProtected(calendar.name())
            .flatMapMany(isProtected -> calendarService.listBusy(calendar.id(), candidate)
                .filter(entry -> entry.slot().overlaps(candidate))
                .filter(entry -> isProtected || !entry.allDay())
                .map(entry -> asConflict(calendar, entry, isProtected)))
            .onErrorResume(error -> {
                LOGGER.warn("Busy query failed for calendar '{}' while probing {}, ignoring it", calendar.name(), candidate, error);
                return Flux.empty();
            });
    }

    private Conflict asConflict(CalendarInfo calendar, CalendarEntry entry, boolean isProtected) {
        return new Conflict(entry.id(), StringUtils.defaultIfBlank(entry.title(), UNTITLED), calendar.name(),
            entry.slot(), isProtected);
    }
}
