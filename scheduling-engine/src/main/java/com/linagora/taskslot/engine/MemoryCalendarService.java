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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemoryCalendarService implements CalendarService {
    private final Map<String, CalendarInfo> calendars = new ConcurrentHashMap<>();
    private final Map<String, Map<String, CalendarEntry>> entries = new ConcurrentHashMap<>();

    public MemoryCalendarService addCalendar(CalendarInfo calendar) {
        calendars.put(calendar.id(), calendar);
        entries.computeIfAbsent(calendar.id(), id -> new ConcurrentHashMap<>());
        return this;
    }

    public MemoryCalendarService addEntry(String calendarId, CalendarEntry entry) {
        calendarEntries(calendarId).put(entry.id(), entry);
        return this;
    }

    public List<CalendarEntry> entries(String calendarId) {
        List<CalendarEntry> result = new ArrayList<>(calendarEntries(calendarId).values());
        result.sort(Comparator.comparing(CalendarEntry::slot));
        return result;
    }

    @Override
    public Flux<CalendarInfo> listCalendars() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(calendars.values()))
            .sort(Comparator.comparing(CalendarInfo::id)));
    }

    @Override
    public Flux<CalendarEntry> listBusy(String calendarId, TimeSlot range) {
        return Flux.defer(() -> Flux.fromIterable(entries(calendarId))
            .filter(entry -> entry.slot().overlaps(range)));
    }

    @Override
    public Mono<CreatedEntry> createEvent(String calendarId, NewCalendarEntry entry) {
        return Mono.fromCallable(() -> {
            String id = UUID.randomUUID().toString();
            calendarEntries(calendarId).put(id, new CalendarEntry(id, entry.title(), entry.slot(), false));
            return new CreatedEntry(id, "memory://" + calendarId + "/" + id);
        });
    }

    @Override
    public Mono<Void> patchEvent(String calendarId, String eventId, TimeSlot slot) {
        return Mono.fromCallable(() -> calendarEntries(calendarId)
                .computeIfPresent(eventId, (id, entry) -> new CalendarEntry(id, entry.title(), slot, false)))
            .switchIfEmpty(Mono.error(() -> new CalendarEntryNotFoundException(calendarId, eventId)))
            .then();
    }

    @Override
    public Mono<CalendarEntry> getEvent(String calendarId, String eventId) {
        return Mono.fromCallable(() -> Optional.ofNullable(entries.get(calendarId))
            .map(calendar -> calendar.get(eventId))
            .orElse(null));
    }

    @Override
    public Mono<Void> deleteEvent(String calendarId, String eventId) {
        return Mono.fromRunnable(() -> calendarEntries(calendarId).remove(eventId));
    }

    private Map<String, CalendarEntry> calendarEntries(String calendarId) {
        return entries.computeIfAbsent(calendarId, id -> new ConcurrentHashMap<>());
    }
}
