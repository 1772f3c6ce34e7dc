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
import java.util.Optional;

import jakarta.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.linagora.taskslot.engine.CalendarService.CreatedEntry;
import com.linagora.taskslot.engine.CalendarService.NewCalendarEntry;
import com.linagora.taskslot.storage.ManagedEventDAO;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.ManagedEventId;
import com.linagora.taskslot.storage.model.Priority;
import com.linagora.taskslot.storage.model.TaskId;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Mono;

/**
 * Books an accepted slot: displaces its victims, creates the calendar entry on the primary calendar, then records
 * the managed event. Any failure undoes what was done and surfaces as
 * {@link SchedulingServiceUnavailableException}.
 */
public class ScheduleCommitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleCommitter.class);

    public record Booking(TaskId taskId, String title, String description, Priority priority, Optional<Instant> deadline) {
        public Booking {
            Preconditions.checkNotNull(taskId, "'taskId' must not be null");
            Preconditions.checkNotNull(title, "'title' must not be null");
            Preconditions.checkNotNull(description, "'description' must not be null");
            Preconditions.checkNotNull(priority, "'priority' must not be null");
            Preconditions.checkNotNull(deadline, "'deadline' must not be null");
        }
    }

    private final Clock clock;
    private final BumpCoordinator bumpCoordinator;
    private final CalendarService calendarService;
    private final ManagedEventDAO managedEventDAO;
    private final SchedulingConfiguration configuration;

    @Inject
    public ScheduleCommitter(Clock clock,
                             BumpCoordinator bumpCoordinator,
                             CalendarService calendarService,
                             ManagedEventDAO managedEventDAO,
                             SchedulingConfiguration configuration) {
        this.clock = clock;
        this.bumpCoordinator = bumpCoordinator;
        this.calendarService = calendarService;
        this.managedEventDAO = managedEventDAO;
        this.configuration = configuration;
    }

    public Mono<ScheduledTask> commit(SlotResult accepted, Booking booking) {
        TimeSlot slot = accepted.slot()
            .orElseThrow(() -> new IllegalArgumentException("Cannot commit a result without slot"));

        return bumpCoordinator.plan(accepted.eventsToBump(), slot, booking.taskId())
            .flatMap(plan -> bumpCoordinator.commit(plan)
                .flatMap(relocated -> book(slot, booking)
                    .onErrorResume(error -> bumpCoordinator.revert(plan.relocations())
                        .then(Mono.error(error)))
                    .map(created -> new ScheduledTask(created.managedEventId(),
                        created.entry().id(),
                        created.entry().url(),
                        slot,
                        accepted.doubleBookWarning(),
                        accepted.cascadeWarning(),
                        relocated,
                        plan.leftInPlace()))))
            .onErrorMap(error -> !(error instanceof SchedulingServiceUnavailableException),
                error -> new SchedulingServiceUnavailableException("Could not book " + slot + " for task " + booking.taskId().value(), error));
    }

    private record Created(ManagedEventId managedEventId, CreatedEntry entry) {
    }

    private Mono<Created> book(TimeSlot slot, Booking booking) {
        String calendarId = configuration.primaryCalendarId();
        return calendarService.createEvent(calendarId, new NewCalendarEntry(booking.title(), booking.description(), slot, configuration.zoneId()))
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Calendar did not return the created entry")))
            .flatMap(entry -> {
                ManagedEvent event = ManagedEvent.booked(ManagedEventId.generate(), booking.taskId(), entry.id(), booking.title(),
                    slot, booking.priority(), booking.deadline(), clock.instant());
                return managedEventDAO.insert(event)
                    .onErrorResume(error -> calendarService.deleteEvent(calendarId, entry.id())
                        .onErrorResume(deleteError -> {
                            LOGGER.error("Could not delete calendar entry {} after failing to record it", entry.id(), deleteError);
                            return Mono.empty();
                        })
                        .then(Mono.error(error)))
                    .then(Mono.fromCallable(() -> {
                        LOGGER.info("Booked {} for task {} at {}", event.toShortString(), booking.taskId().value(), slot);
                        return new Created(event.id(), entry);
                    }));
            });
    }
}
