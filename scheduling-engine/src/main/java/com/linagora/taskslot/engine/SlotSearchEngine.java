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
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import jakarta.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.linagora.taskslot.engine.AvailabilityWindows.WeeklyGrid;
import com.linagora.taskslot.engine.SlotCandidates.Candidate;
import com.linagora.taskslot.engine.SlotRequest.SearchDirection;
import com.linagora.taskslot.engine.SlotResult.Claimed;
import com.linagora.taskslot.engine.SlotResult.DoubleBooked;
import com.linagora.taskslot.engine.SlotResult.Free;
import com.linagora.taskslot.storage.ManagedEventDAO;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.ManagedEventId;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Finds the first workable slot for a request, trying candidates one at a time in search order.
 *
 * <p>A candidate without conflicts is taken immediately. Otherwise, High and Critical requests claim it unless a
 * Critical managed event or a protected calendar entry sits there. Any request also takes it when it has at least
 * one non-protected conflict and every one of them belongs to a managed event it may bump; protected entries next
 * to those stay where they are. Critical requests that exhaust the search fall back to the first window start at or
 * after now within the fallback horizon, ignoring conflicts.</p>
 */
public class SlotSearchEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlotSearchEngine.class);

    private final Clock clock;
    private final AvailabilityWindows availabilityWindows;
    private final ConflictProbe conflictProbe;
    private final ManagedEventDAO managedEventDAO;
    private final SchedulingConfiguration configuration;

    @Inject
    public SlotSearchEngine(Clock clock,
                            AvailabilityWindows availabilityWindows,
                            ConflictProbe conflictProbe,
                            ManagedEventDAO managedEventDAO,
                            SchedulingConfiguration configuration) {
        this.clock = clock;
        this.availabilityWindows = availabilityWindows;
        this.conflictProbe = conflictProbe;
        this.managedEventDAO = managedEventDAO;
        this.configuration = configuration;
    }

    public Mono<SlotResult> findSlot(SlotRequest request) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return availabilityWindows.weeklyGrid(request.critical())
                .onErrorMap(error -> new SchedulingServiceUnavailableException("Could not read scheduling windows", error))
                .flatMap(grid -> search(request, now, new SlotCandidates(grid, configuration.zoneId(), configuration.granularity()))
                    .switchIfEmpty(Mono.defer(() -> fallback(request, now, grid))));
        });
    }

    private Mono<SlotResult> search(SlotRequest request, Instant now, SlotCandidates candidates) {
        return Flux.fromStream(() -> candidates(request, now, candidates))
            .concatMap(candidate -> evaluate(candidate.slot(), request))
            .next();
    }

    private Stream<Candidate> candidates(SlotRequest request, Instant now, SlotCandidates candidates) {
        if (request.direction() == SearchDirection.BACKWARD) {
            return candidates.backward(now, request.searchDeadline(), request.duration(), request.excluded());
        }
        Instant from = request.searchStart()
            .filter(searchStart -> searchStart.isAfter(now))
            .orElse(now);
        Instant horizon = from.plus(configuration.searchHorizon());
        Instant until = request.searchDeadline().isBefore(horizon) ? request.searchDeadline() : horizon;
        return candidates.forward(from, until, request.duration(), request.excluded());
    }

    private Mono<SlotResult> evaluate(TimeSlot candidate, SlotRequest request) {
        Set<String> vacatingExternalIds = request.vacatingExternalIds();
        Set<ManagedEventId> vacatingIds = request.vacating().stream()
            .map(ManagedEvent::id)
            .collect(ImmutableSet.toImmutableSet());

        return conflictProbe.conflictsIn(candidate)
            .filter(conflict -> !vacatingExternalIds.contains(conflict.externalEventId()))
            .collectList()
            .flatMap(conflicts -> {
                if (conflicts.isEmpty()) {
                    return Mono.<SlotResult>just(new Free(candidate));
                }
                return managedEventDAO.findActiveOverlapping(candidate)
                    .filter(occupant -> !vacatingIds.contains(occupant.id()))
                    .collectList()
                    .onErrorMap(error -> new SchedulingServiceUnavailableException("Could not read managed events overlapping " + candidate, error))
                    .flatMap(occupants -> Mono.justOrEmpty(decide(candidate, request, conflicts, occupants)));
            });
    }

    private Optional<SlotResult> decide(TimeSlot candidate, SlotRequest request, List<Conflict> conflicts, List<ManagedEvent> occupants) {
        List<Conflict> nonProtected = conflicts.stream()
            .filter(conflict -> !conflict.isProtected())
            .toList();
        boolean protectedConflict = nonProtected.size() < conflicts.size();
        boolean criticalConflict = occupants.stream().anyMatch(ManagedEvent::isCritical);
        List<ManagedEvent> victims = occupants.stream()
            .filter(occupant -> BumpPolicy.mayBump(request.priority(), request.deadline(), occupant))
            .toList();

        if (request.priority().mayForceBooking() && !criticalConflict && !protectedConflict) {
            return Optional.of(Claimed.of(candidate, victims));
        }
        if (!nonProtected.isEmpty() && victims.size() == nonProtected.size()) {
            return Optional.of(Claimed.of(candidate, victims));
        }
        LOGGER.debug("Skipping {} for a {} request: {} conflict(s), {} bumpable, protected={}, critical={}",
            candidate, request.priority().value(), conflicts.size(), victims.size(), protectedConflict, criticalConflict);
        return Optional.empty();
    }

    private Mono<SlotResult> fallback(SlotRequest request, Instant now, WeeklyGrid grid) {
        if (!request.critical()) {
            LOGGER.info("No slot found for a {} request of {} before {}", request.priority().value(), request.duration(), request.searchDeadline());
            return Mono.just(SlotResult.NOT_FOUND);
        }
        SlotCandidates candidates = new SlotCandidates(grid, configuration.zoneId(), configuration.granularity());
        return Mono.fromCallable(() -> candidates.windowStarts(now, now.plus(configuration.criticalFallbackHorizon()), request.duration(), request.excluded())
                .findFirst()
                .<SlotResult>map(candidate -> {
                    LOGGER.warn("No slot available before {} for a critical request, forcing {} in window '{}'",
                        request.searchDeadline(), candidate.slot(), candidate.window().name());
                    return new DoubleBooked(candidate.slot(), SlotResult.DOUBLE_BOOK_WARNING);
                })
                .orElseGet(() -> {
                    LOGGER.warn("No window at all within {} for a critical request", configuration.criticalFallbackHorizon());
                    return SlotResult.NOT_FOUND;
                }));
    }
}
