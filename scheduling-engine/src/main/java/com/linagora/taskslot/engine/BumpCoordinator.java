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
import java.util.concurrent.CopyOnWriteArrayList;

import jakarta.inject.Inject;

import org.apache.james.metrics.api.Metric;
import org.apache.james.metrics.api.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.linagora.taskslot.engine.SlotRequest.SearchDirection;
import com.linagora.taskslot.engine.SlotResult.Claimed;
import com.linagora.taskslot.engine.SlotResult.Free;
import com.linagora.taskslot.storage.ManagedEventDAO;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.ManagedEventId;
import com.linagora.taskslot.storage.model.TaskId;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Displaces managed events out of a claimed slot.
 *
 * <p>Relocations are planned first, nested cascades included, then committed in order. When a commit fails the
 * relocations already committed are reverted. A victim that finds no new slot within the relocation horizon is
 * left where it is, and its slot stays off limits for the other victims. A victim whose new slot cannot be fully
 * cleared of its own victims is left where it is too.</p>
 */
public class BumpCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BumpCoordinator.class);

    public record Relocation(ManagedEvent victim, TimeSlot target, TaskId bumpedBy) {
        public ManagedEvent relocated(Instant now) {
            return victim.relocatedTo(target, bumpedBy, now);
        }
    }

    public record BumpPlan(List<Relocation> relocations, List<ManagedEvent> leftInPlace) {
        public static final BumpPlan EMPTY = new BumpPlan(ImmutableList.of(), ImmutableList.of());

        public BumpPlan {
            relocations = ImmutableList.copyOf(relocations);
            leftInPlace = ImmutableList.copyOf(leftInPlace);
        }
    }

    private record PlanState(List<Relocation> relocations,
                             List<ManagedEvent> leftInPlace,
                             List<TimeSlot> claimed,
                             List<ManagedEvent> vacating) {

        PlanState withRelocation(Relocation relocation) {
            return new PlanState(append(relocations, relocation), leftInPlace, append(claimed, relocation.target()), vacating);
        }

        PlanState withLeftInPlace(ManagedEvent victim) {
            List<ManagedEvent> stillVacating = vacating.stream()
                .filter(vacatingEvent -> !vacatingEvent.id().equals(victim.id()))
                .collect(ImmutableList.toImmutableList());
            return new PlanState(relocations, append(leftInPlace, victim), append(claimed, victim.scheduled()), stillVacating);
        }

        PlanState withVacating(List<ManagedEvent> moreVacating) {
            return new PlanState(relocations, leftInPlace, claimed, ImmutableList.<ManagedEvent>builder()
                .addAll(vacating)
                .addAll(moreVacating)
                .build());
        }

        boolean isVacating(ManagedEvent event) {
            return vacating.stream().anyMatch(vacatingEvent -> vacatingEvent.id().equals(event.id()));
        }

        private static <T> List<T> append(List<T> list, T element) {
            return ImmutableList.<T>builder().addAll(list).add(element).build();
        }
    }

    private final Clock clock;
    private final SlotSearchEngine slotSearchEngine;
    private final ManagedEventDAO managedEventDAO;
    private final CalendarService calendarService;
    private final SchedulingConfiguration configuration;
    private final Metric bumpMetric;

    @Inject
    public BumpCoordinator(Clock clock,
                           SlotSearchEngine slotSearchEngine,
                           ManagedEventDAO managedEventDAO,
                           CalendarService calendarService,
                           SchedulingConfiguration configuration,
                           MetricFactory metricFactory) {
        this.clock = clock;
        this.slotSearchEngine = slotSearchEngine;
        this.managedEventDAO = managedEventDAO;
        this.calendarService = calendarService;
        this.configuration = configuration;
        this.bumpMetric = metricFactory.generate("taskslot.bump");
    }

    public Mono<BumpPlan> plan(List<ManagedEvent> victims, TimeSlot claimedSlot, TaskId bumper) {
        if (victims.isEmpty()) {
            return Mono.just(BumpPlan.EMPTY);
        }
        PlanState initial = new PlanState(ImmutableList.of(), ImmutableList.of(), ImmutableList.of(claimedSlot), ImmutableList.copyOf(victims));
        return planAll(victims, bumper, 0, initial)
            .map(state -> new BumpPlan(state.relocations(), state.leftInPlace()));
    }

    private Mono<PlanState> planAll(List<ManagedEvent> victims, TaskId bumper, int depth, PlanState state) {
        if (victims.isEmpty()) {
            return Mono.just(state);
        }
        return planOne(victims.get(0), bumper, depth, state)
            .flatMap(next -> planAll(victims.subList(1, victims.size()), bumper, depth, next));
    }

    private Mono<PlanState> planOne(ManagedEvent victim, TaskId bumper, int depth, PlanState state) {
        SlotRequest request = new SlotRequest(victim.scheduled().duration(),
            victim.priority(),
            clock.instant().plus(configuration.relocationHorizon()),
            victim.deadline(),
            false,
            Optional.empty(),
            state.claimed(),
            SearchDirection.FORWARD,
            state.vacating());

        return slotSearchEngine.findSlot(request)
            .flatMap(result -> {
                if (result instanceof Free free) {
                    return Mono.just(state.withRelocation(new Relocation(victim, free.value(), bumper)));
                }
                if (result instanceof Claimed claimed && !claimed.requiresBumping()) {
                    return Mono.just(state.withRelocation(new Relocation(victim, claimed.value(), bumper)));
                }
                if (result instanceof Claimed claimed && depth < configuration.maxCascadeDepth()) {
                    List<ManagedEvent> nested = claimed.eventsToBump().stream()
                        .filter(event -> !state.isVacating(event))
                        .toList();
                    PlanState withParent = state.withRelocation(new Relocation(victim, claimed.value(), bumper))
                        .withVacating(nested);
                    return planAll(nested, victim.sourceTaskId(), depth + 1, withParent)
                        .map(planned -> {
                            if (planned.leftInPlace().size() > withParent.leftInPlace().size()) {
                                LOGGER.warn("Could not clear {} for {}, leaving it in place", claimed.value(), victim.toShortString());
                                return state.withLeftInPlace(victim);
                            }
                            return planned;
                        });
                }
                LOGGER.warn("Could not relocate {} within {}, leaving it in place", victim.toShortString(), configuration.relocationHorizon());
                return Mono.just(state.withLeftInPlace(victim));
            });
    }

    /**
     * Applies the planned relocations to the calendar and the store.
     *
     * @return the relocated events, or an error of type {@link SchedulingServiceUnavailableException} once every
     * relocation already applied has been reverted
     */
    public Mono<List<ManagedEvent>> commit(BumpPlan plan) {
        return Mono.defer(() -> {
            List<Relocation> committed = new CopyOnWriteArrayList<>();
            return Flux.fromIterable(plan.relocations())
                .concatMap(relocation -> apply(relocation)
                    .doOnNext(relocated -> committed.add(relocation)))
                .collectList()
                .onErrorResume(error -> revert(committed)
                    .then(Mono.error(new SchedulingServiceUnavailableException(
                        "Bump cascade failed after " + committed.size() + " relocation(s), reverted them", error))));
        });
    }

    private Mono<ManagedEvent> apply(Relocation relocation) {
        ManagedEvent victim = relocation.victim();
        ManagedEvent relocated = relocation.relocated(clock.instant());

        return calendarService.patchEvent(configuration.primaryCalendarId(), victim.externalEventId(), relocation.target())
            .then(managedEventDAO.update(relocated)
                .onErrorResume(error -> calendarService.patchEvent(configuration.primaryCalendarId(), victim.externalEventId(), victim.scheduled())
                    .onErrorResume(revertError -> {
                        LOGGER.error("Could not move {} back to {} in the calendar", victim.toShortString(), victim.scheduled(), revertError);
                        return Mono.empty();
                    })
                    .then(Mono.error(error))))
            .then(Mono.fromCallable(() -> {
                bumpMetric.increment();
                LOGGER.info("Relocated {} to {}, bumped by task {}", victim.toShortString(), relocation.target(), relocation.bumpedBy().value());
                return relocated;
            }));
    }

    /**
     * Moves relocated events back to their previous slot, latest relocation first. Failures are logged.
     */
    public Mono<Void> revert(List<Relocation> committed) {
        return Flux.fromIterable(Lists.reverse(ImmutableList.copyOf(committed)))
            .concatMap(relocation -> {
                ManagedEvent victim = relocation.victim();
                return calendarService.patchEvent(configuration.primaryCalendarId(), victim.externalEventId(), victim.scheduled())
                    .then(managedEventDAO.update(victim))
                    .doOnSuccess(any -> LOGGER.info("Reverted relocation of {}", victim.toShortString()))
                    .onErrorResume(error -> {
                        LOGGER.error("Could not revert relocation of {}", victim.toShortString(), error);
                        return Mono.empty();
                    });
            })
            .then();
    }

    public Mono<Boolean> undoBump(ManagedEventId id) {
        return managedEventDAO.find(id)
            .onErrorMap(error -> new SchedulingServiceUnavailableException("Could not read managed event " + id.value(), error))
            .flatMap(event -> {
                if (event.original().isEmpty()) {
                    LOGGER.info("Cannot undo bump of {}: no original interval recorded", event.toShortString());
                    return Mono.just(false);
                }
                ManagedEvent restored = event.restoreOriginal(clock.instant());
                return revertCalendarEntry(event, restored.scheduled())
                    .then(managedEventDAO.update(restored))
                    .onErrorMap(error -> new SchedulingServiceUnavailableException("Could not undo bump of " + id.value(), error))
                    .then(Mono.fromCallable(() -> {
                        LOGGER.info("Restored {} to its original slot {}", event.toShortString(), restored.scheduled());
                        return true;
                    }));
            })
            .defaultIfEmpty(false);
    }

    private Mono<Void> revertCalendarEntry(ManagedEvent event, TimeSlot original) {
        if (event.scheduled().equals(original)) {
            return Mono.empty();
        }
        return calendarService.patchEvent(configuration.primaryCalendarId(), event.externalEventId(), original);
    }
}
