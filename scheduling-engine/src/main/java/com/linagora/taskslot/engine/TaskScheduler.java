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
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import jakarta.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.apache.james.metrics.api.Metric;
import org.apache.james.metrics.api.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.linagora.taskslot.engine.ScheduleCommitter.Booking;
import com.linagora.taskslot.engine.SchedulingLease.Lease;
import com.linagora.taskslot.engine.SchedulingLease.LockAlreadyExistsException;
import com.linagora.taskslot.engine.SessionPlanner.SessionTarget;
import com.linagora.taskslot.engine.SlotRequest.SearchDirection;
import com.linagora.taskslot.engine.SlotResult.Claimed;
import com.linagora.taskslot.engine.SlotResult.Free;
import com.linagora.taskslot.storage.ManagedEventDAO;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.ManagedEventId;
import com.linagora.taskslot.storage.model.Priority;
import com.linagora.taskslot.storage.model.TaskId;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Entry point of the engine for the task approval workflow.
 *
 * <p>Mutating operations run one at a time under the {@link SchedulingLease}. A task that cannot be scheduled
 * yields an empty result; an unreachable calendar or store yields a {@link SchedulingServiceUnavailableException}
 * and leaves no partial booking behind.</p>
 */
public class TaskScheduler {
    public static final String SCHEDULE_DURATION_METRIC = "taskslot.schedule.duration";
    public static final String DOUBLE_BOOK_METRIC = "taskslot.doublebook";
    public static final String DEFAULT_DOMAIN = "Task";

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskScheduler.class);
    private static final Duration LEASE_RETRY_DELAY = Duration.ofMillis(100);

    public record ScheduleTaskRequest(TaskId taskId,
                                      String subject,
                                      String domain,
                                      Optional<Duration> duration,
                                      Priority priority,
                                      Optional<Instant> deadline,
                                      String summary,
                                      String suggestedAction,
                                      boolean criticalHint) {
        public ScheduleTaskRequest {
            Preconditions.checkNotNull(taskId, "'taskId' must not be null");
            Preconditions.checkNotNull(duration, "'duration' must not be null");
            Preconditions.checkNotNull(priority, "'priority' must not be null");
            Preconditions.checkNotNull(deadline, "'deadline' must not be null");
        }
    }

    public record SessionRequest(TaskId taskId,
                                 String subject,
                                 String domain,
                                 int sessionCount,
                                 double cadenceDays,
                                 Optional<Duration> sessionDuration,
                                 Priority priority,
                                 Optional<Instant> deadline,
                                 String summary,
                                 String suggestedAction) {
        public SessionRequest {
            Preconditions.checkNotNull(taskId, "'taskId' must not be null");
            Preconditions.checkArgument(sessionCount > 0, "'sessionCount' must be strictly positive");
            Preconditions.checkNotNull(sessionDuration, "'sessionDuration' must not be null");
            Preconditions.checkNotNull(priority, "'priority' must not be null");
            Preconditions.checkNotNull(deadline, "'deadline' must not be null");
        }
    }

    private final Clock clock;
    private final SlotSearchEngine slotSearchEngine;
    private final ScheduleCommitter scheduleCommitter;
    private final BumpCoordinator bumpCoordinator;
    private final ManagedEventDAO managedEventDAO;
    private final DeadlinePolicy deadlinePolicy;
    private final SessionPlanner sessionPlanner;
    private final SchedulingLease schedulingLease;
    private final SchedulingConfiguration configuration;
    private final MetricFactory metricFactory;
    private final Metric doubleBookMetric;

    @Inject
    public TaskScheduler(Clock clock,
                         SlotSearchEngine slotSearchEngine,
                         ScheduleCommitter scheduleCommitter,
                         BumpCoordinator bumpCoordinator,
                         ManagedEventDAO managedEventDAO,
                         DeadlinePolicy deadlinePolicy,
                         SessionPlanner sessionPlanner,
                         SchedulingLease schedulingLease,
                         SchedulingConfiguration configuration,
                         MetricFactory metricFactory) {
        this.clock = clock;
        this.slotSearchEngine = slotSearchEngine;
        this.scheduleCommitter = scheduleCommitter;
        this.bumpCoordinator = bumpCoordinator;
        this.managedEventDAO = managedEventDAO;
        this.deadlinePolicy = deadlinePolicy;
        this.sessionPlanner = sessionPlanner;
        this.schedulingLease = schedulingLease;
        this.configuration = configuration;
        this.metricFactory = metricFactory;
        this.doubleBookMetric = metricFactory.generate(DOUBLE_BOOK_METRIC);
    }

    /**
     * @return the booking, or an empty result when no slot could be found
     */
    public Mono<ScheduledTask> scheduleTask(ScheduleTaskRequest request) {
        Duration duration = configuration.clampDuration(request.duration());
        Instant deadline = request.deadline()
            .orElseGet(() -> deadlinePolicy.defaultDeadline(request.priority()));
        SlotRequest slotRequest = SlotRequest.forward(duration, request.priority(), deadline)
            .withCriticalHint(request.criticalHint());
        Booking booking = new Booking(request.taskId(), title(request.domain(), request.subject()),
            description(request.summary(), request.suggestedAction()), request.priority(), Optional.of(deadline));

        return Mono.from(metricFactory.decoratePublisherWithTimerMetric(SCHEDULE_DURATION_METRIC,
            underLease(slotSearchEngine.findSlot(slotRequest)
                .flatMap(result -> book(result, booking)))))
            .doOnError(SchedulingServiceUnavailableException.class,
                error -> LOGGER.error("Scheduling of task {} aborted", request.taskId().value(), error));
    }

    /**
     * Books the sessions of a multi-session task. Sessions that cannot be placed are skipped.
     */
    public Mono<List<ScheduledTask>> scheduleSessions(SessionRequest request) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            Instant deadline = request.deadline()
                .orElse(now.plus(SessionPlanner.DEFAULT_DEADLINE_DELAY));
            Duration duration = configuration.clampDuration(request.sessionDuration());
            List<SessionTarget> targets = sessionPlanner.targets(now, deadline, request.sessionCount(), request.cadenceDays());
            List<TimeSlot> booked = new CopyOnWriteArrayList<>();

            return underLease(Flux.fromIterable(targets)
                .concatMap(target -> scheduleSession(request, target, deadline, duration, booked))
                .collectList());
        });
    }

    private Mono<ScheduledTask> scheduleSession(SessionRequest request, SessionTarget target, Instant deadline,
                                                Duration duration, List<TimeSlot> booked) {
        Priority priority = target.escalated() ? Priority.CRITICAL : request.priority();
        List<TimeSlot> excluded = ImmutableList.copyOf(booked);
        SlotRequest backward = new SlotRequest(duration, priority, target.target(), Optional.of(deadline), false,
            Optional.empty(), excluded, SearchDirection.BACKWARD, ImmutableList.of());
        SlotRequest forward = new SlotRequest(duration, priority, deadline, Optional.of(deadline), false,
            Optional.of(target.target()), excluded, SearchDirection.FORWARD, ImmutableList.of());
        Booking booking = new Booking(request.taskId(),
            title(request.domain(), target.label() + ": " + StringUtils.defaultIfBlank(request.subject(), DEFAULT_DOMAIN)),
            description(request.summary(), request.suggestedAction()), priority, Optional.of(deadline));

        return slotSearchEngine.findSlot(backward)
            .filter(result -> result instanceof Free || result instanceof Claimed)
            .switchIfEmpty(Mono.defer(() -> slotSearchEngine.findSlot(forward)))
            .flatMap(result -> book(result, booking))
            .doOnNext(scheduled -> booked.add(scheduled.scheduled()))
            .switchIfEmpty(Mono.<ScheduledTask>fromRunnable(() -> LOGGER.warn("Could not place {} of task {} around {}",
                target.label(), request.taskId().value(), target.target())));
    }

    private Mono<ScheduledTask> book(SlotResult result, Booking booking) {
        if (result instanceof SlotResult.NotFound) {
            LOGGER.info("No slot found for task {} ({})", booking.taskId().value(), booking.priority().value());
            return Mono.empty();
        }
        return scheduleCommitter.commit(result, booking)
            .doOnNext(scheduled -> scheduled.doubleBookWarning()
                .ifPresent(warning -> doubleBookMetric.increment()));
    }

    public Mono<Boolean> undoBump(ManagedEventId managedEventId) {
        return underLease(bumpCoordinator.undoBump(managedEventId));
    }

    /**
     * Deactivates every managed event of the task so that it no longer takes part in searches.
     *
     * @return the number of deactivated events
     */
    public Mono<Long> clearTaskCalendarData(TaskId taskId) {
        return underLease(managedEventDAO.deactivateByTask(taskId, clock.instant())
            .onErrorMap(error -> new SchedulingServiceUnavailableException("Could not clear calendar data of task " + taskId.value(), error))
            .doOnNext(count -> LOGGER.info("Deactivated {} managed event(s) of task {}", count, taskId.value())));
    }

    public Flux<ManagedEvent> bumpHistory() {
        return bumpHistory(ManagedEventDAO.DEFAULT_HISTORY_LIMIT);
    }

    public Flux<ManagedEvent> bumpHistory(int limit) {
        return managedEventDAO.recentlyBumped(limit);
    }

    String title(String domain, String subject) {
        return "[" + StringUtils.defaultIfBlank(domain, DEFAULT_DOMAIN) + "] "
            + StringUtils.left(Objects.toString(subject, ""), configuration.titleMaxLength());
    }

    private String description(String summary, String suggestedAction) {
        return "**Summary:** " + Objects.toString(summary, "") + "\n\n**Action:** " + Objects.toString(suggestedAction, "");
    }

    private <T> Mono<T> underLease(Mono<T> work) {
        return Mono.usingWhen(acquireLease(), lease -> work, schedulingLease::release);
    }

    private Mono<Lease> acquireLease() {
        long attempts = configuration.leaseMaxWait().toMillis() / LEASE_RETRY_DELAY.toMillis();
        return schedulingLease.acquire(configuration.leaseTtl())
            .retryWhen(Retry.fixedDelay(attempts, LEASE_RETRY_DELAY)
                .filter(LockAlreadyExistsException.class::isInstance)
                .onRetryExhaustedThrow((retrySpec, retrySignal) ->
                    new SchedulingServiceUnavailableException("Another scheduling attempt is still in progress", retrySignal.failure())));
    }
}
