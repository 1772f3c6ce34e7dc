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

package com.linagora.taskslot.storage;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.base.Preconditions;
import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.ManagedEventId;
import com.linagora.taskslot.storage.model.TaskId;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemoryManagedEventDAO implements ManagedEventDAO {
    private final Map<ManagedEventId, ManagedEvent> store = new ConcurrentHashMap<>();

    @Override
    public Mono<ManagedEvent> find(ManagedEventId id) {
        return Mono.fromCallable(() -> store.get(id));
    }

    @Override
    public Mono<Void> insert(ManagedEvent event) {
        return Mono.fromCallable(() -> store.putIfAbsent(event.id(), event))
            .flatMap(previous -> Mono.<Void>error(new IllegalStateException("Managed event " + event.id().value() + " already exists")));
    }

    @Override
    public Mono<Void> update(ManagedEvent event) {
        return Mono.fromCallable(() -> store.computeIfPresent(event.id(), (id, previous) -> event))
            .switchIfEmpty(Mono.error(() -> new ManagedEventNotFoundException(event.id())))
            .then();
    }

    @Override
    public Flux<ManagedEvent> findActiveOverlapping(TimeSlot slot) {
        return Flux.defer(() -> Flux.fromStream(store.values().stream()
            .filter(ManagedEvent::active)
            .filter(event -> event.overlaps(slot))
            .sorted(Comparator.comparing(ManagedEvent::scheduled))));
    }

    @Override
    public Flux<ManagedEvent> findActiveByTask(TaskId taskId) {
        return Flux.defer(() -> Flux.fromStream(store.values().stream()
            .filter(ManagedEvent::active)
            .filter(event -> event.sourceTaskId().equals(taskId))
            .sorted(Comparator.comparing(ManagedEvent::scheduled))));
    }

    @Override
    public Mono<Long> deactivateByTask(TaskId taskId, Instant updatedAt) {
        return Mono.fromCallable(() -> {
            List<ManagedEvent> owned = store.values().stream()
                .filter(ManagedEvent::active)
                .filter(event -> event.sourceTaskId().equals(taskId))
                .toList();
            owned.forEach(event -> store.put(event.id(), event.deactivated(updatedAt)));
            return (long) owned.size();
        });
    }

    @Override
    public Flux<ManagedEvent> recentlyBumped(int limit) {
        Preconditions.checkArgument(limit > 0, "'limit' must be strictly positive");
        return Flux.defer(() -> Flux.fromStream(store.values().stream()
            .filter(ManagedEvent::active)
            .filter(event -> event.bumpedBy().isPresent())
            .sorted(Comparator.comparing(ManagedEvent::updatedAt).reversed())
            .limit(limit)));
    }

    @Override
    public Mono<Long> countActive() {
        return Mono.fromCallable(() -> store.values().stream()
            .filter(ManagedEvent::active)
            .count());
    }
}
