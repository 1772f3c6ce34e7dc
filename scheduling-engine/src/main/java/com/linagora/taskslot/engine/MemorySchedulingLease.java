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
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.inject.Inject;

import reactor.core.publisher.Mono;

/**
 * Lease guarding a single JVM. An expired lease may be taken over.
 */
public class MemorySchedulingLease implements SchedulingLease {
    private final Clock clock;
    private final AtomicReference<Lease> current = new AtomicReference<>();

    @Inject
    public MemorySchedulingLease(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Lease> acquire(Duration ttl) {
        return Mono.fromCallable(() -> {
            Lease candidate = new Lease(UUID.randomUUID().toString(), clock.instant().plus(ttl));
            Lease held = current.get();
            if (held != null && held.expiresAt().isAfter(clock.instant())) {
                throw new LockAlreadyExistsException(held.expiresAt());
            }
            if (!current.compareAndSet(held, candidate)) {
                throw new LockAlreadyExistsException(candidate.expiresAt());
            }
            return candidate;
        });
    }

    @Override
    public Mono<Void> release(Lease lease) {
        return Mono.fromRunnable(() -> current.compareAndSet(lease, null));
    }
}
