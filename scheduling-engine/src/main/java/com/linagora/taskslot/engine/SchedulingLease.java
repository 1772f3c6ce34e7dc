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

import java.time.Duration;
import java.time.Instant;

import reactor.core.publisher.Mono;

/**
 * Serialises scheduling attempts so that two approvals cannot book the same free slot concurrently.
 */
public interface SchedulingLease {

    record Lease(String owner, Instant expiresAt) {
    }

    /**
     * @return an error of type {@link LockAlreadyExistsException} while another unexpired lease is held
     */
    Mono<Lease> acquire(Duration ttl);

    Mono<Void> release(Lease lease);

    class LockAlreadyExistsException extends RuntimeException {
        public LockAlreadyExistsException(Instant heldUntil) {
            super("Scheduling lease is held until " + heldUntil);
        }
    }

    SchedulingLease NOOP = new NoOpSchedulingLease();

    class NoOpSchedulingLease implements SchedulingLease {

        @Override
        public Mono<Lease> acquire(Duration ttl) {
            return Mono.just(new Lease("noop", Instant.MAX));
        }

        @Override
        public Mono<Void> release(Lease lease) {
            return Mono.empty();
        }
    }
}
