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

import com.linagora.taskslot.storage.model.ManagedEvent;
import com.linagora.taskslot.storage.model.ManagedEventId;
import com.linagora.taskslot.storage.model.TaskId;
import com.linagora.taskslot.storage.model.TimeSlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ManagedEventDAO {
    int DEFAULT_HISTORY_LIMIT = 10;

    Mono<ManagedEvent> find(ManagedEventId id);

    Mono<Void> insert(ManagedEvent event);

    Mono<Void> update(ManagedEvent event);

    Flux<ManagedEvent> findActiveOverlapping(TimeSlot slot); // ordered by scheduled start

    Flux<ManagedEvent> findActiveByTask(TaskId taskId);

    /**
     * @return the number of events that were switched to inactive
     */
    Mono<Long> deactivateByTask(TaskId taskId, Instant updatedAt);

    /**
     * Active events that were displaced by another task, most recently updated first.
     */
    Flux<ManagedEvent> recentlyBumped(int limit);

    Mono<Long> countActive();
}
