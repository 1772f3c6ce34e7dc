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

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.linagora.taskslot.storage.model.SchedulingWindow;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemorySchedulingWindowDAO implements SchedulingWindowDAO {
    private final List<SchedulingWindow> windows = new CopyOnWriteArrayList<>();

    public MemorySchedulingWindowDAO() {
    }

    public MemorySchedulingWindowDAO(Collection<SchedulingWindow> windows) {
        this.windows.addAll(windows);
    }

    @Override
    public Flux<SchedulingWindow> list() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(windows)));
    }

    @Override
    public Mono<Void> save(SchedulingWindow window) {
        return Mono.fromRunnable(() -> {
            windows.removeIf(existing -> existing.name().equals(window.name()) && existing.weekday() == window.weekday());
            windows.add(window);
        });
    }
}
