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

import java.time.DayOfWeek;
import java.util.List;

import jakarta.inject.Inject;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.linagora.taskslot.storage.SchedulingWindowDAO;
import com.linagora.taskslot.storage.model.SchedulingWindow;

import reactor.core.publisher.Mono;

public class AvailabilityWindows {

    /**
     * Immutable snapshot of the windows a request may use, per weekday, in ascending start order.
     */
    public record WeeklyGrid(ImmutableListMultimap<DayOfWeek, SchedulingWindow> windows) {
        public static final WeeklyGrid EMPTY = new WeeklyGrid(ImmutableListMultimap.of());

        public static WeeklyGrid of(List<SchedulingWindow> admitted) {
            return new WeeklyGrid(admitted.stream()
                .sorted(SchedulingWindow.BY_START)
                .collect(ImmutableListMultimap.toImmutableListMultimap(SchedulingWindow::weekday, window -> window)));
        }

        public List<SchedulingWindow> windowsFor(DayOfWeek dayOfWeek) {
            return windows.get(dayOfWeek);
        }

        public boolean isEmpty() {
            return windows.isEmpty();
        }
    }

    private final SchedulingWindowDAO schedulingWindowDAO;

    @Inject
    public AvailabilityWindows(SchedulingWindowDAO schedulingWindowDAO) {
        this.schedulingWindowDAO = schedulingWindowDAO;
    }

    /**
     * Active windows of that weekday the request may use, ordered by start time. Critical-only windows are
     * kept for critical requests only. An empty list means no availability that day.
     */
    public Mono<List<SchedulingWindow>> windowsFor(DayOfWeek dayOfWeek, boolean criticalRequest) {
        return schedulingWindowDAO.list()
            .filter(window -> window.weekday() == dayOfWeek)
            .filter(window -> window.admits(criticalRequest))
            .sort(SchedulingWindow.BY_START)
            .collect(ImmutableList.toImmutableList());
    }

    public Mono<WeeklyGrid> weeklyGrid(boolean criticalRequest) {
        return schedulingWindowDAO.list()
            .filter(window -> window.admits(criticalRequest))
            .collectList()
            .map(WeeklyGrid::of);
    }
}
