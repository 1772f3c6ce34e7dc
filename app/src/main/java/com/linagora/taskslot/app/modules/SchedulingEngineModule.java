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

package com.linagora.taskslot.app.modules;

import java.time.Clock;

import org.apache.james.metrics.api.MetricFactory;
import org.apache.james.metrics.api.NoopMetricFactory;

import com.google.inject.AbstractModule;
import com.google.inject.Scopes;
import com.linagora.taskslot.engine.AvailabilityWindows;
import com.linagora.taskslot.engine.BumpCoordinator;
import com.linagora.taskslot.engine.ConflictProbe;
import com.linagora.taskslot.engine.DeadlinePolicy;
import com.linagora.taskslot.engine.MemorySchedulingLease;
import com.linagora.taskslot.engine.ScheduleCommitter;
import com.linagora.taskslot.engine.SchedulingLease;
import com.linagora.taskslot.engine.SessionPlanner;
import com.linagora.taskslot.engine.SlotSearchEngine;
import com.linagora.taskslot.engine.TaskScheduler;

public class SchedulingEngineModule extends AbstractModule {
    @Override
    protected void configure() {
        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(MetricFactory.class).to(NoopMetricFactory.class);
        bind(NoopMetricFactory.class).in(Scopes.SINGLETON);

        bind(MemorySchedulingLease.class).in(Scopes.SINGLETON);
        bind(SchedulingLease.class).to(MemorySchedulingLease.class);

        bind(AvailabilityWindows.class).in(Scopes.SINGLETON);
        bind(ConflictProbe.class).in(Scopes.SINGLETON);
        bind(SlotSearchEngine.class).in(Scopes.SINGLETON);
        bind(BumpCoordinator.class).in(Scopes.SINGLETON);
        bind(ScheduleCommitter.class).in(Scopes.SINGLETON);
        bind(DeadlinePolicy.class).in(Scopes.SINGLETON);
        bind(SessionPlanner.class).in(Scopes.SINGLETON);
        bind(TaskScheduler.class).in(Scopes.SINGLETON);
    }
}
