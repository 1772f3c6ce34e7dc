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

package com.linagora.taskslot.app;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConfigurationException;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.linagora.taskslot.app.modules.CalendarServiceModule;
import com.linagora.taskslot.app.modules.ConfigurationModule;
import com.linagora.taskslot.app.modules.SchedulingEngineModule;
import com.linagora.taskslot.engine.TaskScheduler;
import com.linagora.taskslot.storage.MemoryStorageModule;

public class TaskSlotApplication {

    public static TaskSlotApplication fromDefaultConfiguration() throws ConfigurationException {
        return new TaskSlotApplication(ConfigurationLoader.load());
    }

    private final Injector injector;

    public TaskSlotApplication(Configuration configuration, Module... overrides) {
        Module base = Modules.combine(
            new ConfigurationModule(configuration),
            new MemoryStorageModule(),
            new SchedulingEngineModule(),
            CalendarServiceModule.forConfiguration(configuration));
        this.injector = Guice.createInjector(Modules.override(base).with(overrides));
    }

    public TaskScheduler taskScheduler() {
        return injector.getInstance(TaskScheduler.class);
    }

    public <T> T getInstance(Class<T> type) {
        return injector.getInstance(type);
    }
}
