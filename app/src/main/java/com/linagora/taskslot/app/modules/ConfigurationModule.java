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

import org.apache.commons.configuration2.Configuration;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.linagora.taskslot.engine.SchedulingConfiguration;
import com.linagora.taskslot.storage.SchedulingWindowsConfiguration;

public class ConfigurationModule extends AbstractModule {
    private final Configuration configuration;

    public ConfigurationModule(Configuration configuration) {
        this.configuration = configuration;
    }

    @Override
    protected void configure() {
        bind(Configuration.class).toInstance(configuration);
    }

    @Provides
    @Singleton
    SchedulingConfiguration schedulingConfiguration(Configuration configuration) {
        return SchedulingConfiguration.parse(configuration);
    }

    @Provides
    @Singleton
    SchedulingWindowsConfiguration schedulingWindowsConfiguration(Configuration configuration) {
        return SchedulingWindowsConfiguration.parse(configuration);
    }
}
