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

package com.linagora.taskslot.dav;

import javax.net.ssl.SSLException;

import org.apache.commons.configuration2.Configuration;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.linagora.taskslot.engine.CalendarService;
import com.linagora.taskslot.engine.SchedulingConfiguration;

public class CalDavModule extends AbstractModule {

    @Provides
    @Singleton
    public DavConfiguration provideDavConfiguration(Configuration configuration) {
        return DavConfiguration.from(configuration);
    }

    @Provides
    @Singleton
    public CalDavCalendarService provideCalDavCalendarService(DavConfiguration davConfiguration,
                                                              SchedulingConfiguration schedulingConfiguration) throws SSLException {
        return new CalDavCalendarService(davConfiguration, schedulingConfiguration.primaryCalendarId(), schedulingConfiguration.zoneId());
    }

    @Provides
    @Singleton
    public CalendarService provideCalendarService(CalDavCalendarService calDavCalendarService) {
        return calDavCalendarService;
    }
}
