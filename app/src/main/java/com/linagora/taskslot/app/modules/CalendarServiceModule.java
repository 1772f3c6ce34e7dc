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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.AbstractModule;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.linagora.taskslot.dav.CalDavModule;
import com.linagora.taskslot.dav.DavConfiguration;
import com.linagora.taskslot.engine.CalendarService;
import com.linagora.taskslot.engine.CalendarService.CalendarInfo;
import com.linagora.taskslot.engine.MemoryCalendarService;
import com.linagora.taskslot.engine.SchedulingConfiguration;

/**
 * CalDAV when {@value DavConfiguration#URL} is set, an in-memory calendar holding only the primary calendar otherwise.
 */
public class CalendarServiceModule {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarServiceModule.class);

    public static class MemoryCalendarModule extends AbstractModule {
        @Provides
        @Singleton
        MemoryCalendarService memoryCalendarService(SchedulingConfiguration configuration) {
            return new MemoryCalendarService()
                .addCalendar(new CalendarInfo(configuration.primaryCalendarId(), configuration.primaryCalendarId(), true));
        }

        @Provides
        @Singleton
        CalendarService calendarService(MemoryCalendarService memoryCalendarService) {
            return memoryCalendarService;
        }
    }

    public static Module forConfiguration(Configuration configuration) {
        if (DavConfiguration.isConfigured(configuration)) {
            LOGGER.info("Using the CalDAV calendar service");
            return new CalDavModule();
        }
        LOGGER.warn("'{}' is not set, using an in-memory calendar service", DavConfiguration.URL);
        return new MemoryCalendarModule();
    }
}
