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

import java.net.URI;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.apache.james.util.DurationParser;

import com.google.common.base.Preconditions;

/**
 * @param calendarHome path of the collection holding the calendars, for instance {@code /calendars/alice}
 */
public record DavConfiguration(URI baseUrl,
                               String adminUser,
                               String adminPassword,
                               String calendarHome,
                               Optional<Boolean> trustAllSslCerts,
                               Optional<Duration> responseTimeout) {

    public static final String URL = "dav.url";
    public static final String ADMIN_USER = "dav.admin.user";
    public static final String ADMIN_PASSWORD = "dav.admin.password";
    public static final String CALENDAR_HOME = "dav.calendar.home";
    public static final String TRUST_ALL_SSL_CERTS = "dav.trustAllSslCerts";
    public static final String RESPONSE_TIMEOUT = "dav.response.timeout";

    public static boolean isConfigured(Configuration configuration) {
        return StringUtils.isNotBlank(configuration.getString(URL, null));
    }

    public static DavConfiguration from(Configuration configuration) {
        String url = configuration.getString(URL, null);
        Preconditions.checkArgument(StringUtils.isNotBlank(url), "'%s' must be set", URL);
        String adminUser = configuration.getString(ADMIN_USER, null);
        Preconditions.checkArgument(StringUtils.isNotBlank(adminUser), "'%s' must be set", ADMIN_USER);
        String adminPassword = configuration.getString(ADMIN_PASSWORD, null);
        Preconditions.checkArgument(adminPassword != null, "'%s' must be set", ADMIN_PASSWORD);
        String calendarHome = configuration.getString(CALENDAR_HOME, null);
        Preconditions.checkArgument(StringUtils.isNotBlank(calendarHome), "'%s' must be set", CALENDAR_HOME);

        return new DavConfiguration(URI.create(url),
            adminUser,
            adminPassword,
            calendarHome,
            Optional.ofNullable(configuration.getBoolean(TRUST_ALL_SSL_CERTS, null)),
            Optional.ofNullable(configuration.getString(RESPONSE_TIMEOUT, null))
                .map(value -> DurationParser.parse(value, ChronoUnit.SECONDS)));
    }

    public DavConfiguration {
        Preconditions.checkNotNull(baseUrl, "'%s' must not be null", URL);
        Preconditions.checkNotNull(adminUser, "'%s' must not be null", ADMIN_USER);
        Preconditions.checkNotNull(adminPassword, "'%s' must not be null", ADMIN_PASSWORD);
        Preconditions.checkNotNull(calendarHome, "'%s' must not be null", CALENDAR_HOME);
        Preconditions.checkNotNull(trustAllSslCerts, "'%s' must not be null", TRUST_ALL_SSL_CERTS);
        Preconditions.checkNotNull(responseTimeout, "'%s' must not be null", RESPONSE_TIMEOUT);
        calendarHome = "/" + StringUtils.strip(calendarHome, "/");
    }
}
