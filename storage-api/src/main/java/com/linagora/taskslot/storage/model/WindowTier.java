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

package com.linagora.taskslot.storage.model;

import java.util.Arrays;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

public enum WindowTier {
    ALL("all"),
    CRITICAL_ONLY("critical-only");

    public static WindowTier parse(String value) {
        String normalized = StringUtils.trimToEmpty(value).toLowerCase(Locale.US).replace('_', '-');
        return Arrays.stream(values())
            .filter(tier -> tier.value.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown window tier '" + value + "'"));
    }

    private final String value;

    WindowTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean admits(boolean criticalRequest) {
        return this == ALL || criticalRequest;
    }
}
