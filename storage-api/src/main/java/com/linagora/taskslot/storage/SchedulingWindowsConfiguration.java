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

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import com.linagora.taskslot.storage.model.SchedulingWindow;
import com.linagora.taskslot.storage.model.WindowTier;

/**
 * Weekly availability grid and protected calendar names, read from keys such as:
 *
 * <pre>
 * windows.0.name=Monday Evening
 * windows.0.weekday=1
 * windows.0.start=20:00
 * windows.0.end=21:30
 * windows.0.tier=all
 * windows.0.active=true
 * calendars.protected=ICLOUD,FAMILY
 * </pre>
 */
public record SchedulingWindowsConfiguration(List<SchedulingWindow> windows, List<String> protectedCalendars) {
    public static final String WINDOWS_PREFIX = "windows";
    public static final String PROTECTED_CALENDARS = "calendars.protected";
    public static final SchedulingWindowsConfiguration EMPTY = new SchedulingWindowsConfiguration(List.of(), List.of());

    public static SchedulingWindowsConfiguration parse(Configuration configuration) {
        ImmutableList<SchedulingWindow> windows = windowIndexes(configuration)
            .map(index -> parseWindow(configuration.subset(WINDOWS_PREFIX + "." + index), index))
            .collect(ImmutableList.toImmutableList());

        List<String> protectedCalendars = Optional.ofNullable(configuration.getString(PROTECTED_CALENDARS, null))
            .map(value -> Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value))
            .orElse(List.of());

        return new SchedulingWindowsConfiguration(windows, protectedCalendars);
    }

    private static Stream<Integer> windowIndexes(Configuration configuration) {
        return Streams.stream(configuration.getKeys(WINDOWS_PREFIX))
            .map(key -> StringUtils.substringBetween(key, WINDOWS_PREFIX + ".", "."))
            .filter(StringUtils::isNumeric)
            .map(Integer::parseInt)
            .distinct()
            .sorted();
    }

    private static SchedulingWindow parseWindow(Configuration window, int index) {
        String name = Optional.ofNullable(window.getString("name", null))
            .orElse("window-" + index);
        int weekday = Optional.ofNullable(window.getString("weekday", null))
            .map(Integer::parseInt)
            .orElseThrow(() -> new IllegalArgumentException("'" + WINDOWS_PREFIX + "." + index + ".weekday' is compulsory"));
        LocalTime start = LocalTime.parse(requireValue(window, "start", index));
        LocalTime end = LocalTime.parse(requireValue(window, "end", index));
        WindowTier tier = WindowTier.parse(window.getString("tier", WindowTier.ALL.value()));
        boolean active = window.getBoolean("active", true);

        return new SchedulingWindow(name, SchedulingWindow.weekdayFromIndex(weekday), start, end, tier, active);
    }

    private static String requireValue(Configuration window, String key, int index) {
        return Optional.ofNullable(window.getString(key, null))
            .filter(StringUtils::isNotBlank)
            .orElseThrow(() -> new IllegalArgumentException("'" + WINDOWS_PREFIX + "." + index + "." + key + "' is compulsory"));
    }
}
