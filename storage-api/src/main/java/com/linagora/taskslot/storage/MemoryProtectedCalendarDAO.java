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
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.lang3.StringUtils;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemoryProtectedCalendarDAO implements ProtectedCalendarDAO {
    private final Set<String> names = ConcurrentHashMap.newKeySet();

    public MemoryProtectedCalendarDAO() {
    }

    public MemoryProtectedCalendarDAO(Collection<String> names) {
        names.forEach(name -> this.names.add(normalize(name)));
    }

    @Override
    public Flux<String> list() {
        return Flux.defer(() -> Flux.fromIterable(Set.copyOf(names)));
    }

    @Override
    public Mono<Boolean> isProtected(String calendarName) {
        return Mono.fromCallable(() -> StringUtils.isNotBlank(calendarName) && names.contains(normalize(calendarName)));
    }

    @Override
    public Mono<Void> add(String calendarName) {
        return Mono.fromRunnable(() -> names.add(normalize(calendarName)));
    }

    private static String normalize(String name) {
        return StringUtils.trimToEmpty(name).toUpperCase(Locale.US);
    }
}
