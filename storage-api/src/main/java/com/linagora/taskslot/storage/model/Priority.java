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

/**
 * Task priority, totally ordered by {@link #rank()}: Critical(4) &gt; High(3) &gt; Normal(2) &gt; Low(1).
 */
public enum Priority {
    LOW("Low", 1),
    NORMAL("Normal", 2),
    HIGH("High", 3),
    CRITICAL("Critical", 4);

    private final String value;
    private final int rank;

    Priority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public boolean isHigherThan(Priority other) {
        return rank > other.rank;
    }

    public boolean isLowerThan(Priority other) {
        return rank < other.rank;
    }

    public boolean isCritical() {
        return this == CRITICAL;
    }

    public boolean mayForceBooking() {
        return this == CRITICAL || this == HIGH;
    }
}
