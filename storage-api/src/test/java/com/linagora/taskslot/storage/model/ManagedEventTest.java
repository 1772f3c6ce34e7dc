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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class ManagedEventTest {
    private static final Instant NOW = Instant.parse("2026-02-23T08:00:00Z");
    private static final TimeSlot MONDAY_NINE = TimeSlot.of(Instant.parse("2026-02-23T09:00:00Z"), Duration.ofMinutes(30));
    private static final TimeSlot TUESDAY_TWO_PM = TimeSlot.of(Instant.parse("2026-02-24T14:00:00Z"), Duration.ofMinutes(30));
    private static final TaskId BUMPER = new TaskId("bumper");

    private final ManagedEvent booked = ManagedEvent.booked(new ManagedEventId("1"), new TaskId("task"), "ext-1", "[work] report",
        MONDAY_NINE, Priority.NORMAL, Optional.empty(), NOW);

    @Test
    void bookedEventShouldRecordScheduledSlotAsOriginal() {
        assertThat(booked.original()).contains(MONDAY_NINE);
        assertThat(booked.bumpCount()).isZero();
        assertThat(booked.bumpedBy()).isEmpty();
        assertThat(booked.active()).isTrue();
    }

    @Test
    void relocatedToShouldRecordLineage() {
        ManagedEvent relocated = booked.relocatedTo(TUESDAY_TWO_PM, BUMPER, NOW.plusSeconds(1));

        assertThat(relocated.scheduled()).isEqualTo(TUESDAY_TWO_PM);
        assertThat(relocated.original()).contains(MONDAY_NINE);
        assertThat(relocated.bumpCount()).isEqualTo(1);
        assertThat(relocated.bumpedBy()).contains(BUMPER);
        assertThat(relocated.updatedAt()).isEqualTo(NOW.plusSeconds(1));
    }

    @Test
    void restoreOriginalShouldUndoOneBump() {
        ManagedEvent restored = booked.relocatedTo(TUESDAY_TWO_PM, BUMPER, NOW).restoreOriginal(NOW);

        assertThat(restored.scheduled()).isEqualTo(MONDAY_NINE);
        assertThat(restored.bumpCount()).isZero();
        assertThat(restored.bumpedBy()).isEmpty();
    }

    @Test
    void restoreOriginalShouldNotDecrementBelowZero() {
        assertThat(booked.restoreOriginal(NOW).bumpCount()).isZero();
    }

    @Test
    void restoreOriginalShouldFailWithoutOriginal() {
        ManagedEvent withoutOriginal = new ManagedEvent(new ManagedEventId("2"), new TaskId("task"), "ext-2", "title",
            TUESDAY_TWO_PM, Priority.LOW, Optional.empty(), Optional.empty(), Optional.empty(), 0, true, NOW);

        assertThatThrownBy(() -> withoutOriginal.restoreOriginal(NOW))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void negativeBumpCountShouldBeRejected() {
        assertThatThrownBy(() -> new ManagedEvent(new ManagedEventId("2"), new TaskId("task"), "ext-2", "title",
            TUESDAY_TWO_PM, Priority.LOW, Optional.empty(), Optional.empty(), Optional.empty(), -1, true, NOW))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toShortStringShouldExposeIdentifiers() {
        assertThat(booked.toShortString())
            .contains("id=1")
            .contains("task=task")
            .contains("priority=Normal");
    }
}
