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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.linagora.taskslot.engine.CalendarService.CalendarEntry;
import com.linagora.taskslot.engine.CalendarService.NewCalendarEntry;
import com.linagora.taskslot.storage.model.TimeSlot;

import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.CalendarParserFactory;
import net.fortuna.ical4j.data.ContentHandlerContext;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Component;
import net.fortuna.ical4j.model.Parameter;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.TimeZoneRegistryImpl;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.Description;
import net.fortuna.ical4j.model.property.DtEnd;
import net.fortuna.ical4j.model.property.DtStart;
import net.fortuna.ical4j.model.property.Duration;
import net.fortuna.ical4j.model.property.ProdId;
import net.fortuna.ical4j.model.property.Uid;
import net.fortuna.ical4j.model.property.immutable.ImmutableCalScale;
import net.fortuna.ical4j.model.property.immutable.ImmutableVersion;
import net.fortuna.ical4j.util.CompatibilityHints;
import net.fortuna.ical4j.util.MapTimeZoneCache;

/**
 * Translates between iCalendar payloads and calendar entries.
 */
public class IcsCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsCodec.class);

    public static final String PRODUCT_ID = "-//Linagora//Taskslot//EN";

    private static final DateTimeFormatter DATE_FORMATTER = new DateTimeFormatterBuilder()
        .appendPattern("yyyyMMdd")
        .toFormatter();
    private static final DateTimeFormatter DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
        .appendPattern("yyyyMMdd'T'HHmmss")
        .toFormatter();
    private static final DateTimeFormatter FLEXIBLE_DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
        .appendPattern("yyyyMMdd'T'HHmmss")
        .optionalStart()
        .appendPattern("X")
        .optionalEnd()
        .toFormatter();

    static {
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_PARSING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_UNFOLDING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_VALIDATION, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_OUTLOOK_COMPATIBILITY, true);

        System.setProperty("net.fortuna.ical4j.timezone.cache.impl", MapTimeZoneCache.class.getName());
    }

    private final ZoneId defaultZone;

    /**
     * @param defaultZone zone of floating times and of all-day dates
     */
    public IcsCodec(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    public Calendar parse(String icsContent) {
        return parse(icsContent.getBytes(StandardCharsets.UTF_8));
    }

    public Calendar parse(byte[] icsContent) {
        CalendarBuilder builder = new CalendarBuilder(
            CalendarParserFactory.getInstance().get(),
            new ContentHandlerContext().withSupressInvalidProperties(true),
            new TimeZoneRegistryImpl());
        try {
            return builder.build(new ByteArrayInputStream(icsContent));
        } catch (IOException e) {
            throw new DavClientException("Error while reading calendar input", e);
        } catch (ParserException e) {
            throw new DavClientException("Error while parsing ICal object", e);
        }
    }

    /**
     * Busy entries of the calendar object. Cancelled and transparent events do not occupy time and are left out.
     */
    public List<CalendarEntry> busyEntries(String resourceName, Calendar calendar) {
        List<VEvent> events = calendar.getComponents(Component.VEVENT);
        return events.stream()
            .filter(this::isBusy)
            .flatMap(vEvent -> toEntry(resourceName, vEvent).stream())
            .collect(ImmutableList.toImmutableList());
    }

    public Optional<CalendarEntry> firstEntry(String resourceName, Calendar calendar) {
        List<VEvent> events = calendar.getComponents(Component.VEVENT);
        return events.stream()
            .flatMap(vEvent -> toEntry(resourceName, vEvent).stream())
            .findFirst();
    }

    public Calendar newCalendar(String uid, NewCalendarEntry entry) {
        VEvent event = new VEvent(entry.slot().start(), entry.slot().end(), entry.title());
        event.add(new Uid(uid));
        event.add(new Description(entry.description()));

        Calendar calendar = new Calendar();
        calendar.add(new ProdId(PRODUCT_ID));
        calendar.add(ImmutableVersion.VERSION_2_0);
        calendar.add(ImmutableCalScale.GREGORIAN);
        calendar.add(event);
        return calendar;
    }

    /**
     * Moves every VEVENT of the calendar object onto the given slot. A DURATION is replaced by an explicit DTEND.
     */
    public Calendar reschedule(Calendar calendar, TimeSlot slot) {
        List<VEvent> events = calendar.getComponents(Component.VEVENT);
        events.forEach(vEvent -> {
            vEvent.getProperty(Property.DTSTART).ifPresent(vEvent::remove);
            vEvent.getProperty(Property.DTEND).ifPresent(vEvent::remove);
            vEvent.getProperty(Property.DURATION).ifPresent(vEvent::remove);
            vEvent.add(new DtStart<>(slot.start()));
            vEvent.add(new DtEnd<>(slot.end()));
        });
        return calendar;
    }

    private boolean isBusy(VEvent vEvent) {
        boolean cancelled = vEvent.getProperty(Property.STATUS)
            .map(Property::getValue)
            .map("CANCELLED"::equalsIgnoreCase)
            .orElse(false);
        boolean transparent = vEvent.getProperty(Property.TRANSP)
            .map(Property::getValue)
            .map("TRANSPARENT"::equalsIgnoreCase)
            .orElse(false);
        return !cancelled && !transparent;
    }

    private Optional<CalendarEntry> toEntry(String resourceName, VEvent vEvent) {
        Optional<ZonedDateTime> start = vEvent.getProperty(Property.DTSTART).flatMap(this::parseTime);
        if (start.isEmpty()) {
            LOGGER.info("Ignoring event {} without a readable DTSTART", resourceName);
            return Optional.empty();
        }
        boolean allDay = isAllDay(vEvent);
        Optional<ZonedDateTime> end = endTime(vEvent, start.get(), allDay);
        if (end.isEmpty() || !end.get().isAfter(start.get())) {
            LOGGER.debug("Ignoring event {} that does not occupy time", resourceName);
            return Optional.empty();
        }
        String title = vEvent.getProperty(Property.SUMMARY).map(Property::getValue).orElse("");
        return Optional.of(new CalendarEntry(resourceName, title,
            new TimeSlot(start.get().toInstant(), end.get().toInstant()), allDay));
    }

    private Optional<ZonedDateTime> endTime(VEvent vEvent, ZonedDateTime start, boolean allDay) {
        return vEvent.getProperty(Property.DTEND)
            .flatMap(this::parseTime)
            .or(() -> vEvent.getProperty(Property.DURATION)
                .map(property -> start.plus(((Duration) property).getDuration())))
            .or(() -> {
                if (allDay) {
                    return Optional.of(start.plusDays(1));
                }
                return Optional.empty();
            });
    }

    Optional<ZonedDateTime> parseTime(Property property) {
        try {
            String value = property.getValue();
            if (isDateType(property)) {
                return Optional.of(LocalDate.from(DATE_FORMATTER.parse(value)).atStartOfDay(defaultZone));
            }
            Optional<ZoneId> tzid = property.getParameter(Parameter.TZID)
                .map(Parameter::getValue)
                .flatMap(this::zoneId);
            if (tzid.isPresent()) {
                return Optional.of(LocalDateTime.parse(value, DATE_TIME_FORMATTER).atZone(tzid.get()));
            }
            TemporalAccessor temporalAccessor = FLEXIBLE_DATE_TIME_FORMATTER.parse(value);
            if (temporalAccessor.isSupported(ChronoField.OFFSET_SECONDS)) {
                return Optional.of(ZonedDateTime.from(temporalAccessor));
            }
            return Optional.of(LocalDateTime.from(temporalAccessor).atZone(defaultZone));
        } catch (DateTimeException e) {
            LOGGER.info("Failed to parse time: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ZoneId> zoneId(String tzid) {
        try {
            return Optional.of(ZoneId.of(tzid));
        } catch (DateTimeException e) {
            LOGGER.debug("Unknown TZID {}, falling back to {}", tzid, defaultZone);
            return Optional.of(defaultZone);
        }
    }

    static boolean isAllDay(VEvent vEvent) {
        return vEvent.getProperty(Property.DTSTART)
            .map(IcsCodec::isDateType)
            .orElse(false);
    }

    static boolean isDateType(Property prop) {
        return prop.getParameter(Parameter.VALUE).map(parameter -> "DATE".equals(parameter.getValue())).orElse(false);
    }
}
