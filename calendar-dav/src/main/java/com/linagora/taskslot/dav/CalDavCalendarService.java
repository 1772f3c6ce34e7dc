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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

import javax.net.ssl.SSLException;

import org.apache.commons.lang3.StringUtils;
import org.apache.james.util.ReactorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.taskslot.dav.DavXmlParser.DavResource;
import com.linagora.taskslot.engine.CalendarEntryNotFoundException;
import com.linagora.taskslot.engine.CalendarService;
import com.linagora.taskslot.storage.model.TimeSlot;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import net.fortuna.ical4j.model.Calendar;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * {@link CalendarService} backed by a CalDAV server. Calendars are the collections found under the configured
 * calendar home, entries are calendar objects named after their UID.
 */
public class CalDavCalendarService extends DavClient implements CalendarService {

    public static class RetriableDavClientException extends DavClientException {
        public RetriableDavClientException(String message) {
            super(message);
        }
    }

    private record DavCalendarObject(String etag, Calendar calendarData) {
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(CalDavCalendarService.class);
    private static final String CONTENT_TYPE_XML = "application/xml";
    private static final String CONTENT_TYPE_CALENDAR = "text/calendar; charset=utf-8";
    private static final HttpMethod PROPFIND_METHOD = HttpMethod.valueOf("PROPFIND");
    private static final HttpMethod REPORT_METHOD = HttpMethod.valueOf("REPORT");
    private static final DateTimeFormatter CALDAV_UTC_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
        .withZone(ZoneOffset.UTC);
    private static final int MAX_UPDATE_RETRIES = 3;
    private static final Duration UPDATE_RETRY_BACKOFF = Duration.ofMillis(100);

    private static final String LIST_CALENDARS_BODY = """
        <d:propfind xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
          <d:prop>
            <d:displayname/>
            <d:resourcetype/>
          </d:prop>
        </d:propfind>
        """;

    private static final String CALENDAR_QUERY_BODY = """
        <c:calendar-query xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
          <d:prop>
            <d:getetag/>
            <c:calendar-data>
              <c:expand start="%1$s" end="%2$s"/>
            </c:calendar-data>
          </d:prop>
          <c:filter>
            <c:comp-filter name="VCALENDAR">
              <c:comp-filter name="VEVENT">
                <c:time-range start="%1$s" end="%2$s"/>
              </c:comp-filter>
            </c:comp-filter>
          </c:filter>
        </c:calendar-query>
        """;

    private final String primaryCalendarId;
    private final IcsCodec icsCodec;

    public CalDavCalendarService(DavConfiguration config, String primaryCalendarId, ZoneId zoneId) throws SSLException {
        super(config);
        this.primaryCalendarId = primaryCalendarId;
        this.icsCodec = new IcsCodec(zoneId);
    }

    @Override
    public Flux<CalendarInfo> listCalendars() {
        String uri = config.calendarHome() + "/";
        return authenticationByAdmin()
            .headers(headers -> headers.add(HttpHeaderNames.CONTENT_TYPE, CONTENT_TYPE_XML)
                .add("Depth", "1"))
            .request(PROPFIND_METHOD)
            .uri(uri)
            .send(Mono.just(Unpooled.wrappedBuffer(LIST_CALENDARS_BODY.getBytes(StandardCharsets.UTF_8))))
            .responseSingle((response, responseContent) -> {
                if (response.status().code() == 207) {
                    return responseContent.asByteArray();
                }
                return unexpectedStatus(response.status().code(), responseContent.asString(StandardCharsets.UTF_8),
                    "listing calendars of '" + uri + "'");
            })
            .flatMapIterable(DavXmlParser::parseMultistatus)
            .filter(DavResource::calendar)
            .map(this::toCalendarInfo);
    }

    private CalendarInfo toCalendarInfo(DavResource resource) {
        String id = resource.resourceName();
        return new CalendarInfo(id, resource.displayName().orElse(id), id.equals(primaryCalendarId));
    }

    @Override
    public Flux<CalendarEntry> listBusy(String calendarId, TimeSlot range) {
        String uri = calendarUri(calendarId);
        String body = CALENDAR_QUERY_BODY.formatted(CALDAV_UTC_FORMATTER.format(range.start()), CALDAV_UTC_FORMATTER.format(range.end()));
        return authenticationByAdmin()
            .headers(headers -> headers.add(HttpHeaderNames.CONTENT_TYPE, CONTENT_TYPE_XML)
                .add("Depth", "1"))
            .request(REPORT_METHOD)
            .uri(uri)
            .send(Mono.just(Unpooled.wrappedBuffer(body.getBytes(StandardCharsets.UTF_8))))
            .responseSingle((response, responseContent) -> {
                if (response.status().code() == 207) {
                    return responseContent.asByteArray();
                }
                return unexpectedStatus(response.status().code(), responseContent.asString(StandardCharsets.UTF_8),
                    "querying calendar '" + uri + "'");
            })
            .flatMapIterable(DavXmlParser::parseMultistatus)
            .filter(resource -> resource.calendarData().isPresent())
            .flatMapIterable(resource -> icsCodec.busyEntries(resource.resourceName(), icsCodec.parse(resource.calendarData().get())))
            .filter(entry -> entry.slot().overlaps(range));
    }

    @Override
    public Mono<CreatedEntry> createEvent(String calendarId, NewCalendarEntry entry) {
        String eventId = UUID.randomUUID().toString();
        String uri = eventUri(calendarId, eventId);
        byte[] calendarData = icsCodec.newCalendar(eventId, entry).toString().getBytes(StandardCharsets.UTF_8);
        return authenticationByAdmin()
            .headers(headers -> headers.add(HttpHeaderNames.CONTENT_TYPE, CONTENT_TYPE_CALENDAR)
                .add(HttpHeaderNames.IF_NONE_MATCH, "*"))
            .request(HttpMethod.PUT)
            .uri(uri)
            .send(Mono.just(Unpooled.wrappedBuffer(calendarData)))
            .responseSingle((response, responseContent) -> {
                switch (response.status().code()) {
                    case 201:
                    case 204:
                        return ReactorUtils.logAsMono(() -> LOGGER.info("Calendar object '{}' created successfully.", uri))
                            .thenReturn(new CreatedEntry(eventId, config.baseUrl().resolve(uri).toString()));
                    default:
                        return unexpectedStatus(response.status().code(), responseContent.asString(StandardCharsets.UTF_8),
                            "creating calendar object '" + uri + "'");
                }
            });
    }

    @Override
    public Mono<Void> patchEvent(String calendarId, String eventId, TimeSlot slot) {
        String uri = eventUri(calendarId, eventId);
        return Mono.defer(() -> fetch(uri)
                .switchIfEmpty(Mono.error(() -> new CalendarEntryNotFoundException(calendarId, eventId)))
                .flatMap(calendarObject -> update(uri, calendarObject.etag(), icsCodec.reschedule(calendarObject.calendarData(), slot))))
            .retryWhen(Retry.backoff(MAX_UPDATE_RETRIES, UPDATE_RETRY_BACKOFF)
                .filter(RetriableDavClientException.class::isInstance)
                .onRetryExhaustedThrow((retryBackoffSpec, retrySignal) -> retrySignal.failure()));
    }

    @Override
    public Mono<CalendarEntry> getEvent(String calendarId, String eventId) {
        return fetch(eventUri(calendarId, eventId))
            .flatMap(calendarObject -> Mono.justOrEmpty(icsCodec.firstEntry(eventId, calendarObject.calendarData())));
    }

    @Override
    public Mono<Void> deleteEvent(String calendarId, String eventId) {
        String uri = eventUri(calendarId, eventId);
        return authenticationByAdmin()
            .request(HttpMethod.DELETE)
            .uri(uri)
            .responseSingle((response, responseContent) ->
                switch (response.status().code()) {
                    case 200, 204 -> Mono.empty();
                    case 404 -> ReactorUtils.logAsMono(() -> LOGGER.info("Calendar object '{}' not found, nothing to delete.", uri));
                    default -> unexpectedStatus(response.status().code(), responseContent.asString(StandardCharsets.UTF_8),
                        "deleting calendar object '" + uri + "'");
                });
    }

    private Mono<DavCalendarObject> fetch(String uri) {
        return authenticationByAdmin()
            .headers(headers -> headers.add(HttpHeaderNames.ACCEPT, "text/calendar"))
            .request(HttpMethod.GET)
            .uri(uri)
            .responseSingle((response, responseContent) -> {
                switch (response.status().code()) {
                    case 200:
                        String etag = StringUtils.defaultString(response.responseHeaders().get(HttpHeaderNames.ETAG));
                        return responseContent.asByteArray()
                            .map(bytes -> new DavCalendarObject(etag, icsCodec.parse(bytes)));
                    case 404:
                        return ReactorUtils.logAsMono(() -> LOGGER.debug("Calendar object '{}' not found", uri))
                            .then(Mono.<DavCalendarObject>empty());
                    default:
                        return unexpectedStatus(response.status().code(), responseContent.asString(StandardCharsets.UTF_8),
                            "reading calendar object '" + uri + "'");
                }
            });
    }

    private Mono<Void> update(String uri, String etag, Calendar calendarData) {
        return authenticationByAdmin()
            .headers(headers -> {
                headers.add(HttpHeaderNames.CONTENT_TYPE, CONTENT_TYPE_CALENDAR);
                if (StringUtils.isNotEmpty(etag)) {
                    headers.add(HttpHeaderNames.IF_MATCH, etag);
                }
            })
            .request(HttpMethod.PUT)
            .uri(uri)
            .send(Mono.just(Unpooled.wrappedBuffer(calendarData.toString().getBytes(StandardCharsets.UTF_8))))
            .responseSingle((response, responseContent) ->
                switch (response.status().code()) {
                    case 200, 201, 204 -> ReactorUtils.logAsMono(() -> LOGGER.info("Calendar object '{}' updated successfully.", uri));
                    case 404 -> Mono.error(new DavClientException("Calendar object '" + uri + "' disappeared while being updated"));
                    case 412 -> Mono.error(new RetriableDavClientException(String.format(
                        "Precondition failed (ETag mismatch) when updating calendar object '%s'. Retry may be needed.", uri)));
                    default -> unexpectedStatus(response.status().code(), responseContent.asString(StandardCharsets.UTF_8),
                        "updating calendar object '" + uri + "'");
                });
    }

    private <T> Mono<T> unexpectedStatus(int status, Mono<String> responseBody, String action) {
        return responseBody
            .switchIfEmpty(Mono.just(StringUtils.EMPTY))
            .flatMap(body -> Mono.error(new DavClientException("""
                Unexpected status code: %d when %s
                %s
                """.formatted(status, action, body))));
    }

    private String calendarUri(String calendarId) {
        return config.calendarHome() + "/" + calendarId + "/";
    }

    private String eventUri(String calendarId, String eventId) {
        return config.calendarHome() + "/" + calendarId + "/" + eventId + ".ics";
    }
}
