package me.golemcore.turnguard.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict RFC 3339 timestamp parsing for writeback and persona state fields.
 *
 * <p>
 * Accepts {@code YYYY-MM-DD}, a {@code T}, {@code t} or space separator,
 * {@code hh:mm:ss} with an optional fraction of any length, and an offset of
 * {@code Z}, {@code z} or {@code +hh:mm}/{@code -hh:mm}. Seconds and the
 * offset are mandatory. Fraction digits past nanosecond precision are
 * truncated. A leap second ({@code :60}) is read as the last nanosecond of its
 * minute. Offsets outside {@code ±18:00} are rejected.
 */
public final class Rfc3339Timestamps {

    private static final Pattern RFC3339 = Pattern.compile(
            "(\\d{4})-(\\d{2})-(\\d{2})[Tt ](\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d+))?"
                    + "(?:([Zz])|([+-])(\\d{2}):(\\d{2}))");

    private static final int LEAP_SECOND = 60;
    private static final int NANO_DIGITS = 9;
    private static final int LAST_NANO = 999_999_999;

    private Rfc3339Timestamps() {
    }

    /**
     * Parses {@code value}, or returns empty when it is null or not a valid
     * RFC 3339 date-time.
     */
    public static Optional<OffsetDateTime> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = RFC3339.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        try {
            LocalDate date = LocalDate.of(number(matcher, 1), number(matcher, 2), number(matcher, 3));
            int second = number(matcher, 6);
            int nano = nanos(matcher.group(7));
            if (second == LEAP_SECOND) {
                second = 59;
                nano = LAST_NANO;
            }
            LocalTime time = LocalTime.of(number(matcher, 4), number(matcher, 5), second, nano);
            return Optional.of(OffsetDateTime.of(date, time, offset(matcher)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static boolean isValid(String value) {
        return parse(value).isPresent();
    }

    private static ZoneOffset offset(Matcher matcher) {
        if (matcher.group(8) != null) {
            return ZoneOffset.UTC;
        }
        int hours = number(matcher, 10);
        int minutes = number(matcher, 11);
        if (minutes > 59) {
            throw new DateTimeException("offset minutes out of range: " + minutes);
        }
        return "-".equals(matcher.group(9))
                ? ZoneOffset.ofHoursMinutes(-hours, -minutes)
                : ZoneOffset.ofHoursMinutes(hours, minutes);
    }

    private static int nanos(String fraction) {
        if (fraction == null) {
            return 0;
        }
        String digits = fraction.length() > NANO_DIGITS
                ? fraction.substring(0, NANO_DIGITS)
                : fraction + "0".repeat(NANO_DIGITS - fraction.length());
        return Integer.parseInt(digits);
    }

    private static int number(Matcher matcher, int group) {
        return Integer.parseInt(matcher.group(group));
    }
}
