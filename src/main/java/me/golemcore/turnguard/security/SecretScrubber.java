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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts secret-like tokens from error text before it is logged, persisted in
 * an audit event, or returned as a rejection reason.
 *
 * <p>
 * Handles provider key prefixes ({@code sk-}, {@code ghp_}, {@code xoxb-}, ...)
 * and header/query/JSON markers ({@code Authorization: Bearer},
 * {@code api_key=}, {@code "access_token":"}, ...). The marker and the token
 * that follows it are both replaced by {@value #REDACTED}.
 */
public final class SecretScrubber {

    public static final String REDACTED = "[REDACTED]";
    public static final int MAX_ERROR_CHARS = 200;

    private static final String TOKEN_CHARS = "[A-Za-z0-9\\-_.:+/=]+";

    private static final List<String> PREFIXES = List.of(
            "sk-", "xoxb-", "xoxp-", "xoxs-", "xoxa-", "xapp-", "ghp_", "github_pat_", "hf_", "glpat-", "ya29.",
            "AIza");

    private static final List<String> MARKERS = List.of(
            "Authorization: Bearer ",
            "authorization: bearer ",
            "\"authorization\":\"Bearer ",
            "\"authorization\":\"bearer ",
            "api_key=",
            "access_token=",
            "refresh_token=",
            "id_token=",
            "\"api_key\":\"",
            "\"access_token\":\"",
            "\"refresh_token\":\"",
            "\"id_token\":\"",
            "\"token\":\"");

    private static final List<Pattern> SECRET_PATTERNS = buildPatterns();

    private SecretScrubber() {
    }

    /**
     * Replaces every recognized secret token with {@value #REDACTED}. Bare
     * markers with no token after them are left untouched.
     */
    public static String scrub(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        String scrubbed = input;
        for (Pattern pattern : SECRET_PATTERNS) {
            Matcher matcher = pattern.matcher(scrubbed);
            if (matcher.find()) {
                scrubbed = matcher.replaceAll(Matcher.quoteReplacement(REDACTED));
            }
        }
        return scrubbed;
    }

    /**
     * Scrubs secrets and truncates to {@value #MAX_ERROR_CHARS} characters,
     * appending {@code ...} when truncated.
     */
    public static String sanitizeError(String input) {
        if (input == null) {
            return "";
        }
        String scrubbed = scrub(input);
        int length = scrubbed.codePointCount(0, scrubbed.length());
        if (length <= MAX_ERROR_CHARS) {
            return scrubbed;
        }
        int end = scrubbed.offsetByCodePoints(0, MAX_ERROR_CHARS);
        return scrubbed.substring(0, end) + "...";
    }

    private static List<Pattern> buildPatterns() {
        List<Pattern> patterns = new ArrayList<>();
        for (String prefix : PREFIXES) {
            patterns.add(Pattern.compile(Pattern.quote(prefix) + TOKEN_CHARS));
        }
        for (String marker : MARKERS) {
            patterns.add(Pattern.compile(Pattern.quote(marker) + TOKEN_CHARS));
        }
        return List.copyOf(patterns);
    }
}
