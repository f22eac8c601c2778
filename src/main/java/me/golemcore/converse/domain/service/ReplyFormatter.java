package me.golemcore.converse.domain.service;

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

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns generated markdown into plain chat text.
 *
 * <p>
 * Chat clients render asterisks and underscores literally, so emphasis,
 * headers, code fences and strikethrough are removed, links become
 * {@code text (url)} and bullets become {@code •}.
 */
@Component
public class ReplyFormatter {

    private static final Pattern HEADER = Pattern.compile("(?m)^#{1,6}\\s*(.+)$");
    private static final Pattern BOLD_ITALIC = Pattern.compile("\\*\\*\\*([^*]+)\\*\\*\\*");
    private static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("\\*([^*\\n]+)\\*");
    private static final Pattern UNDERLINE_BOLD = Pattern.compile("__([^_]+)__");
    private static final Pattern UNDERLINE_ITALIC = Pattern.compile("_([^_\\n]+)_");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\(([^)]+)\\)");
    private static final Pattern DASH_BULLET = Pattern.compile("(?m)^-\\s+");
    private static final Pattern STAR_BULLET = Pattern.compile("(?m)^\\*\\s+");
    private static final Pattern NUMBERED = Pattern.compile("(?m)^(\\d+)\\.\\s+");
    private static final Pattern CODE_BLOCK = Pattern.compile("```\\w*\\n?([\\s\\S]*?)```");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern STRIKETHROUGH = Pattern.compile("~~([^~]+)~~");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern SPACES = Pattern.compile(" {2,}");

    public String format(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = text;
        result = HEADER.matcher(result).replaceAll("$1");
        result = BOLD_ITALIC.matcher(result).replaceAll("$1");
        result = BOLD.matcher(result).replaceAll("$1");
        // Bullets before single-star emphasis, otherwise "* a *b*" loses its marker.
        result = STAR_BULLET.matcher(result).replaceAll("• ");
        result = ITALIC.matcher(result).replaceAll("$1");
        result = UNDERLINE_BOLD.matcher(result).replaceAll("$1");
        result = UNDERLINE_ITALIC.matcher(result).replaceAll("$1");
        result = LINK.matcher(result).replaceAll("$1 ($2)");
        result = DASH_BULLET.matcher(result).replaceAll("• ");
        result = NUMBERED.matcher(result).replaceAll("$1. ");
        result = CODE_BLOCK.matcher(result).replaceAll("$1");
        result = INLINE_CODE.matcher(result).replaceAll("$1");
        result = STRIKETHROUGH.matcher(result).replaceAll("$1");
        result = result.replace("*", "");
        result = BLANK_LINES.matcher(result).replaceAll("\n\n");
        result = SPACES.matcher(result).replaceAll(" ");
        return result.trim();
    }
}
