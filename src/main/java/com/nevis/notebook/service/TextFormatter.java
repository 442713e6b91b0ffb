package com.nevis.notebook.service;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Rule-based cleanup of extracted text. Removes layout noise without touching
 * the wording.
 */
@Component
public class TextFormatter {

    private static final Pattern TRAILING_BLANKS = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern BROKEN_CJK_LINE = Pattern.compile(
        "([\\p{IsHan}\\p{IsHiragana}\\p{IsKatakana}])\\n([\\p{IsHan}\\p{IsHiragana}\\p{IsKatakana}])");
    private static final Pattern DASHED_PAGE_NUMBER = Pattern.compile("\\n\\s*-\\s*\\d+\\s*-\\s*\\n");
    private static final Pattern FRACTION_PAGE_NUMBER = Pattern.compile("\\n\\s*\\d+\\s*/\\s*\\d+\\s*\\n");
    private static final Pattern PAGE_LABEL = Pattern.compile("\\n\\s*Page\\s*\\d+\\s*\\n", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_DOT_LABEL = Pattern.compile("\\n\\s*P\\.\\s*\\d+\\s*\\n");
    private static final Pattern SPACE_RUNS = Pattern.compile("[ \\t]{2,}");

    public String format(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return "";
        }

        String text = rawText.replace("\r\n", "\n").replace('\r', '\n');
        text = TRAILING_BLANKS.matcher(text).replaceAll("");
        text = EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
        text = BROKEN_CJK_LINE.matcher(text).replaceAll("$1$2");
        text = DASHED_PAGE_NUMBER.matcher(text).replaceAll("\n");
        text = FRACTION_PAGE_NUMBER.matcher(text).replaceAll("\n");
        text = PAGE_LABEL.matcher(text).replaceAll("\n");
        text = P_DOT_LABEL.matcher(text).replaceAll("\n");
        text = SPACE_RUNS.matcher(text).replaceAll(" ");
        return text.strip();
    }

    public String format(String rawText, int maxChars) {
        String formatted = format(rawText);
        return formatted.length() > maxChars ? formatted.substring(0, maxChars) : formatted;
    }
}
