package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.types.CategoryInfo;
import com.shadowcollector.label_storage.util.S3Paths;

import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes canonical destination keys.
 * <p>
 * The current month comes from the injected {@link Clock}, so a run that crosses a month boundary
 * may compute different months for keys that carry no date of their own.
 */
public class PathCalculator {

    private static final Pattern FULL_DATE = Pattern.compile("(\\d{4}-\\d{2})-\\d{2}");
    private static final Pattern MONTH = Pattern.compile("(\\d{4}-\\d{2})");
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final Clock clock;

    public PathCalculator(Clock clock) {
        this.clock = clock;
    }

    /** First segment after stripping one leading slash; the whole key when it has no slash. */
    public static String extractType(String key) {
        if (key == null || key.isEmpty()) {
            return "";
        }
        String clean = S3Paths.stripLeadingSlash(key);
        int slash = clean.indexOf('/');
        return slash == -1 ? clean : clean.substring(0, slash);
    }

    /**
     * Month of the first {@code YYYY-MM-DD} in the key, else the first {@code YYYY-MM}, else the current month.
     */
    public String extractMonth(String key) {
        if (key != null) {
            Matcher fullDate = FULL_DATE.matcher(key);
            if (fullDate.find()) {
                return fullDate.group(1);
            }
            Matcher month = MONTH.matcher(key);
            if (month.find()) {
                return month.group(1);
            }
        }
        return currentMonth();
    }

    public String currentMonth() {
        return YearMonth.now(clock).format(MONTH_FORMAT);
    }

    /**
     * {@code {type}/{month}/{category1}/{category2}/{basename}}, with empty categories replaced by 未分类.
     */
    public static String calculateNewPath(String oldKey, String month, CategoryInfo category) {
        String type = extractType(oldKey);
        String filename = S3Paths.basename(oldKey);
        String category1 = category == null || category.category1().isEmpty()
            ? CategoryInfo.UNCLASSIFIED : category.category1();
        String category2 = category == null || category.category2().isEmpty()
            ? CategoryInfo.UNCLASSIFIED : category.category2();
        return type + "/" + month + "/" + category1 + "/" + category2 + "/" + filename;
    }

    public static boolean isCorrectLocation(String currentKey, String computedKey) {
        if (currentKey == null || currentKey.isEmpty() || computedKey == null || computedKey.isEmpty()) {
            return false;
        }
        return currentKey.equals(computedKey);
    }
}
