/**
 * Classifies object keys against the canonical storage layout
 *
 * Features:
 * - Recognises canonical {type}/{YYYY-MM}/{category1}/{category2}/{filename} keys
 * - Recognises the legacy task id and flat day layouts
 * - Detects root objects whose whole path was stored percent-encoded
 * - Splits existing keys into their segments for diagnostics
 */

package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.types.ParsedPath;
import com.shadowcollector.label_storage.types.PathViolationType;
import com.shadowcollector.label_storage.types.StorageType;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

public final class PathGrammar {

    private static final String TYPES = "(?:" + StorageType.segmentAlternation() + ")";

    private static final Pattern VALID_PATH =
        Pattern.compile("^" + TYPES + "/\\d{4}-\\d{2}/[^/]+/[^/]+/[^/]+$");

    private static final Pattern OLD_TASKID_PATH =
        Pattern.compile("^" + TYPES + "/\\d{4}-\\d{2}-\\d{2}/[a-f0-9]{32}/[^/]+$");

    private static final Pattern OLD_FLAT_PATH =
        Pattern.compile("^" + TYPES + "/\\d{4}-\\d{2}-\\d{2}/[^/]+\\.(?i:jpg|jpeg|png|gif|webp|bmp|json)$");

    private static final Pattern TYPE_PREFIX = Pattern.compile("^" + TYPES + "/");

    private static final Pattern TASK_ID = Pattern.compile("^[a-f0-9]{32}$");

    private static final String ENCODED_SEPARATOR = "%2F";

    private PathGrammar() {
        // Utility class
    }

    /**
     * Exactly one violation type per key. Checked in order: url-encoded-root, valid, old-taskid, old-flat.
     */
    public static PathViolationType classify(String key) {
        if (key == null || key.isEmpty()) {
            return PathViolationType.UNKNOWN;
        }
        if (isUrlEncodedRoot(key)) {
            return PathViolationType.URL_ENCODED_ROOT;
        }
        if (VALID_PATH.matcher(key).matches()) {
            return PathViolationType.VALID;
        }
        if (OLD_TASKID_PATH.matcher(key).matches()) {
            return PathViolationType.OLD_TASKID;
        }
        if (OLD_FLAT_PATH.matcher(key).matches()) {
            return PathViolationType.OLD_FLAT;
        }
        return PathViolationType.UNKNOWN;
    }

    public static boolean isValid(String key) {
        return key != null && !key.isEmpty() && VALID_PATH.matcher(key).matches();
    }

    /**
     * True when the key contains an encoded separator and its decoded form starts with a storage type segment.
     * A key with malformed percent escapes, or escapes that are not valid UTF-8, is never url-encoded-root.
     */
    public static boolean isUrlEncodedRoot(String key) {
        if (key == null || !key.contains(ENCODED_SEPARATOR)) {
            return false;
        }
        try {
            return TYPE_PREFIX.matcher(decodeRootKey(key)).find();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Percent-decodes a root key as UTF-8. A literal {@code +} is kept as is.
     *
     * @throws IllegalArgumentException when the key holds a malformed escape or escapes bytes that are not valid UTF-8
     */
    public static String decodeRootKey(String key) {
        StringBuilder decoded = new StringBuilder(key.length());
        ByteArrayOutputStream escaped = new ByteArrayOutputStream();
        int i = 0;
        while (i < key.length()) {
            char c = key.charAt(i);
            if (c == '%') {
                if (i + 2 >= key.length()) {
                    throw new IllegalArgumentException("Incomplete escape at index " + i + " in " + key);
                }
                int high = Character.digit(key.charAt(i + 1), 16);
                int low = Character.digit(key.charAt(i + 2), 16);
                if (high < 0 || low < 0) {
                    throw new IllegalArgumentException("Malformed escape at index " + i + " in " + key);
                }
                escaped.write((high << 4) | low);
                i += 3;
            } else {
                flushEscaped(escaped, decoded, key);
                decoded.append(c);
                i++;
            }
        }
        flushEscaped(escaped, decoded, key);
        return decoded.toString();
    }

    private static void flushEscaped(ByteArrayOutputStream escaped, StringBuilder decoded, String key) {
        if (escaped.size() == 0) {
            return;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            decoded.append(decoder.decode(ByteBuffer.wrap(escaped.toByteArray())));
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Escaped bytes are not valid UTF-8 in " + key, e);
        }
        escaped.reset();
    }

    public static ParsedPath parseExisting(String key) {
        if (key == null || key.isEmpty()) {
            return ParsedPath.empty();
        }
        String[] segments = key.split("/", -1);
        String type = segments[0];
        String date = segments.length > 1 ? segments[1] : "";
        String filename = segments[segments.length - 1];

        if (segments.length == 5) {
            return new ParsedPath(type, date, segments[2], segments[3], null, filename);
        }
        if (segments.length == 4 && TASK_ID.matcher(segments[2]).matches()) {
            return new ParsedPath(type, date, null, null, segments[2], filename);
        }
        return new ParsedPath(type, date, null, null, null, filename);
    }
}
