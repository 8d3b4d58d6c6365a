package com.vedant.sqlgateway.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexical screen for destructive SQL keywords.
 * Runs on the raw text before any parsing, so it still catches attempts the parser could be fooled by.
 * String literals and comments are NOT treated specially: a literal containing "drop" is rejected too.
 */
public class SQLValidator {

    // Order is the reporting order
    private static final Map<String, Pattern> DESTRUCTIVE_KEYWORDS = new LinkedHashMap<>();

    static {
        for (String keyword : List.of("DROP", "TRUNCATE", "DELETE", "INSERT", "UPDATE",
                "ALTER", "CREATE", "GRANT", "REVOKE")) {
            DESTRUCTIVE_KEYWORDS.put(keyword, Pattern.compile("\\b" + keyword + "\\b", Pattern.CASE_INSENSITIVE));
        }
    }

    private SQLValidator() {}

    public static List<String> scanForDestructiveKeywords(String sql) {
        List<String> detected = new ArrayList<>();
        if (sql == null || sql.isBlank()) return detected;

        for (Map.Entry<String, Pattern> e : DESTRUCTIVE_KEYWORDS.entrySet()) {
            if (e.getValue().matcher(sql).find()) {
                detected.add(e.getKey());
            }
        }
        return detected;
    }
}
