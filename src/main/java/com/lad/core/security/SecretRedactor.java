package com.lad.core.security;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Best-effort masking of credentials in text that leaves the process: prompts sent to
 * models, tool results and rendered reports.
 */
public final class SecretRedactor {

    public static final String REPLACEMENT = "[REDACTED]";

    private static final List<Pattern> RULES = List.of(
            Pattern.compile("\\bsk-or-v1-[A-Za-z0-9]{16,}\\b"),
            Pattern.compile("\\bsk-[A-Za-z0-9]{16,}\\b"),
            Pattern.compile("\\bghp_[A-Za-z0-9]{20,}\\b"),
            Pattern.compile("\\bgithub_pat_[A-Za-z0-9_]{20,}\\b"),
            Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"),
            Pattern.compile("\\beyJ[A-Za-z0-9_-]{10,}\\.[A-Za-z0-9_-]{10,}\\.[A-Za-z0-9_-]{10,}\\b"),
            Pattern.compile("-----BEGIN (?:RSA |EC |OPENSSH |)?PRIVATE KEY-----[\\s\\S]*?-----END (?:RSA |EC |OPENSSH |)?PRIVATE KEY-----"));

    private SecretRedactor() {}

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String redacted = text;
        for (Pattern rule : RULES) {
            redacted = rule.matcher(redacted).replaceAll(REPLACEMENT);
        }
        return redacted;
    }

    public static boolean containsSecrets(String text) {
        if (text == null) return false;
        for (Pattern rule : RULES) {
            if (rule.matcher(text).find()) return true;
        }
        return false;
    }
}
