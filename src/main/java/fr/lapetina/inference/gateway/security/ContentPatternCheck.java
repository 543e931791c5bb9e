package fr.lapetina.inference.gateway.security;

import fr.lapetina.inference.gateway.domain.failure.SecurityFailure;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring scan of string leaves against a denylist.
 *
 * <p>This is a heuristic blacklist, not a sound security boundary. The matched pattern
 * goes into the failure message, which is logged but never returned to the client.
 */
public final class ContentPatternCheck implements PayloadCheck {

    /**
     * Code execution, script injection, path traversal and destructive shell/SQL markers.
     */
    public static final List<String> DEFAULT_PATTERNS = List.of(
            "__import__", "eval", "exec", "compile", "open", "file",
            "<script", "</script>", "javascript:", "data:",
            "../", "..\\", "/etc/", "c:\\", "cmd.exe", "powershell",
            "rm -rf", "del /", "format c:", "drop table"
    );

    private final List<String> patterns;

    public ContentPatternCheck(List<String> patterns) {
        this.patterns = patterns.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
    }

    public static ContentPatternCheck withDefaults() {
        return new ContentPatternCheck(DEFAULT_PATTERNS);
    }

    @Override
    public void inspectString(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (lower.contains(pattern)) {
                throw new SecurityFailure("Dangerous pattern detected: " + pattern,
                        SecurityFailure.DANGEROUS_PATTERN);
            }
        }
    }

    public List<String> getPatterns() {
        return patterns;
    }

    @Override
    public String getName() {
        return "content-pattern";
    }
}
