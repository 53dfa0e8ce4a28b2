package io.github.hongjungwan.actionlog.core.internal;

/**
 * Renders a failure into the {@code exception} and {@code reason} fields of a
 * finish message. Never throws: the logging path must not fail because an
 * exception cannot describe itself.
 */
public final class ExceptionFormatter {

    public static final String UNREPRESENTABLE_REASON = "<unrepresentable reason>";

    private ExceptionFormatter() {}

    /** 예외 클래스의 FQCN */
    public static String typeName(Throwable throwable) {
        return throwable.getClass().getName();
    }

    /**
     * Message of the throwable, or its {@code toString()} when the message is null.
     * Unpaired surrogates are replaced with U+FFFD.
     */
    public static String reason(Throwable throwable) {
        String raw;
        try {
            raw = throwable.getMessage();
            if (raw == null) {
                raw = throwable.toString();
            }
        } catch (RuntimeException | LinkageError e) {
            return UNREPRESENTABLE_REASON;
        }
        if (raw == null) {
            return UNREPRESENTABLE_REASON;
        }
        return replaceLoneSurrogates(raw);
    }

    static String replaceLoneSurrogates(String value) {
        StringBuilder sb = null;
        int length = value.length();
        for (int i = 0; i < length; i++) {
            char c = value.charAt(i);
            boolean lone;
            if (Character.isHighSurrogate(c)) {
                lone = i + 1 >= length || !Character.isLowSurrogate(value.charAt(i + 1));
                if (!lone) {
                    if (sb != null) {
                        sb.append(c).append(value.charAt(i + 1));
                    }
                    i++;
                    continue;
                }
            } else {
                lone = Character.isLowSurrogate(c);
            }

            if (lone && sb == null) {
                sb = new StringBuilder(length).append(value, 0, i);
            }
            if (sb != null) {
                sb.append(lone ? '\uFFFD' : c);
            }
        }
        return sb == null ? value : sb.toString();
    }
}
