package org.querylex.sql2.scanner;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.querylex.sql2.lexer.UnterminatedBracketPolicy;

import java.util.Arrays;
import java.util.Locale;

/**
 * Behavior switches of a {@link Sql2Scanner}, read from the {@code querylex.scanner} block.
 *
 * <pre>
 * querylex.scanner {
 *   delimiter-alignment = "POSITIONAL"   # or "TOKEN"
 *   unterminated-bracket = "ERROR"       # or "IGNORE"
 * }
 * </pre>
 *
 * @param delimiterAlignment Which delimiter list {@code previousDelimiter()} indexes.
 * @param unterminatedBracket What to do with a bracketed identifier left open at the end.
 */
public record ScannerOptions(
        DelimiterAlignment delimiterAlignment,
        UnterminatedBracketPolicy unterminatedBracket
) {
    /** Path of the scanner block in the application configuration. */
    public static final String CONFIG_PATH = "querylex.scanner";

    private static final String ALIGNMENT_KEY = "delimiter-alignment";
    private static final String BRACKET_KEY = "unterminated-bracket";

    private static final ScannerOptions DEFAULTS =
            new ScannerOptions(DelimiterAlignment.POSITIONAL, UnterminatedBracketPolicy.ERROR);

    /**
     * @return The built-in defaults, identical to those in {@code reference.conf}.
     */
    public static ScannerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the options from a configuration. Missing keys fall back to {@link #defaults()}.
     * @param config The application configuration (the root, not the scanner block).
     * @return The options.
     * @throws ConfigException.BadValue if a key holds an unknown value.
     */
    public static ScannerOptions fromConfig(Config config) {
        Config scanner = config.hasPath(CONFIG_PATH) ? config.getConfig(CONFIG_PATH) : ConfigFactory.empty();
        DelimiterAlignment alignment = scanner.hasPath(ALIGNMENT_KEY)
                ? parseEnum(scanner, ALIGNMENT_KEY, DelimiterAlignment.class)
                : DEFAULTS.delimiterAlignment();
        UnterminatedBracketPolicy bracket = scanner.hasPath(BRACKET_KEY)
                ? parseEnum(scanner, BRACKET_KEY, UnterminatedBracketPolicy.class)
                : DEFAULTS.unterminatedBracket();
        return new ScannerOptions(alignment, bracket);
    }

    /**
     * @param alignment The alignment to use.
     * @return A copy of these options with a different delimiter alignment.
     */
    public ScannerOptions withDelimiterAlignment(DelimiterAlignment alignment) {
        return new ScannerOptions(alignment, unterminatedBracket);
    }

    /**
     * @param policy The policy to use.
     * @return A copy of these options with a different unterminated-bracket policy.
     */
    public ScannerOptions withUnterminatedBracket(UnterminatedBracketPolicy policy) {
        return new ScannerOptions(delimiterAlignment, policy);
    }

    private static <E extends Enum<E>> E parseEnum(Config config, String key, Class<E> type) {
        String value = config.getString(key);
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), key,
                    "unknown value '" + value + "', expected one of " + Arrays.toString(type.getEnumConstants()), e);
        }
    }
}
