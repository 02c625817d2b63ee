package de.bsommerfeld.sixdegrees.ingest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.IngestConfig;
import de.bsommerfeld.sixdegrees.core.domain.ExternalId;
import de.bsommerfeld.sixdegrees.core.domain.MalformedIdException;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw dump fields into typed, optional values. The dataset writes
 * {@code \N} for an absent value in any column; that token becomes an empty
 * {@link Optional}. A numeric field that is neither the sentinel nor a number
 * is dataset corruption and raises {@link DumpFormatException}, never a soft
 * null.
 *
 * <p>
 * Stateless apart from the configured sentinel.
 */
@Singleton
public class FieldNormalizer {

    /** Unsigned digits with an optional fraction, as the ratings dump writes them. */
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");

    private final String sentinel;

    @Inject
    public FieldNormalizer(IngestConfig config) {
        this(config.getNullSentinel());
    }

    public FieldNormalizer(String sentinel) {
        this.sentinel = sentinel;
    }

    public boolean isAbsent(String raw) {
        return raw == null || sentinel.equals(raw);
    }

    /**
     * Generic entry point; the typed methods below are what the loaders use.
     */
    public Optional<?> normalize(String raw, FieldType type) {
        switch (type) {
            case INTEGER:
                return integer(raw);
            case DECIMAL:
                return decimal(raw);
            case TEXT:
                return text(raw);
            case CATEGORY:
                return category(raw);
            default:
                throw new IllegalArgumentException("Unhandled field type " + type);
        }
    }

    public Optional<Integer> integer(String raw) {
        if (isAbsent(raw))
            return Optional.empty();
        if (raw.isEmpty() || !raw.chars().allMatch(ch -> ch >= '0' && ch <= '9'))
            throw new DumpFormatException("Not an integer: '" + raw + "'");
        try {
            return Optional.of(Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            throw new DumpFormatException("Integer out of range: '" + raw + "'", e);
        }
    }

    public Optional<Double> decimal(String raw) {
        if (isAbsent(raw))
            return Optional.empty();
        if (!PLAIN_DECIMAL.matcher(raw).matches())
            throw new DumpFormatException("Not a decimal: '" + raw + "'");
        double value = Double.parseDouble(raw);
        if (Double.isInfinite(value))
            throw new DumpFormatException("Decimal out of range: '" + raw + "'");
        return Optional.of(value);
    }

    public Optional<String> text(String raw) {
        return isAbsent(raw) ? Optional.empty() : Optional.of(raw);
    }

    public Optional<String> category(String raw) {
        return isAbsent(raw) || raw.isBlank() ? Optional.empty() : Optional.of(raw);
    }

    /**
     * Boolean-as-integer flag: {@code 0} or {@code 1}; an absent flag reads as
     * {@code false}.
     */
    public boolean flag(String raw) {
        int value = integer(raw).orElse(0);
        if (value != 0 && value != 1)
            throw new DumpFormatException("Flag must be 0 or 1 but was '" + raw + "'");
        return value == 1;
    }

    /**
     * Parses an id-bearing column. Ids are never optional.
     */
    public int id(String prefix, String raw) {
        try {
            return ExternalId.parse(prefix, raw);
        } catch (MalformedIdException e) {
            throw new DumpFormatException(e.getMessage(), e);
        }
    }
}
