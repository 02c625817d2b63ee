package de.bsommerfeld.sixdegrees.core.domain;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Every credit category of the principals dump, each with the phrase used
 * when a path is described in prose ("Kevin Bacon <em>was an actor</em> in
 * ...").
 *
 * <p>
 * A category code that is not listed here means the dump format drifted. The
 * edge loader counts and reports such rows instead of storing a code nobody
 * can describe.
 */
public enum RoleCategory {

    ACTOR("actor", "was an actor"),
    ACTRESS("actress", "was an actress"),
    SELF("self", "were themselves"),
    DIRECTOR("director", "was a director"),
    WRITER("writer", "was a writer"),
    PRODUCER("producer", "was a producer"),
    COMPOSER("composer", "was a composer"),
    CINEMATOGRAPHER("cinematographer", "was a cinematographer"),
    EDITOR("editor", "was an editor"),
    PRODUCTION_DESIGNER("production_designer", "was a production designer"),
    CASTING_DIRECTOR("casting_director", "was a casting director"),
    ARCHIVE_FOOTAGE("archive_footage", "was present in archive footage"),
    ARCHIVE_SOUND("archive_sound", "was in archive sound");

    private static final Map<String, RoleCategory> BY_CODE = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(RoleCategory::code, Function.identity()));

    private final String code;
    private final String phrase;

    RoleCategory(String code, String phrase) {
        this.code = code;
        this.phrase = phrase;
    }

    /** The category as written in the dump and stored in {@code edges.role}. */
    public String code() {
        return code;
    }

    public String phrase() {
        return phrase;
    }

    /** Looks up a dump code. Empty for codes this enum does not know. */
    public static Optional<RoleCategory> fromCode(String code) {
        return Optional.ofNullable(code == null ? null : BY_CODE.get(code));
    }
}
