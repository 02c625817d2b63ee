package de.bsommerfeld.sixdegrees.core.domain;

/**
 * A row of the {@code movies} table. "Movie" covers every title category of
 * the dump; the cleaning stage narrows it down to the retained categories.
 *
 * @param id        key derived from the {@code tt} identifier
 * @param title     primary title
 * @param year      start year, {@code null} if unknown
 * @param titleType dump category such as {@code movie} or {@code tvSeries}
 * @param adult     adult flag
 * @param runtime   runtime in minutes, {@code null} if unknown
 * @param genres    comma-delimited genre tags, {@code null} if none
 */
public record Movie(
        int id,
        String title,
        Integer year,
        String titleType,
        boolean adult,
        Integer runtime,
        String genres) {
}
