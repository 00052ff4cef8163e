package de.bsommerfeld.landcover.core.domain;

/**
 * One class of a {@link Legend}.
 *
 * @param name            display name (e.g. {@code flooded})
 * @param probabilityBand name of the per-class probability band in the source
 *                        imagery (e.g. {@code flooded_vegetation})
 * @param color           display color as {@code #RRGGBB}
 */
public record LegendEntry(String name, String probabilityBand, String color) {
}
