package io.github.galkahana.extractionrunner;

/**
 * Per-unit prices of the extraction service, in currency units per million usage units.
 *
 * @param inputPerMillion Price of one million input units
 * @param outputPerMillion Price of one million output units
 */
public record PriceTable(double inputPerMillion, double outputPerMillion) {

    public static final PriceTable DEFAULT = new PriceTable(3.0, 15.0);
}
