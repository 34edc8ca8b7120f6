package com.flagship.tax_submission.document;

/**
 * Kinds of tax documents the service issues.
 *
 * Each kind carries its regulatory code (catalog 01), the letter its series
 * must start with (null when unrestricted) and the series used when the
 * tenant has not registered one.
 */
public enum DocumentKind {
    INVOICE("01", "F", "F001"),
    RECEIPT("03", "B", "B001"),
    CREDIT_NOTE("07", null, "NC01");

    private final String code;
    private final String seriesPrefix;
    private final String defaultSeries;

    DocumentKind(String code, String seriesPrefix, String defaultSeries) {
        this.code = code;
        this.seriesPrefix = seriesPrefix;
        this.defaultSeries = defaultSeries;
    }

    public String getCode() {
        return code;
    }

    public String getSeriesPrefix() {
        return seriesPrefix;
    }

    public String getDefaultSeries() {
        return defaultSeries;
    }

    /**
     * Checks if the given series may number documents of this kind.
     */
    public boolean acceptsSeries(String series) {
        return seriesPrefix == null || (series != null && series.startsWith(seriesPrefix));
    }
}
