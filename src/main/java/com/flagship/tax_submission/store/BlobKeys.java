package com.flagship.tax_submission.store;

/**
 * Builds blob keys. Every key starts with the owning tenant's id.
 */
public final class BlobKeys {

    private BlobKeys() {
        // Utility class
    }

    public static String tenantPrefix(String tenantId) {
        return tenantId + "/";
    }

    public static String signedXml(String tenantId, String documentNumber) {
        return tenantPrefix(tenantId) + "xml/signed-" + documentNumber + ".xml";
    }

    public static String receipt(String tenantId, String documentNumber) {
        return tenantPrefix(tenantId) + "receipts/receipt-" + documentNumber + ".xml";
    }

    public static String certificate(String tenantId) {
        return tenantPrefix(tenantId) + "certificates/" + tenantId + ".p12";
    }

    public static String voidCommunication(String tenantId, String communicationNumber) {
        return tenantPrefix(tenantId) + "xml/" + communicationNumber + ".xml";
    }

    public static boolean belongsTo(String tenantId, String key) {
        return tenantId != null && key != null && key.startsWith(tenantPrefix(tenantId));
    }
}
