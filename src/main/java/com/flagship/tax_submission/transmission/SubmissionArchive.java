package com.flagship.tax_submission.transmission;

import com.flagship.tax_submission.document.Document;
import lombok.ToString;
import lombok.Value;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Single-entry DEFLATE zip carrying a signed document, named
 * {tenantId}-{kindCode}-{series}-{sequence}.xml inside {..}.zip.
 */
@Value
public class SubmissionArchive {
    String fileName;
    String entryName;
    @ToString.Exclude
    byte[] content;

    public static SubmissionArchive of(Document document, String signedXml) {
        String baseName = baseName(document);
        String entryName = baseName + ".xml";
        return new SubmissionArchive(baseName + ".zip", entryName,
            zip(entryName, signedXml.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * The document number already is {series}-{8-digit sequence}.
     */
    public static String baseName(Document document) {
        return document.getTenantId() + "-" + document.getKind().getCode() + "-" + document.getDocumentNumber();
    }

    static byte[] zip(String entryName, byte[] payload) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            zip.setMethod(ZipOutputStream.DEFLATED);
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(payload);
            zip.closeEntry();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to compress " + entryName, e);
        }
        return buffer.toByteArray();
    }
}
