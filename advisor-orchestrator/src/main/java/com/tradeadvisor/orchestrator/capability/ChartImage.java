package com.tradeadvisor.orchestrator.capability;

import com.tradeadvisor.common.exception.InputException;

import java.util.Arrays;

/**
 * Raw chart upload. Only PNG and JPEG are accepted; the format is read from the
 * leading magic bytes, not from the filename.
 */
public record ChartImage(byte[] data, String filename) {

    public static final String PNG  = "image/png";
    public static final String JPEG = "image/jpeg";

    private static final byte[] PNG_MAGIC  = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};

    public ChartImage {
        data = data != null ? data : new byte[0];
        filename = filename != null ? filename : "";
    }

    /** {@value #PNG}, {@value #JPEG}, or null when the bytes are neither. */
    public String mediaType() {
        if (startsWith(PNG_MAGIC))  return PNG;
        if (startsWith(JPEG_MAGIC)) return JPEG;
        return null;
    }

    /** @throws InputException when the upload is empty or not a PNG/JPEG image */
    public ChartImage validate() {
        if (data.length == 0) {
            throw new InputException("Chart image is missing or empty");
        }
        if (mediaType() == null) {
            throw new InputException("Chart image must be PNG or JPEG. filename=" + filename);
        }
        return this;
    }

    private boolean startsWith(byte[] magic) {
        return data.length >= magic.length
            && Arrays.equals(Arrays.copyOf(data, magic.length), magic);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChartImage other
            && Arrays.equals(data, other.data)
            && filename.equals(other.filename);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + filename.hashCode();
    }

    @Override
    public String toString() {
        return "ChartImage[filename=" + filename + ", bytes=" + data.length + ", mediaType=" + mediaType() + "]";
    }
}
