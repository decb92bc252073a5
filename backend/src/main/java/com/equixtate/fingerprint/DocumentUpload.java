package com.equixtate.fingerprint;

/**
 * Raw file as handed over by the form layer.
 */
public record DocumentUpload(String name, String mimeType, byte[] content) {

    public boolean isEmpty() {
        return content == null || content.length == 0;
    }
}
