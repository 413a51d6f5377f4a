package tech.noetzold.phishing_detector.ncd;

/**
 * The compressor rejected a byte sequence. Not recovered from.
 */
public class CompressionFailureException extends IllegalStateException {

    public CompressionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
