package io.github.cyfko.hypermedia.core.exception;

/**
 * Exception thrown when the API descriptor cannot be located, read or parsed.
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Missing resource:</strong> the configured location does not exist</li>
 *   <li><strong>Malformed content:</strong> the file is not valid JSON or YAML</li>
 * </ul>
 *
 * @author cyfko
 * @since 1.0
 */
public class DescriptorLoadException extends RuntimeException {

    private final String location;

    public DescriptorLoadException(String location, String message) {
        super(message);
        this.location = location;
    }

    public DescriptorLoadException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * Location the descriptor was expected at.
     */
    public String location() {
        return location;
    }
}
