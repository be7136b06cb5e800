package feedwatch;

/**
 * Thrown when an operation names a source handle the registry does not know.
 */
public class SourceNotFoundException extends RuntimeException {
    private final String handle;

    public SourceNotFoundException(String handle) {
        super("Source not found: " + handle);
        this.handle = handle;
    }

    public String handle() {
        return handle;
    }
}
