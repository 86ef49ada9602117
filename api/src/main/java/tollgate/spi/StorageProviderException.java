package tollgate.spi;

/**
 * A usage storage provider could not be selected, connected, or migrated.
 *
 * <p>Distinct from {@code UsagePersistenceException}, which covers failed reads
 * and writes against a provider that started.
 */
public class StorageProviderException extends RuntimeException {

    private final String provider;

    public StorageProviderException(String provider, String message) {
        super("[" + provider + "] " + message);
        this.provider = provider;
    }

    public StorageProviderException(String provider, String message, Throwable cause) {
        super("[" + provider + "] " + message, cause);
        this.provider = provider;
    }

    /**
     * Name of the provider involved, or {@code "loader"} when none was chosen.
     */
    public String provider() {
        return provider;
    }
}
