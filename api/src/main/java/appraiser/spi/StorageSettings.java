package appraiser.spi;

/**
 * Settings handed to a storage provider when it builds its repositories.
 *
 * @param applySchema whether a relational provider creates its tables at startup
 *                    ({@code appraiser.storage.jdbc.apply-schema}, default true)
 */
public record StorageSettings(boolean applySchema) {

    public static StorageSettings defaults() {
        return new StorageSettings(true);
    }
}
