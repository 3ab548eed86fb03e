package appraiser.core.model.auth;

/**
 * Minimal identity resolved by the request gate.
 *
 * @param id   credential id
 * @param name credential display name
 */
public record AuthenticatedCaller(long id, String name) {

    /**
     * Whether this caller owns a resource attributed to the given credential.
     *
     * @param ownerId owning credential id, null when orphaned
     * @return true if the ids match
     */
    public boolean owns(Long ownerId) {
        return ownerId != null && ownerId == id;
    }
}
