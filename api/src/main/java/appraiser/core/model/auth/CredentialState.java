package appraiser.core.model.auth;

/**
 * Lifecycle state of an issued API key.
 *
 * <p>Keys transition through these states:
 * <pre>
 * ACTIVE → DEACTIVATED
 * ACTIVE | DEACTIVATED → DELETED → (restore) previous state
 * </pre>
 *
 * <ul>
 *   <li>{@link #ACTIVE} - Usable for token exchange and request authentication</li>
 *   <li>{@link #DEACTIVATED} - Explicitly revoked, history retained</li>
 *   <li>{@link #DELETED} - Soft-deleted, hidden from listings, restorable</li>
 * </ul>
 *
 * <p>A single state replaces independent "active" and "deleted" flags, so a key
 * can never be both deleted and usable.
 */
public enum CredentialState {

    /**
     * Key can be exchanged for session tokens and its tokens pass the request gate.
     */
    ACTIVE,

    /**
     * Key was revoked. Existing session tokens are rejected on their next use.
     */
    DEACTIVATED,

    /**
     * Key was soft-deleted. It is excluded from listings and can be restored.
     */
    DELETED;

    /**
     * Whether a key in this state may authenticate.
     *
     * @return true only for {@link #ACTIVE}
     */
    public boolean isUsable() {
        return this == ACTIVE;
    }
}
