package appraiser.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.auth.Credential;
import appraiser.core.model.auth.NewCredential;

/**
 * Port interface for persistent storage of API keys.
 *
 * <p>Every mutation is atomic on a single row. Concurrent read-modify-write
 * sequences on the same key are last-writer-wins.
 */
public interface CredentialRepository {

    /**
     * Persist a newly issued key and assign its identity.
     *
     * @param credential the key to store
     * @return Uni with the stored, active key; fails with
     *     {@link appraiser.core.model.auth.CredentialCollisionException} if the secret hash already exists
     */
    Uni<Credential> create(NewCredential credential);

    /**
     * Find a key by identity, whatever its state.
     *
     * @param id the key identity
     * @return Uni with Optional containing the key if found
     */
    Uni<Optional<Credential>> findById(long id);

    /**
     * Find usable keys whose secret starts with the given prefix.
     *
     * <p>Used during validation to narrow the set of hashes to verify.
     *
     * @param secretPrefix the first characters of the presented secret
     * @return Uni with the matching active, non-deleted keys (possibly empty)
     */
    Uni<List<Credential>> findUsableByPrefix(String secretPrefix);

    /**
     * Retrieve a page of keys ordered by identity.
     *
     * @param skip number of keys to skip
     * @param limit maximum number of keys to return
     * @param includeDeleted whether soft-deleted keys are included
     * @return Uni with the page
     */
    Uni<List<Credential>> findAll(int skip, int limit, boolean includeDeleted);

    /**
     * Overwrite the mutable state of an existing key.
     *
     * @param credential the key with its new state
     * @return Uni with true if the key existed
     */
    Uni<Boolean> update(Credential credential);

    /**
     * Physically remove a key.
     *
     * <p>Audit entries referencing the key survive with a null key reference.
     *
     * @param id the key identity
     * @return Uni with true if removed, false if not found
     */
    Uni<Boolean> hardDelete(long id);
}
