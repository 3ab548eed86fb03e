package appraiser.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.auth.Credential;
import appraiser.core.model.auth.CredentialIssueResult;

/**
 * Port interface for API key lifecycle operations.
 */
public interface CredentialManagement {

    /**
     * Issue a new API key.
     *
     * @param name display name
     * @param description optional description
     * @return Uni with the stored key and its plaintext secret (only available now)
     */
    Uni<CredentialIssueResult> issue(String name, String description);

    /**
     * Resolve a plaintext secret to its usable key.
     *
     * @param plaintext the presented secret
     * @return Uni with the matching active key, or empty
     */
    Uni<Optional<Credential>> validate(String plaintext);

    /**
     * List keys, excluding soft-deleted ones.
     *
     * @param skip keys to skip
     * @param limit maximum keys to return
     * @return Uni with the page
     */
    Uni<List<Credential>> list(int skip, int limit);

    Uni<Optional<Credential>> get(long id);

    /**
     * Deactivate a key. Deactivating an already inactive key succeeds.
     *
     * @param id the key identity
     * @return Uni with true if the key exists
     */
    Uni<Boolean> deactivate(long id);

    /**
     * Delete a key.
     *
     * @param id the key identity
     * @param hard physical removal when true, soft deletion otherwise
     * @return Uni with true if the key existed
     */
    Uni<Boolean> delete(long id, boolean hard);

    /**
     * Restore a soft-deleted key.
     *
     * @param id the key identity
     * @return Uni with the restored key, or empty if absent or not deleted
     */
    Uni<Optional<Credential>> restore(long id);
}
