package appraiser.core.model.ratelimit;

/**
 * Endpoint groups that share a rate limit budget.
 *
 * <p>Key issuance and token exchange are anonymous and attractive to abuse, so
 * they get tighter budgets than general traffic.
 */
public enum RateLimitCategory {
    KEY_ISSUANCE("key-issuance"),
    TOKEN_EXCHANGE("token-exchange"),
    GENERAL("general");

    private final String tag;

    RateLimitCategory(String tag) {
        this.tag = tag;
    }

    /**
     * Stable lowercase name used in counter keys and metric tags.
     */
    public String tag() {
        return tag;
    }
}
