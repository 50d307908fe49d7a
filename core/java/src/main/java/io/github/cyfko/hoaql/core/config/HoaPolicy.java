package io.github.cyfko.hoaql.core.config;

/**
 * Configuration of the HOA parser: input limits and optional reference validation.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>maxDocumentLength</strong>: maximum character length of a document</li>
 *   <li><strong>validateReferences</strong>: check that every state index, proposition index and
 *       acceptance mark used in the document was declared by {@code States:}, {@code AP:} and
 *       {@code Acceptance:}</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * HoaPolicy policy = HoaPolicy.defaults();
 *
 * // Strict (documents coming from untrusted tools)
 * HoaPolicy policy = HoaPolicy.strict();
 *
 * // Relaxed (large trusted documents)
 * HoaPolicy policy = HoaPolicy.relaxed();
 *
 * // Custom
 * HoaPolicy policy = HoaPolicy.builder()
 *     .maxDocumentLength(1_000_000)
 *     .validateReferences(true)
 *     .build();
 * }</pre>
 *
 * @param policyName         display name of the policy
 * @param maxDocumentLength  maximum number of characters accepted by the parser
 * @param validateReferences whether indices must stay within their declared bounds
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record HoaPolicy(
    String policyName,
    int maxDocumentLength,
    boolean validateReferences
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or the length limit is not positive
     */
    public HoaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxDocumentLength <= 0) {
            throw new IllegalArgumentException("maxDocumentLength must be positive, got: " + maxDocumentLength);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Document Length: 10 000 000 characters</li>
     *   <li>Reference Validation: DISABLED (the format leaves it to consumers)</li>
     * </ul>
     *
     * @return default configuration
     */
    public static HoaPolicy defaults() {
        return new HoaPolicy(PolicyName.DEFAULT_POLICY.name(), 10_000_000, false);
    }

    /**
     * Strict configuration for documents produced by untrusted tools.
     * <ul>
     *   <li>Max Document Length: 1 000 000 characters</li>
     *   <li>Reference Validation: ENABLED</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static HoaPolicy strict() {
        return new HoaPolicy(PolicyName.STRICT_POLICY.name(), 1_000_000, true);
    }

    /**
     * Relaxed configuration for very large, trusted documents.
     * <ul>
     *   <li>Max Document Length: {@link Integer#MAX_VALUE}</li>
     *   <li>Reference Validation: DISABLED</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static HoaPolicy relaxed() {
        return new HoaPolicy(PolicyName.RELAXED_POLICY.name(), Integer.MAX_VALUE, false);
    }

    /**
     * Creates a custom configuration, initialized exactly as {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxDocumentLength = 10_000_000;
        private boolean _validateReferences = false;

        private Builder() {}

        public HoaPolicy build() {
            return new HoaPolicy(_policyName, _maxDocumentLength, _validateReferences);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxDocumentLength(int maxDocumentLength) { this._maxDocumentLength = maxDocumentLength; return this; }
        public Builder validateReferences(boolean validate) { this._validateReferences = validate; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
