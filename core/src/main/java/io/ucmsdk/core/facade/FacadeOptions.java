package io.ucmsdk.core.facade;

/**
 * Per-facade switches.
 *
 * @param verifyArguments    check arguments against the schema before sending;
 *                           when off, arguments are passed to the transport
 *                           as given
 * @param normalizeResponses normalize responses; when off, the raw tree is
 *                           only converted to maps and lists
 * @param strictEnums        raise on enum values outside the known set; when
 *                           off they are passed through with a warning
 */
public record FacadeOptions(boolean verifyArguments, boolean normalizeResponses, boolean strictEnums) {

    /** Everything on. */
    public static final FacadeOptions DEFAULT = builder().build();

    /** Creates a new builder with every switch on. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link FacadeOptions}. */
    public static final class Builder {
        private boolean verifyArguments = true;
        private boolean normalizeResponses = true;
        private boolean strictEnums = true;

        Builder() {}

        public Builder verifyArguments(boolean verifyArguments) {
            this.verifyArguments = verifyArguments;
            return this;
        }

        public Builder normalizeResponses(boolean normalizeResponses) {
            this.normalizeResponses = normalizeResponses;
            return this;
        }

        public Builder strictEnums(boolean strictEnums) {
            this.strictEnums = strictEnums;
            return this;
        }

        public FacadeOptions build() {
            return new FacadeOptions(verifyArguments, normalizeResponses, strictEnums);
        }
    }
}
