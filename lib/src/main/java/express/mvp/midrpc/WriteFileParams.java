package express.mvp.midrpc;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;

/**
 * Content and ownership for {@link MiddlewareClient#writeFile}.
 *
 * <p>A {@code null} uid or gid leaves that owner unchanged on the remote side (sent as -1).
 */
public final class WriteFileParams {

    /** Mode used when none is given. */
    public static final int DEFAULT_MODE = 0644;

    private final byte[] content;
    private final int mode;
    private final Integer uid;
    private final Integer gid;

    private WriteFileParams(Builder builder) {
        this.content = builder.content;
        this.mode = builder.mode;
        this.uid = builder.uid;
        this.gid = builder.gid;
    }

    /**
     * Creates params with the default mode and unchanged ownership.
     *
     * @param content the file content
     * @return new params
     */
    public static WriteFileParams of(byte[] content) {
        return builder().content(content).build();
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Content is handed to the transport without copying.")
    public byte[] content() {
        return content;
    }

    public int mode() {
        return mode;
    }

    public Integer uid() {
        return uid;
    }

    public Integer gid() {
        return gid;
    }

    /**
     * Returns the uid as sent on the wire.
     *
     * @return the uid, or -1 when unchanged
     */
    public int uidOrUnchanged() {
        return uid != null ? uid : -1;
    }

    /**
     * Returns the gid as sent on the wire.
     *
     * @return the gid, or -1 when unchanged
     */
    public int gidOrUnchanged() {
        return gid != null ? gid : -1;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link WriteFileParams}. */
    public static final class Builder {
        private byte[] content;
        private int mode = DEFAULT_MODE;
        private Integer uid;
        private Integer gid;

        private Builder() {}

        @SuppressFBWarnings(
                value = "EI_EXPOSE_REP2",
                justification = "Content is handed to the transport without copying.")
        public Builder content(byte[] content) {
            this.content = Objects.requireNonNull(content, "content");
            return this;
        }

        /**
         * Sets the permission bits; zero selects {@link #DEFAULT_MODE}.
         *
         * @param mode permission bits, e.g. {@code 0600}
         * @return this builder
         */
        public Builder mode(int mode) {
            this.mode = mode == 0 ? DEFAULT_MODE : mode;
            return this;
        }

        public Builder uid(Integer uid) {
            this.uid = uid;
            return this;
        }

        public Builder gid(Integer gid) {
            this.gid = gid;
            return this;
        }

        public WriteFileParams build() {
            if (content == null) {
                throw new IllegalArgumentException("content is required");
            }
            return new WriteFileParams(this);
        }
    }
}
