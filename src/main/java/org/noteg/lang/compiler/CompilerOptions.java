package org.noteg.lang.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Objects;

/**
 * Compiler configuration options.
 *
 * <p>{@code minify} and {@code sourceMap} are accepted for forward compatibility but do not change
 * the output yet.
 */
public record CompilerOptions(
    String emissionProfile,
    boolean minify,
    boolean sourceMap,
    boolean strict
) {
    public static final String CONFIG_PATH = "noteg.compiler";

    public static final CompilerOptions DEFAULT = new CompilerOptions(
        "es2022",
        false,
        false,
        true
    );

    public CompilerOptions {
        Objects.requireNonNull(emissionProfile, "emissionProfile");
        if (emissionProfile.isBlank()) {
            throw new IllegalArgumentException("Emission profile must not be blank");
        }
    }

    /**
     * Read options from {@code noteg.compiler}; keys missing from {@code config} take the
     * values shipped in {@code reference.conf}.
     */
    public static CompilerOptions fromConfig(Config config) {
        var section = config.withFallback(ConfigFactory.defaultReference())
                            .getConfig(CONFIG_PATH);
        return new CompilerOptions(
            section.getString("emission-profile"),
            section.getBoolean("minify"),
            section.getBoolean("source-map"),
            section.getBoolean("strict")
        );
    }

    /**
     * Options from {@code application.conf}, system properties and {@code reference.conf}.
     */
    public static CompilerOptions load() {
        return fromConfig(ConfigFactory.load());
    }

    public static Builder builder() {
        return new Builder(DEFAULT);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private String emissionProfile;
        private boolean minify;
        private boolean sourceMap;
        private boolean strict;

        private Builder(CompilerOptions base) {
            this.emissionProfile = base.emissionProfile();
            this.minify = base.minify();
            this.sourceMap = base.sourceMap();
            this.strict = base.strict();
        }

        public Builder emissionProfile(String emissionProfile) {
            this.emissionProfile = emissionProfile;
            return this;
        }

        public Builder minify(boolean minify) {
            this.minify = minify;
            return this;
        }

        public Builder sourceMap(boolean sourceMap) {
            this.sourceMap = sourceMap;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(emissionProfile, minify, sourceMap, strict);
        }
    }
}
