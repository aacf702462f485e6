package com.labshare.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FingerprintGeneratorTest {

    private static final String USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64)";

    @Test
    void digestsUserAgentAndNonce() {
        FingerprintGenerator generator = new FingerprintGenerator(() -> "fixed-nonce");

        assertThat(generator.generate(USER_AGENT))
                .isEqualTo("502822212d698f7d13183b848ec25c3a50f98b2399d57f1200b734df4c64baf2");
    }

    @Test
    void missingUserAgentIsTreatedAsEmpty() {
        FingerprintGenerator generator = new FingerprintGenerator(() -> "fixed-nonce");

        assertThat(generator.generate(null))
                .isEqualTo("11362c67502c9b9d03f046afec02ffec7e0cf9bef834beb6807346e42b2dbcea");
    }

    @Test
    void sameUserAgentYieldsDifferentFingerprints() {
        FingerprintGenerator generator = new FingerprintGenerator();

        String first = generator.generate(USER_AGENT);
        String second = generator.generate(USER_AGENT);

        assertThat(first).matches("[0-9a-f]{64}");
        assertThat(second).matches("[0-9a-f]{64}");
        assertThat(first).isNotEqualTo(second);
    }
}
