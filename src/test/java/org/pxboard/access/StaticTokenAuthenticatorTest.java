package org.pxboard.access;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class StaticTokenAuthenticatorTest {

    private final StaticTokenAuthenticator authenticator = new StaticTokenAuthenticator(ConfigFactory.parseString(
        "tokens = [ { token = \"s3cret\", user = \"alice\" } ]"));

    @Test
    void knownTokenResolvesToUser() {
        assertThat(authenticator.authenticate("s3cret")).contains(new Identity("alice"));
    }

    @Test
    void unknownOrBlankTokensAreRejected() {
        assertThat(authenticator.authenticate("guess")).isEmpty();
        assertThat(authenticator.authenticate("  ")).isEmpty();
        assertThat(authenticator.authenticate(null)).isEmpty();
    }

    @Test
    void missingTableMeansNoTokens() {
        assertThat(new StaticTokenAuthenticator(ConfigFactory.empty()).authenticate("s3cret")).isEmpty();
    }
}
