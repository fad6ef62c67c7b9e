package io.github.sasproject.record;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.spec.ECGenParameterSpec;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class X509PublicKeysTest extends SasRecordTestBase {

    static PublicKey rsaKey() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        return generator.generateKeyPair().getPublic();
    }

    @Test
    void rsaPemRoundTrips() throws Exception {
        PublicKey key = rsaKey();
        String pem = X509PublicKeys.toPem(key);
        assertThat(pem).startsWith("-----BEGIN PUBLIC KEY-----\n").endsWith("-----END PUBLIC KEY-----\n");
        assertThat(pem.lines().filter(l -> !l.startsWith("-----"))).allMatch(l -> l.length() <= 64);

        PublicKey parsed = X509PublicKeys.parse(pem);
        assertThat(parsed.getAlgorithm()).isEqualTo("RSA");
        assertThat(parsed.getEncoded()).isEqualTo(key.getEncoded());
    }

    @Test
    void ecKeyIsRecognised() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        PublicKey key = generator.generateKeyPair().getPublic();

        PublicKey parsed = X509PublicKeys.parse(X509PublicKeys.toPem(key));
        assertThat(parsed.getAlgorithm()).isEqualTo("EC");
        assertThat(parsed.getEncoded()).isEqualTo(key.getEncoded());
    }

    @Test
    void ed25519KeyIsRecognised() throws Exception {
        PublicKey key = KeyPairGenerator.getInstance("Ed25519").generateKeyPair().getPublic();
        PublicKey parsed = X509PublicKeys.parse(X509PublicKeys.toPem(key));
        assertThat(parsed.getEncoded()).isEqualTo(key.getEncoded());
    }

    @Test
    void bareBase64IsAccepted() throws Exception {
        PublicKey key = rsaKey();
        String bare = Base64.getEncoder().encodeToString(key.getEncoded());
        assertThat(X509PublicKeys.isWellFormed(bare)).isTrue();
        assertThat(X509PublicKeys.isWellFormed("  " + bare + "\n")).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "garbage!",
            "bm90IGEga2V5",
            "-----BEGIN PUBLIC KEY-----...",
            "-----BEGIN PUBLIC KEY-----\nMIIB\n-----END PUBLIC KEY-----"
    })
    void malformedKeysAreRejected(String text) {
        assertThat(X509PublicKeys.isWellFormed(text)).isFalse();
        assertThatThrownBy(() -> X509PublicKeys.parse(text)).isInstanceOf(InvalidPublicKeyException.class);
    }

    @Test
    void nullIsNotWellFormed() {
        assertThat(X509PublicKeys.isWellFormed(null)).isFalse();
    }
}
