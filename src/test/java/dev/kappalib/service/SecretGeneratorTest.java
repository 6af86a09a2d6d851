package dev.kappalib.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SecretGeneratorTest {

    private SecretGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SecretGenerator(new SecureRandom());
    }

    @Nested
    @DisplayName("Secret tokens")
    class SecretTokens {

        @Test
        @DisplayName("Should produce 64 lowercase hex characters")
        void shouldProduceHexToken() {
            assertThat(generator.newSecretToken()).matches("^[0-9a-f]{64}$");
        }

        @Test
        @DisplayName("Should not repeat across calls")
        void shouldBeUnique() {
            Set<String> tokens = new HashSet<>();
            for (int i = 0; i < 200; i++) {
                tokens.add(generator.newSecretToken());
            }
            assertThat(tokens).hasSize(200);
        }
    }

    @Test
    @DisplayName("Avatar seed should be 16 hex characters")
    void avatarSeedShouldBeHex() {
        assertThat(generator.newAvatarSeed()).matches("^[0-9a-f]{16}$");
    }

    @Test
    @DisplayName("Sync code should use the unambiguous alphabet only")
    void syncCodeShouldAvoidAmbiguousCharacters() {
        for (int i = 0; i < 500; i++) {
            String code = generator.newSyncCode();
            assertThat(code).hasSize(SecretGenerator.SYNC_CODE_LENGTH);
            assertThat(code).doesNotContain("0", "O", "1", "I");
            for (char c : code.toCharArray()) {
                assertThat(SecretGenerator.SYNC_CODE_ALPHABET).contains(String.valueOf(c));
            }
        }
    }

    @Test
    @DisplayName("Display name should be an adjective followed by an animal")
    void displayNameShouldComeFromWordLists() {
        String name = generator.newDisplayName();
        String[] parts = name.split(" ");

        assertThat(parts).hasSize(2);
        assertThat(SecretGenerator.ADJECTIVES).contains(parts[0]);
        assertThat(SecretGenerator.ANIMALS).contains(parts[1]);
    }

    @Test
    @DisplayName("Ids should carry the prefix and eight base36 characters")
    void idShouldHavePrefix() {
        assertThat(generator.newId(SecretGenerator.PROFILE_ID_PREFIX)).matches("^usr_[a-z0-9]{8}$");
        assertThat(generator.newId(SecretGenerator.COMMENT_ID_PREFIX)).matches("^cmt_[a-z0-9]{8}$");
    }
}
