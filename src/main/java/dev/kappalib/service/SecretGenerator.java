package dev.kappalib.service;

import dev.kappalib.util.DigestUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.List;

/**
 * Source of every random value that doubles as credential or identifier:
 * secret tokens, avatar seeds, sync codes, display names and row ids.
 *
 * <pre>
 * Profile profile = Profile.builder()
 *     .id(secretGenerator.newId(SecretGenerator.PROFILE_ID_PREFIX))
 *     .secretToken(secretGenerator.newSecretToken())
 *     .build();
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class SecretGenerator {

    public static final String PROFILE_ID_PREFIX = "usr_";
    public static final String COMMENT_ID_PREFIX = "cmt_";

    /** Sync code alphabet: no 0/O or 1/I. */
    static final String SYNC_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int SYNC_CODE_LENGTH = 8;

    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int ID_LENGTH = 8;

    static final List<String> ADJECTIVES = List.of(
            "Неопознанный", "Загадочный", "Мистический", "Древний", "Теневой",
            "Странный", "Забытый", "Одинокий", "Тихий", "Быстрый",
            "Мудрый", "Храбрый", "Дикий", "Свободный", "Гордый"
    );

    static final List<String> ANIMALS = List.of(
            "Шакал", "Волк", "Ворон", "Сокол", "Медведь",
            "Лис", "Ёж", "Барсук", "Рысь", "Сыч",
            "Филин", "Хорёк", "Енот", "Суслик", "Бобр"
    );

    private final SecureRandom secureRandom;

    /**
     * 256-bit bearer credential, hex-encoded (64 chars).
     */
    public String newSecretToken() {
        return randomHex(32);
    }

    /**
     * 64-bit avatar renderer seed, hex-encoded (16 chars).
     */
    public String newAvatarSeed() {
        return randomHex(8);
    }

    public String newSyncCode() {
        return randomString(SYNC_CODE_ALPHABET, SYNC_CODE_LENGTH);
    }

    /**
     * Random "adjective animal" pair, one of 225 combinations.
     */
    public String newDisplayName() {
        String adjective = ADJECTIVES.get(secureRandom.nextInt(ADJECTIVES.size()));
        String animal = ANIMALS.get(secureRandom.nextInt(ANIMALS.size()));
        return adjective + " " + animal;
    }

    public String newId(String prefix) {
        return prefix + randomString(ID_ALPHABET, ID_LENGTH);
    }

    private String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        secureRandom.nextBytes(buffer);
        return DigestUtils.toHex(buffer);
    }

    private String randomString(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(secureRandom.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
