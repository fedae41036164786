package ae.teletronics.custody.application.util;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Random public identifiers. Pure randomness, no shared counter, safe to call from
 * any thread. Uniqueness is enforced by the store; callers retry on collision.
 */
public final class TokenGenerator {
    private static final char[] SHARE_CODE_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final SecureRandom RNG = new SecureRandom();

    public static final int FILE_ID_LENGTH = 16;
    public static final int SHARE_CODE_LENGTH = 8;

    private TokenGenerator() {}

    /** 16 lowercase hex chars (64 random bits). */
    public static String newFileId() {
        byte[] bytes = new byte[FILE_ID_LENGTH / 2];
        RNG.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /** 8 chars of [a-z0-9], used by the legacy share-code path. */
    public static String newShareCode() {
        char[] c = new char[SHARE_CODE_LENGTH];
        for (int i = 0; i < c.length; i++) c[i] = SHARE_CODE_ALPHABET[RNG.nextInt(SHARE_CODE_ALPHABET.length)];
        return new String(c);
    }
}
