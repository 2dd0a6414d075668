package net.leasehold.core.util;

import java.security.SecureRandom;
import java.time.Instant;

/**
 * 시간순 정렬 가능한 26자 식별자 (ULID 레이아웃).
 * 앞 10자: epoch millis 48bit, 뒤 16자: 난수 80bit. Crockford base32.
 */
public final class Ids {
    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    public static final int LENGTH = 26;

    private Ids() {}

    public static String next(Instant at) {
        long time = at.toEpochMilli();
        if (time < 0 || time > 0xFFFF_FFFF_FFFFL) {
            throw new IllegalArgumentException("timestamp out of range: " + at);
        }
        char[] out = new char[LENGTH];
        for (int i = 9; i >= 0; i--) {
            out[i] = ALPHABET[(int) (time & 31)];
            time >>>= 5;
        }
        byte[] rnd = new byte[10];
        RANDOM.nextBytes(rnd);
        encode40(rnd, 0, out, 10);
        encode40(rnd, 5, out, 18);
        return new String(out);
    }

    // 5바이트(40bit) -> 8자
    private static void encode40(byte[] src, int from, char[] out, int at) {
        long v = 0;
        for (int i = 0; i < 5; i++) v = (v << 8) | (src[from + i] & 0xFFL);
        for (int i = 7; i >= 0; i--) {
            out[at + i] = ALPHABET[(int) (v & 31)];
            v >>>= 5;
        }
    }
}
