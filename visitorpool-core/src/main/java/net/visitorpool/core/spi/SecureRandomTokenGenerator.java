package net.visitorpool.core.spi;

import java.security.SecureRandom;
import java.util.HexFormat;

final class SecureRandomTokenGenerator implements TokenGenerator {
    private final SecureRandom random = new SecureRandom();
    private final int bytes;

    SecureRandomTokenGenerator(int bytes) {
        if (bytes < 16) throw new IllegalArgumentException("token too short: " + bytes + " bytes");
        this.bytes = bytes;
    }

    @Override
    public String next() {
        byte[] buf = new byte[bytes];
        random.nextBytes(buf);
        return HexFormat.of().formatHex(buf);
    }
}
