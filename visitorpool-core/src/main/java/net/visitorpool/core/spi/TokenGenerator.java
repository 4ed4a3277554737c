package net.visitorpool.core.spi;

public interface TokenGenerator {
    String next();

    /** SecureRandom 32바이트 → hex 64자 */
    static TokenGenerator secureRandom() {
        return new SecureRandomTokenGenerator(32);
    }
}
