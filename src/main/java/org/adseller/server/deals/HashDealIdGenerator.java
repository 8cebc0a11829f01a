package org.adseller.server.deals;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds deal ids as an uppercase seller prefix followed by a truncated SHA-256 digest.
 * <p>
 * The digest covers the seller, the product, the proposal timestamp, a per-instance counter and a random
 * per-instance nonce, so ids never repeat within an instance and do not collide across instances. Buyer data
 * never enters the id.
 */
public class HashDealIdGenerator implements DealIdGenerator {

    private static final String DEFAULT_PREFIX = "DEAL";
    private static final int PREFIX_LENGTH = 6;
    private static final int DIGEST_LENGTH = 20;
    private static final int NONCE_BYTES = 16;
    private static final char SEPARATOR = '|';

    private final AtomicLong counter = new AtomicLong();
    private final String nonce;

    public HashDealIdGenerator() {
        this(new SecureRandom());
    }

    HashDealIdGenerator(SecureRandom random) {
        final byte[] nonceBytes = new byte[NONCE_BYTES];
        random.nextBytes(nonceBytes);
        this.nonce = Hex.encodeHexString(nonceBytes);
    }

    @Override
    public String generate(String sellerOrgId, String productId, Instant proposalTimestamp) {
        final String source = StringUtils.defaultString(sellerOrgId)
                + SEPARATOR + StringUtils.defaultString(productId)
                + SEPARATOR + (proposalTimestamp != null ? proposalTimestamp.toEpochMilli() : 0L)
                + SEPARATOR + counter.incrementAndGet()
                + SEPARATOR + nonce;

        final String digest = DigestUtils.sha256Hex(source).substring(0, DIGEST_LENGTH);
        return prefix(sellerOrgId) + digest.toUpperCase(Locale.ROOT);
    }

    static String prefix(String sellerOrgId) {
        final String alphanumeric = StringUtils.defaultString(sellerOrgId).codePoints()
                .filter(codePoint -> codePoint < 128 && Character.isLetterOrDigit(codePoint))
                .limit(PREFIX_LENGTH)
                .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
                .toString();

        return alphanumeric.isEmpty() ? DEFAULT_PREFIX : alphanumeric.toUpperCase(Locale.ROOT);
    }
}
