package com.dealbot.core.packager;

import org.apache.commons.codec.binary.Base32;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.ByteArrayOutputStream;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Locale;

/**
 * Content identifier (version 1 only). CIDs render as lower-case base32 with the {@code b} multibase prefix.
 */
public final class Cid {

    public static final int CODEC_RAW = 0x55;
    public static final int CODEC_DAG_PB = 0x70;
    public static final int HASH_IDENTITY = 0x00;
    public static final int HASH_SHA2_256 = 0x12;

    private static final Base32 BASE32 = new Base32();

    private final int version;
    private final int codec;
    private final byte[] multihash;

    private Cid(int version, int codec, byte[] multihash) {
        this.version = version;
        this.codec = codec;
        this.multihash = multihash;
    }

    /** CIDv1 over the sha2-256 digest of {@code content}. */
    public static Cid of(int codec, byte[] content) {
        byte[] digest = DigestUtils.sha256(content);
        ByteArrayOutputStream mh = new ByteArrayOutputStream(digest.length + 2);
        ByteCursor.writeVarint(mh, HASH_SHA2_256);
        ByteCursor.writeVarint(mh, digest.length);
        mh.writeBytes(digest);
        return new Cid(1, codec, mh.toByteArray());
    }

    public static Cid parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CID is empty");
        }
        if (value.charAt(0) != 'b') {
            throw new IllegalArgumentException("Unsupported multibase prefix '" + value.charAt(0) + "' in " + value);
        }
        String body = value.substring(1).toUpperCase(Locale.ROOT);
        int padding = (8 - body.length() % 8) % 8;
        byte[] bytes = BASE32.decode(body + "=".repeat(padding));
        ByteCursor cursor = new ByteCursor(bytes);
        try {
            Cid cid = read(cursor);
            if (cursor.hasRemaining()) {
                throw new IllegalArgumentException("Trailing bytes after CID " + value);
            }
            return cid;
        } catch (PackagingException e) {
            throw new IllegalArgumentException("Malformed CID " + value + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a binary CIDv1 from the cursor. Bare v0 multihashes are rejected.
     */
    public static Cid read(ByteCursor cursor) {
        if (cursor.peek(0) == HASH_SHA2_256 && cursor.peek(1) == 0x20) {
            throw new PackagingException("CIDv0 is not supported");
        }
        long version = cursor.readVarint();
        if (version != 1) {
            throw new PackagingException("Unsupported CID version " + version);
        }
        int codec = (int) cursor.readVarint();
        long hashCode = cursor.readVarint();
        int digestLength = (int) cursor.readVarint();
        byte[] digest = cursor.readBytes(digestLength);

        ByteArrayOutputStream mh = new ByteArrayOutputStream(digestLength + 4);
        ByteCursor.writeVarint(mh, hashCode);
        ByteCursor.writeVarint(mh, digestLength);
        mh.writeBytes(digest);
        return new Cid(1, codec, mh.toByteArray());
    }

    public static Cid fromBytes(byte[] bytes) {
        ByteCursor cursor = new ByteCursor(bytes);
        Cid cid = read(cursor);
        if (cursor.hasRemaining()) {
            throw new PackagingException("Trailing bytes after binary CID");
        }
        return cid;
    }

    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(multihash.length + 4);
        ByteCursor.writeVarint(out, version);
        ByteCursor.writeVarint(out, codec);
        out.writeBytes(multihash);
        return out.toByteArray();
    }

    /**
     * True when {@code data} hashes to this CID's multihash. Unknown hash functions never match.
     */
    public boolean matches(byte[] data) {
        ByteCursor cursor = new ByteCursor(multihash);
        long hashCode = cursor.readVarint();
        int length = (int) cursor.readVarint();
        byte[] expected = cursor.readBytes(length);
        if (hashCode == HASH_SHA2_256) {
            return MessageDigest.isEqual(expected, DigestUtils.sha256(data));
        }
        if (hashCode == HASH_IDENTITY) {
            return MessageDigest.isEqual(expected, data);
        }
        return false;
    }

    public int getVersion() {
        return version;
    }

    public int getCodec() {
        return codec;
    }

    public boolean isRaw() {
        return codec == CODEC_RAW;
    }

    public boolean isDagPb() {
        return codec == CODEC_DAG_PB;
    }

    @Override
    public String toString() {
        String encoded = BASE32.encodeAsString(toBytes()).replace("=", "").toLowerCase(Locale.ROOT);
        return "b" + encoded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Cid other = (Cid) o;
        return version == other.version && codec == other.codec && Arrays.equals(multihash, other.multihash);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * version + codec) + Arrays.hashCode(multihash);
    }
}
