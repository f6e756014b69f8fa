package com.dealbot.core.packager;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Sequential reader over a byte array with unsigned LEB128 varint support.
 */
public final class ByteCursor {

    private final byte[] bytes;
    private int position;

    public ByteCursor(byte[] bytes) {
        this(bytes, 0);
    }

    public ByteCursor(byte[] bytes, int position) {
        this.bytes = bytes;
        this.position = position;
    }

    public long readVarint() {
        long value = 0;
        int shift = 0;
        while (true) {
            if (position >= bytes.length) {
                throw new PackagingException("Unexpected end of data while reading varint at offset " + position);
            }
            byte b = bytes[position++];
            value |= (long) (b & 0x7f) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
            shift += 7;
            if (shift > 63) {
                throw new PackagingException("Varint too long at offset " + position);
            }
        }
    }

    public byte[] readBytes(int length) {
        if (length < 0 || length > remaining()) {
            throw new PackagingException("Unexpected end of data: wanted " + length + " bytes, " + remaining() + " left");
        }
        byte[] out = Arrays.copyOfRange(bytes, position, position + length);
        position += length;
        return out;
    }

    public int peek(int offset) {
        int index = position + offset;
        return index < bytes.length ? bytes[index] & 0xff : -1;
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return bytes.length - position;
    }

    public boolean hasRemaining() {
        return position < bytes.length;
    }

    public static byte[] encodeVarint(long value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(10);
        writeVarint(out, value);
        return out.toByteArray();
    }

    public static void writeVarint(ByteArrayOutputStream out, long value) {
        long remaining = value;
        while ((remaining & ~0x7FL) != 0) {
            out.write((int) ((remaining & 0x7f) | 0x80));
            remaining >>>= 7;
        }
        out.write((int) remaining);
    }
}
