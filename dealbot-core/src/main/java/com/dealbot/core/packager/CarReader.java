package com.dealbot.core.packager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes a CARv1 into an in-memory block store. Every block must hash to the CID it is stored under.
 */
public final class CarReader {

    private static final ObjectMapper CBOR_MAPPER = new ObjectMapper(new CBORFactory());

    private CarReader() {}

    /** Roots in header order and blocks in file order. */
    public record CarContents(List<Cid> roots, Map<Cid, byte[]> blocks) {

        public List<Cid> blockCids() {
            return List.copyOf(blocks.keySet());
        }
    }

    public static CarContents read(byte[] car, int maxBlockSize) {
        if (car == null || car.length == 0) {
            throw new PackagingException("CAR is empty");
        }
        ByteCursor cursor = new ByteCursor(car);
        long headerLength = cursor.readVarint();
        if (headerLength <= 0 || headerLength > cursor.remaining()) {
            throw new PackagingException("Invalid CAR header length " + headerLength);
        }
        List<Cid> roots = decodeHeader(cursor.readBytes((int) headerLength));

        Map<Cid, byte[]> blocks = new LinkedHashMap<>();
        while (cursor.hasRemaining()) {
            long frameLength = cursor.readVarint();
            if (frameLength <= 0 || frameLength > cursor.remaining()) {
                throw new PackagingException("Truncated CAR section at offset " + cursor.position()
                    + ": declared " + frameLength + " bytes, " + cursor.remaining() + " left");
            }
            int frameStart = cursor.position();
            Cid cid = Cid.read(cursor);
            int dataLength = (int) frameLength - (cursor.position() - frameStart);
            if (dataLength < 0) {
                throw new PackagingException("CAR section shorter than its CID at offset " + frameStart);
            }
            if (dataLength > maxBlockSize) {
                throw new PackagingException("Block " + cid + " exceeds " + maxBlockSize + " bytes");
            }
            byte[] data = cursor.readBytes(dataLength);
            if (!cid.matches(data)) {
                throw new PackagingException("Block hash mismatch for CID " + cid + " at offset " + frameStart);
            }
            blocks.putIfAbsent(cid, data);
        }
        return new CarContents(roots, Collections.unmodifiableMap(blocks));
    }

    static List<Cid> decodeHeader(byte[] header) {
        JsonNode node;
        try {
            node = CBOR_MAPPER.readTree(header);
        } catch (IOException e) {
            throw new PackagingException("Malformed CAR header: " + e.getMessage(), e);
        }
        if (node == null || node.path("version").asInt(-1) != 1) {
            throw new PackagingException("Unsupported CAR version");
        }
        JsonNode rootsNode = node.path("roots");
        if (!rootsNode.isArray() || rootsNode.isEmpty()) {
            throw new PackagingException("CAR header has no roots");
        }
        List<Cid> roots = new ArrayList<>();
        for (JsonNode root : rootsNode) {
            byte[] raw;
            try {
                raw = root.binaryValue();
            } catch (IOException e) {
                throw new PackagingException("CAR root is not a CID", e);
            }
            if (raw == null || raw.length < 2 || raw[0] != 0x00) {
                throw new PackagingException("CAR root is not a tagged CID");
            }
            roots.add(Cid.fromBytes(Arrays.copyOfRange(raw, 1, raw.length)));
        }
        return roots;
    }
}
