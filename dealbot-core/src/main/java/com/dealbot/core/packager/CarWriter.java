package com.dealbot.core.packager;

import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * CARv1 serializer: varint-prefixed dag-cbor header {@code {roots, version}} followed by
 * varint-framed {@code cid || data} sections.
 */
public final class CarWriter {

    private static final int CID_TAG = 42;
    private static final CBORFactory CBOR = new CBORFactory();

    private CarWriter() {}

    public static byte[] write(Cid root, List<Block> blocks) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] header = encodeHeader(root);
            ByteCursor.writeVarint(out, header.length);
            out.writeBytes(header);
            for (Block block : blocks) {
                byte[] cid = block.cid().toBytes();
                ByteCursor.writeVarint(out, (long) cid.length + block.size());
                out.writeBytes(cid);
                out.writeBytes(block.data());
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new PackagingException("Failed to write CAR header", e);
        }
    }

    static byte[] encodeHeader(Cid root) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (CBORGenerator gen = CBOR.createGenerator(buffer)) {
            // dag-cbor orders map keys by length first: "roots" before "version"
            gen.writeStartObject(null, 2);
            gen.writeFieldName("roots");
            gen.writeStartArray(null, 1);
            gen.writeTag(CID_TAG);
            byte[] cid = root.toBytes();
            byte[] prefixed = new byte[cid.length + 1];
            System.arraycopy(cid, 0, prefixed, 1, cid.length);
            gen.writeBinary(prefixed);
            gen.writeEndArray();
            gen.writeFieldName("version");
            gen.writeNumber(1);
            gen.writeEndObject();
        }
        return buffer.toByteArray();
    }
}
