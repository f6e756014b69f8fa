package com.dealbot.core.packager;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * UnixFS Data message carried in a dag-pb node's Data field.
 */
public record UnixFsData(Type type, byte[] data, Long fileSize, List<Long> blockSizes) {

    public enum Type {
        RAW(0), DIRECTORY(1), FILE(2), METADATA(3), SYMLINK(4), HAMT_SHARD(5);

        private final int code;

        Type(int code) {
            this.code = code;
        }

        static Type fromCode(int code) {
            for (Type type : values()) {
                if (type.code == code) {
                    return type;
                }
            }
            throw new PackagingException("Unknown UnixFS type " + code);
        }
    }

    public static UnixFsData file(long fileSize, List<Long> blockSizes) {
        return new UnixFsData(Type.FILE, null, fileSize, blockSizes);
    }

    public static UnixFsData directory() {
        return new UnixFsData(Type.DIRECTORY, null, null, List.of());
    }

    public byte[] encode() {
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            CodedOutputStream out = CodedOutputStream.newInstance(buffer);
            out.writeEnum(1, type.code);
            if (data != null && data.length > 0) {
                out.writeByteArray(2, data);
            }
            if (fileSize != null) {
                out.writeUInt64(3, fileSize);
            }
            for (Long size : blockSizes) {
                out.writeUInt64(4, size);
            }
            out.flush();
            return buffer.toByteArray();
        } catch (IOException e) {
            throw new PackagingException("Failed to encode UnixFS data", e);
        }
    }

    public static UnixFsData decode(byte[] bytes) {
        if (bytes == null) {
            throw new PackagingException("dag-pb node carries no UnixFS data");
        }
        try {
            CodedInputStream in = CodedInputStream.newInstance(bytes);
            Type type = null;
            byte[] data = null;
            Long fileSize = null;
            List<Long> blockSizes = new ArrayList<>();
            int tag;
            while ((tag = in.readTag()) != 0) {
                int field = WireFormat.getTagFieldNumber(tag);
                if (field == 1) {
                    type = Type.fromCode(in.readEnum());
                } else if (field == 2) {
                    data = in.readByteArray();
                } else if (field == 3) {
                    fileSize = in.readUInt64();
                } else if (field == 4) {
                    readBlockSizes(in, tag, blockSizes);
                } else {
                    in.skipField(tag);
                }
            }
            if (type == null) {
                throw new PackagingException("UnixFS data without a type");
            }
            return new UnixFsData(type, data, fileSize, blockSizes);
        } catch (IOException e) {
            throw new PackagingException("Malformed UnixFS data: " + e.getMessage(), e);
        }
    }

    private static void readBlockSizes(CodedInputStream in, int tag, List<Long> target) throws IOException {
        if (WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
            int limit = in.pushLimit(in.readRawVarint32());
            while (in.getBytesUntilLimit() > 0) {
                target.add(in.readUInt64());
            }
            in.popLimit(limit);
        } else {
            target.add(in.readUInt64());
        }
    }
}
