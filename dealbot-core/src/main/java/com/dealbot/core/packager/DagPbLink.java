package com.dealbot.core.packager;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * PBLink: Hash = 1, Name = 2, Tsize = 3.
 */
public record DagPbLink(Cid hash, String name, long tsize) {

    byte[] encode() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(buffer);
        out.writeByteArray(1, hash.toBytes());
        out.writeString(2, name != null ? name : "");
        out.writeUInt64(3, tsize);
        out.flush();
        return buffer.toByteArray();
    }

    static DagPbLink decode(byte[] bytes) throws IOException {
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        Cid hash = null;
        String name = "";
        long tsize = 0;
        int tag;
        while ((tag = in.readTag()) != 0) {
            int field = WireFormat.getTagFieldNumber(tag);
            if (field == 1) {
                hash = Cid.fromBytes(in.readByteArray());
            } else if (field == 2) {
                name = in.readString();
            } else if (field == 3) {
                tsize = in.readUInt64();
            } else {
                in.skipField(tag);
            }
        }
        if (hash == null) {
            throw new PackagingException("dag-pb link without a hash");
        }
        return new DagPbLink(hash, name, tsize);
    }
}
