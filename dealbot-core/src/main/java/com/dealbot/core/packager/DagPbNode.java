package com.dealbot.core.packager;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * dag-pb PBNode. Links (field 2) are written before Data (field 1), matching the canonical encoding.
 */
public record DagPbNode(List<DagPbLink> links, byte[] data) {

    public byte[] encode() {
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            CodedOutputStream out = CodedOutputStream.newInstance(buffer);
            for (DagPbLink link : links) {
                out.writeByteArray(2, link.encode());
            }
            if (data != null) {
                out.writeByteArray(1, data);
            }
            out.flush();
            return buffer.toByteArray();
        } catch (IOException e) {
            throw new PackagingException("Failed to encode dag-pb node", e);
        }
    }

    public static DagPbNode decode(byte[] bytes) {
        try {
            CodedInputStream in = CodedInputStream.newInstance(bytes);
            List<DagPbLink> links = new ArrayList<>();
            byte[] data = null;
            int tag;
            while ((tag = in.readTag()) != 0) {
                int field = WireFormat.getTagFieldNumber(tag);
                if (field == 1) {
                    data = in.readByteArray();
                } else if (field == 2) {
                    links.add(DagPbLink.decode(in.readByteArray()));
                } else {
                    in.skipField(tag);
                }
            }
            return new DagPbNode(links, data);
        } catch (IOException e) {
            throw new PackagingException("Malformed dag-pb node: " + e.getMessage(), e);
        }
    }
}
