package com.dealbot.core.packager;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes a UnixFS DAG held in a block store back to disk. Directories become directories;
 * file content is streamed leaf by leaf.
 *
 * A block may appear more than once in a DAG but never as its own ancestor, and no path may be
 * deeper than {@link #MAX_DEPTH} links.
 */
public class UnixFsExporter {

    static final int MAX_DEPTH = 64;

    private final Map<Cid, byte[]> blockStore;

    public UnixFsExporter(Map<Cid, byte[]> blockStore) {
        this.blockStore = blockStore;
    }

    /**
     * Exports the DAG rooted at {@code root} as {@code target}.
     *
     * @return every regular file written
     */
    public List<Path> export(Cid root, Path target) throws IOException {
        List<Path> written = new ArrayList<>();
        exportEntry(root, target, written, new HashSet<>());
        return written;
    }

    /** True when the root is a UnixFS directory rather than a file. */
    public boolean isDirectory(Cid root) {
        if (!root.isDagPb()) {
            return false;
        }
        DagPbNode node = DagPbNode.decode(block(root));
        return UnixFsData.decode(node.data()).type() == UnixFsData.Type.DIRECTORY;
    }

    private void exportEntry(Cid cid, Path target, List<Path> written, Set<Cid> ancestors) throws IOException {
        if (cid.isDagPb()) {
            DagPbNode node = DagPbNode.decode(block(cid));
            UnixFsData unixFs = UnixFsData.decode(node.data());
            if (unixFs.type() == UnixFsData.Type.DIRECTORY) {
                Files.createDirectories(target);
                enter(cid, ancestors);
                for (DagPbLink link : node.links()) {
                    String name = link.name();
                    if (name == null || name.isEmpty() || name.contains("/") || name.equals("..") || name.equals(".")) {
                        throw new PackagingException("Illegal directory entry name '" + name + "'");
                    }
                    exportEntry(link.hash(), target.resolve(name), written, ancestors);
                }
                ancestors.remove(cid);
                return;
            }
        }
        try (OutputStream out = Files.newOutputStream(target)) {
            writeFileContent(cid, out, ancestors);
        }
        written.add(target);
    }

    private void writeFileContent(Cid cid, OutputStream out, Set<Cid> ancestors) throws IOException {
        if (cid.isRaw()) {
            out.write(block(cid));
            return;
        }
        if (!cid.isDagPb()) {
            throw new PackagingException("Unsupported codec 0x" + Integer.toHexString(cid.getCodec()) + " in " + cid);
        }
        DagPbNode node = DagPbNode.decode(block(cid));
        UnixFsData unixFs = UnixFsData.decode(node.data());
        if (unixFs.type() != UnixFsData.Type.FILE && unixFs.type() != UnixFsData.Type.RAW) {
            throw new PackagingException("Unsupported UnixFS node type " + unixFs.type() + " in file " + cid);
        }
        if (unixFs.data() != null) {
            out.write(unixFs.data());
        }
        enter(cid, ancestors);
        for (DagPbLink link : node.links()) {
            writeFileContent(link.hash(), out, ancestors);
        }
        ancestors.remove(cid);
    }

    private static void enter(Cid cid, Set<Cid> ancestors) {
        if (!ancestors.add(cid)) {
            throw new PackagingException("Cycle in DAG at " + cid);
        }
        if (ancestors.size() > MAX_DEPTH) {
            throw new PackagingException("DAG deeper than " + MAX_DEPTH + " levels at " + cid);
        }
    }

    private byte[] block(Cid cid) {
        byte[] data = blockStore.get(cid);
        if (data == null) {
            throw new PackagingException("Block not found for CID " + cid);
        }
        return data;
    }
}
