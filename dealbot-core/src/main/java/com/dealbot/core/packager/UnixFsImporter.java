package com.dealbot.core.packager;

import com.dealbot.common.constants.ProbeDefaults;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Chunks files into raw leaves and links them into a balanced UnixFS tree.
 * The same input always produces the same root.
 */
public class UnixFsImporter {

    private final int chunkSize;
    private final int maxLinksPerNode;

    public UnixFsImporter() {
        this(ProbeDefaults.CHUNK_SIZE_BYTES, ProbeDefaults.MAX_LINKS_PER_NODE);
    }

    public UnixFsImporter(int chunkSize, int maxLinksPerNode) {
        if (chunkSize <= 0 || maxLinksPerNode < 2) {
            throw new IllegalArgumentException("chunkSize must be positive and maxLinksPerNode at least 2");
        }
        this.chunkSize = chunkSize;
        this.maxLinksPerNode = maxLinksPerNode;
    }

    /** Outcome of an import: the root and every block, children before parents. */
    public record ImportResult(Cid root, List<Block> blocks, long fileSize) {

        public long totalBlockSize() {
            return blocks.stream().mapToLong(Block::size).sum();
        }
    }

    private record Node(Cid cid, long fileSize, long tsize) {}

    public ImportResult importFile(Path file) throws IOException {
        List<Block> blocks = new ArrayList<>();
        Node root = importFileNode(file, blocks);
        return new ImportResult(root.cid(), blocks, root.fileSize());
    }

    /**
     * Imports a directory tree. Entries are linked by name in sorted order.
     */
    public ImportResult importDirectory(Path directory) throws IOException {
        List<Block> blocks = new ArrayList<>();
        Node root = importDirectoryNode(directory, blocks);
        return new ImportResult(root.cid(), blocks, root.fileSize());
    }

    private Node importFileNode(Path file, List<Block> blocks) throws IOException {
        List<Node> level = new ArrayList<>();
        try (InputStream in = Files.newInputStream(file)) {
            while (true) {
                byte[] chunk = in.readNBytes(chunkSize);
                if (chunk.length == 0 && !level.isEmpty()) {
                    break;
                }
                Cid cid = Cid.of(Cid.CODEC_RAW, chunk);
                blocks.add(new Block(cid, chunk));
                level.add(new Node(cid, chunk.length, chunk.length));
                if (chunk.length < chunkSize) {
                    break;
                }
            }
        }

        // a single chunk is its own root
        while (level.size() > 1) {
            List<Node> parents = new ArrayList<>();
            for (int start = 0; start < level.size(); start += maxLinksPerNode) {
                List<Node> children = level.subList(start, Math.min(start + maxLinksPerNode, level.size()));
                parents.add(fileNode(children, blocks));
            }
            level = parents;
        }
        return level.get(0);
    }

    private Node fileNode(List<Node> children, List<Block> blocks) {
        List<DagPbLink> links = new ArrayList<>(children.size());
        List<Long> blockSizes = new ArrayList<>(children.size());
        long fileSize = 0;
        long childTsize = 0;
        for (Node child : children) {
            links.add(new DagPbLink(child.cid(), "", child.tsize()));
            blockSizes.add(child.fileSize());
            fileSize += child.fileSize();
            childTsize += child.tsize();
        }
        byte[] encoded = new DagPbNode(links, UnixFsData.file(fileSize, blockSizes).encode()).encode();
        Cid cid = Cid.of(Cid.CODEC_DAG_PB, encoded);
        blocks.add(new Block(cid, encoded));
        return new Node(cid, fileSize, encoded.length + childTsize);
    }

    private Node importDirectoryNode(Path directory, List<Block> blocks) throws IOException {
        List<Path> entries;
        try (Stream<Path> list = Files.list(directory)) {
            entries = list.sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString())).toList();
        }

        List<DagPbLink> links = new ArrayList<>(entries.size());
        long fileSize = 0;
        long childTsize = 0;
        for (Path entry : entries) {
            Node child = Files.isDirectory(entry) ? importDirectoryNode(entry, blocks) : importFileNode(entry, blocks);
            links.add(new DagPbLink(child.cid(), entry.getFileName().toString(), child.tsize()));
            fileSize += child.fileSize();
            childTsize += child.tsize();
        }
        byte[] encoded = new DagPbNode(links, UnixFsData.directory().encode()).encode();
        Cid cid = Cid.of(Cid.CODEC_DAG_PB, encoded);
        blocks.add(new Block(cid, encoded));
        return new Node(cid, fileSize, encoded.length + childTsize);
    }
}
