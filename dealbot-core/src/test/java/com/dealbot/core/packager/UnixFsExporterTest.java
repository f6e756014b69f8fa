package com.dealbot.core.packager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnixFsExporterTest {

    @TempDir
    Path target;

    private static byte[] fileNode(List<DagPbLink> links) {
        return new DagPbNode(links, UnixFsData.file(10, List.of(10L)).encode()).encode();
    }

    @Test
    @DisplayName("A file node linking to itself is rejected instead of recursing")
    void selfLinkedFile() {
        Cid self = Cid.of(Cid.CODEC_DAG_PB, "self".getBytes(StandardCharsets.UTF_8));
        Map<Cid, byte[]> blocks = Map.of(self, fileNode(List.of(new DagPbLink(self, "", 10))));

        assertThatThrownBy(() -> new UnixFsExporter(blocks).export(self, target.resolve("out")))
            .isInstanceOf(PackagingException.class)
            .hasMessageContaining("Cycle");
    }

    @Test
    @DisplayName("A directory that contains itself is rejected")
    void selfLinkedDirectory() {
        Cid self = Cid.of(Cid.CODEC_DAG_PB, "dir".getBytes(StandardCharsets.UTF_8));
        byte[] dir = new DagPbNode(List.of(new DagPbLink(self, "loop", 0)), UnixFsData.directory().encode()).encode();

        assertThatThrownBy(() -> new UnixFsExporter(Map.of(self, dir)).export(self, target.resolve("out")))
            .isInstanceOf(PackagingException.class)
            .hasMessageContaining("Cycle");
    }

    @Test
    @DisplayName("A chain deeper than the limit is rejected")
    void tooDeep() {
        Map<Cid, byte[]> blocks = new HashMap<>();
        Cid leaf = Cid.of(Cid.CODEC_RAW, new byte[10]);
        blocks.put(leaf, new byte[10]);
        Cid next = leaf;
        for (int i = 0; i <= UnixFsExporter.MAX_DEPTH; i++) {
            byte[] node = fileNode(List.of(new DagPbLink(next, "", 10)));
            next = Cid.of(Cid.CODEC_DAG_PB, node);
            blocks.put(next, node);
        }
        Cid root = next;

        assertThatThrownBy(() -> new UnixFsExporter(blocks).export(root, target.resolve("out")))
            .isInstanceOf(PackagingException.class)
            .hasMessageContaining("deeper");
    }

    @Test
    @DisplayName("A leaf repeated under the same parent is not mistaken for a cycle")
    void repeatedLeafAllowed() throws Exception {
        byte[] chunk = "0123456789".getBytes(StandardCharsets.UTF_8);
        Cid leaf = Cid.of(Cid.CODEC_RAW, chunk);
        byte[] node = new DagPbNode(
            List.of(new DagPbLink(leaf, "", 10), new DagPbLink(leaf, "", 10)),
            UnixFsData.file(20, List.of(10L, 10L)).encode()).encode();
        Cid root = Cid.of(Cid.CODEC_DAG_PB, node);

        List<Path> written = new UnixFsExporter(Map.of(leaf, chunk, root, node)).export(root, target.resolve("out"));

        assertThat(written).hasSize(1);
        assertThat(Files.readString(written.get(0))).isEqualTo("01234567890123456789");
    }
}
