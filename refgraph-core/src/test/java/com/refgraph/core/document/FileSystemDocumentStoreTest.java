package com.refgraph.core.document;

import com.refgraph.core.model.Document;
import com.refgraph.core.model.Span;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemDocumentStore}.
 */
class FileSystemDocumentStoreTest {

    @TempDir
    Path tempDir;

    private Path write(String key, String content) throws IOException {
        Path file = tempDir.resolve(key);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void keys_includeAndExcludePatterns_areSlashSeparatedAndSorted() throws IOException {
        write("panels/vision/main.xml", "");
        write("panels/objects/objects_A/b.xml", "");
        write("panels/objects/objects_A/b.xml.bak", "");
        write("scripts/libs/std/Struct.ctl", "");
        write("panels/tmp/scratch.xml", "");

        FileSystemDocumentStore store = new FileSystemDocumentStore(
            tempDir, List.of("**/*.xml", "**/*.ctl"), List.of("panels/tmp/**"));

        assertThat(store.keys()).containsExactly(
            "panels/objects/objects_A/b.xml",
            "panels/vision/main.xml",
            "scripts/libs/std/Struct.ctl");
        assertThat(store.exists("panels/tmp/scratch.xml")).isFalse();
    }

    @Test
    void find_legacyCodePage_decodesWithFallback() throws IOException {
        Path file = tempDir.resolve("panel.xml");
        Files.write(file, "// Насос".getBytes(Charset.forName("windows-1251")));
        FileSystemDocumentStore store = new FileSystemDocumentStore(tempDir, List.of(), List.of());

        Document document = store.find("panel.xml").orElseThrow();

        assertThat(document.text()).isEqualTo("// Насос");
    }

    @Test
    void find_unknownKey_returnsEmpty() {
        FileSystemDocumentStore store = new FileSystemDocumentStore(tempDir, List.of(), List.of());

        assertThat(store.find("nope.xml")).isEmpty();
    }

    @Test
    void removeSpan_rewritesOnlyTheSpanAsUtf8() throws IOException {
        Path file = write("a.xml", "keep\ndrop\nkeep too");
        FileSystemDocumentStore store = new FileSystemDocumentStore(tempDir, List.of(), List.of());

        store.removeSpan("a.xml", new Span(5, 10));

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("keep\nkeep too");
    }

    @Test
    void deleteDocument_lastFileInDirectory_removesEmptyParents() throws IOException {
        write("panels/objects/objects_A/PV/valve.xml", "");
        write("panels/objects/objects_A/other.xml", "");
        FileSystemDocumentStore store = new FileSystemDocumentStore(tempDir, List.of(), List.of());

        store.deleteDocument("panels/objects/objects_A/PV/valve.xml");

        assertThat(tempDir.resolve("panels/objects/objects_A/PV")).doesNotExist();
        assertThat(tempDir.resolve("panels/objects/objects_A")).isDirectory();
        assertThat(store.keys()).containsExactly("panels/objects/objects_A/other.xml");
    }

    @Test
    void deleteDocument_keyOutsideRoot_throws() {
        FileSystemDocumentStore store = new FileSystemDocumentStore(tempDir, List.of(), List.of());

        assertThatThrownBy(() -> store.deleteDocument("../outside.xml"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
