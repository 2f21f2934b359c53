package it.aw.collectionindex.cache;

import it.aw.collectionindex.model.Collection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static it.aw.collectionindex.support.TestCollections.collection;
import static it.aw.collectionindex.support.TestCollections.withThumbnailPath;
import static org.assertj.core.api.Assertions.assertThat;

class FileSystemThumbnailSourceTest {

    @TempDir
    Path baseDir;

    @Test
    void loadsFileRelativeToBaseDir() throws Exception {
        Files.write(baseDir.resolve("c1.webp"), new byte[] {5, 6});
        FileSystemThumbnailSource source = new FileSystemThumbnailSource(baseDir.toString(), 1_000);

        Collection c = withThumbnailPath(collection("c1", "A", 0), "c1.webp");

        assertThat(source.load(c)).hasValueSatisfying(t -> {
            assertThat(t.bytes()).containsExactly(5, 6);
            assertThat(t.contentType()).isEqualTo("image/webp");
        });
    }

    @Test
    void skipsMissingAndOversizedFiles() throws Exception {
        Files.write(baseDir.resolve("big.jpg"), new byte[2_000]);
        FileSystemThumbnailSource source = new FileSystemThumbnailSource(baseDir.toString(), 1_000);

        assertThat(source.load(withThumbnailPath(collection("c1", "A", 0), "big.jpg"))).isEmpty();
        assertThat(source.load(withThumbnailPath(collection("c2", "B", 0), "missing.jpg"))).isEmpty();
        assertThat(source.load(collection("c3", "C", 0))).isEmpty();
    }

    @Test
    void refusesPathsOutsideBaseDir() throws Exception {
        Path thumbs = Files.createDirectories(baseDir.resolve("thumbs"));
        Path secret = Files.writeString(baseDir.resolve("secret.txt"), "riservato");
        Files.write(thumbs.resolve("ok.jpg"), new byte[] {1});
        FileSystemThumbnailSource source = new FileSystemThumbnailSource(thumbs.toString(), 1_000);

        assertThat(source.load(withThumbnailPath(collection("c1", "A", 0), "../secret.txt"))).isEmpty();
        assertThat(source.load(withThumbnailPath(collection("c2", "B", 0), secret.toString()))).isEmpty();
        assertThat(source.load(withThumbnailPath(collection("c3", "C", 0), "sub/../ok.jpg"))).isPresent();
    }
}
