package it.aw.collectionindex.cache;

import it.aw.collectionindex.model.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Legge la prima thumbnail dal filesystem. I path relativi sono risolti rispetto a
 * {@code index.thumbnail.base-dir} e non possono uscirne (path assoluti o {@code ..}
 * vengono rifiutati); i file oltre {@code index.thumbnail.max-bytes} non vengono messi in cache.
 */
@Component
public class FileSystemThumbnailSource implements ThumbnailSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemThumbnailSource.class);

    private final Path baseDir;
    private final long maxBytes;

    public FileSystemThumbnailSource(@Value("${index.thumbnail.base-dir:.}") String baseDir,
                                     @Value("${index.thumbnail.max-bytes:512000}") long maxBytes) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
        this.maxBytes = maxBytes;
    }

    @Override
    public Optional<ThumbnailData> load(Collection collection) {
        String thumbnailPath = collection.firstThumbnailPath();
        if (thumbnailPath == null || thumbnailPath.isBlank()) {
            return Optional.empty();
        }
        Path path;
        try {
            path = baseDir.resolve(thumbnailPath).normalize();
        } catch (InvalidPathException e) {
            log.warn("Path thumbnail non valido per {}: {}", collection.id(), e.getMessage());
            return Optional.empty();
        }
        if (!path.startsWith(baseDir)) {
            log.warn("Thumbnail di {} fuori dalla directory {}: {}", collection.id(), baseDir, thumbnailPath);
            return Optional.empty();
        }
        try {
            if (!Files.isRegularFile(path)) {
                log.debug("Thumbnail assente per {}: {}", collection.id(), path);
                return Optional.empty();
            }
            long size = Files.size(path);
            if (size > maxBytes) {
                log.debug("Thumbnail di {} troppo grande per la cache ({} KB)", collection.id(), size / 1024);
                return Optional.empty();
            }
            return Optional.of(new ThumbnailData(Files.readAllBytes(path),
                    ThumbnailData.contentTypeFor(path.getFileName().toString())));
        } catch (IOException e) {
            log.warn("Impossibile leggere la thumbnail {} della collection {}: {}", path, collection.id(), e.getMessage());
            return Optional.empty();
        }
    }
}
