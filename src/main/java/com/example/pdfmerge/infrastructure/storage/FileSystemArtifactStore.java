package com.example.pdfmerge.infrastructure.storage;

import com.example.pdfmerge.config.PdfMergeProperties;
import com.example.pdfmerge.domain.model.ArtifactHandle;
import com.example.pdfmerge.domain.model.StorageArea;
import com.example.pdfmerge.infrastructure.exception.ArtifactStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ArtifactStore} backed by two local directories, one per {@link StorageArea}.
 * Content is written to a hidden temporary file next to its destination and then renamed atomically,
 * so readers never see a partially written artifact.
 */
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);
    private static final String PARTIAL_PREFIX = ".partial-";

    private final Map<StorageArea, Path> roots = new EnumMap<>(StorageArea.class);

    /**
     * Creates the store and makes sure both directories exist.
     *
     * @param properties storage locations
     * @throws ArtifactStoreException when a directory cannot be created
     */
    public FileSystemArtifactStore(PdfMergeProperties properties) {
        roots.put(StorageArea.UPLOADS, createDirectory(properties.storage().uploadDir()));
        roots.put(StorageArea.OUTPUT, createDirectory(properties.storage().outputDir()));
    }

    @Override
    public ArtifactHandle store(StorageArea area, String name, byte[] content) {
        return store(area, name, target -> target.write(content));
    }

    @Override
    public ArtifactHandle store(StorageArea area, String name, ArtifactWriter writer) {
        Path target = resolve(area, name);
        if (Files.exists(target)) {
            throw new ArtifactStoreException("Artifact already exists: " + name, new FileAlreadyExistsException(target.toString()));
        }

        Path partial = null;
        boolean moved = false;
        try {
            partial = Files.createTempFile(target.getParent(), PARTIAL_PREFIX, ".tmp");
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(partial))) {
                writer.write(out);
            }
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);
            moved = true;
            log.debug("Stored {} in {}", name, area);
            return new ArtifactHandle(area, name);
        } catch (IOException e) {
            throw new ArtifactStoreException("Unable to store " + name, e);
        } finally {
            if (!moved && partial != null) {
                deletePartial(partial);
            }
        }
    }

    @Override
    public byte[] load(ArtifactHandle handle) {
        try {
            return Files.readAllBytes(resolve(handle.area(), handle.name()));
        } catch (IOException e) {
            throw new ArtifactStoreException("Unable to read " + handle.name(), e);
        }
    }

    @Override
    public Optional<ArtifactHandle> find(StorageArea area, String name) {
        Path path = resolve(area, name);
        return Files.isRegularFile(path) ? Optional.of(new ArtifactHandle(area, name)) : Optional.empty();
    }

    @Override
    public long size(ArtifactHandle handle) {
        try {
            return Files.size(resolve(handle.area(), handle.name()));
        } catch (IOException e) {
            throw new ArtifactStoreException("Unable to determine the size of " + handle.name(), e);
        }
    }

    @Override
    public void delete(ArtifactHandle handle) {
        try {
            if (Files.deleteIfExists(resolve(handle.area(), handle.name()))) {
                log.debug("Deleted {} from {}", handle.name(), handle.area());
            }
        } catch (IOException e) {
            throw new ArtifactStoreException("Unable to delete " + handle.name(), e);
        }
    }

    /**
     * Resolves a name inside its area, refusing anything that would leave the area's directory.
     *
     * @param area storage area
     * @param name plain file name
     * @return absolute path of the artifact
     */
    private Path resolve(StorageArea area, String name) {
        if (name == null || name.isBlank() || name.startsWith(".")
                || name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("Not a plain artifact name: " + name);
        }
        Path root = roots.get(area);
        Path path = root.resolve(name).normalize();
        if (!root.equals(path.getParent())) {
            throw new IllegalArgumentException("Not a plain artifact name: " + name);
        }
        return path;
    }

    private static Path createDirectory(String directory) {
        Path path = Path.of(directory).toAbsolutePath().normalize();
        try {
            return Files.createDirectories(path);
        } catch (IOException e) {
            throw new ArtifactStoreException("Could not create directory " + path, e);
        }
    }

    private static void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Could not remove partial file {}", partial, e);
        }
    }
}
