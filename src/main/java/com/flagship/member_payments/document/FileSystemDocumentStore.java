package com.flagship.member_payments.document;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores documents on local disk under {@code documents.storage.directory}.
 *
 * Writes go to a temp file first and are moved into place, so a reader never
 * sees a half-written document.
 */
@Component
@Slf4j
public class FileSystemDocumentStore implements DocumentStore {

    private final Path root;
    private final String publicBaseUrl;

    public FileSystemDocumentStore(@Value("${documents.storage.directory:./storage/documents}") String directory,
                                   @Value("${documents.storage.public-base-url:http://localhost:8080/documents/}") String publicBaseUrl) {
        this.root = Path.of(directory).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
    }

    @Override
    public String store(String name, byte[] content, String contentType) {
        Path target = root.resolve(name).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Document name escapes the storage directory: " + name);
        }
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            try {
                Files.write(temp, content);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                deleteQuietly(temp, e);
                throw e;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store document " + name, e);
        }
        log.debug("Stored {} ({} bytes, {})", target, content.length, contentType);
        return publicBaseUrl + name;
    }

    private static void deleteQuietly(Path temp, IOException cause) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
