package com.example.lobby.runtime;

import com.example.lobby.config.LobbyStorageProperties;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.springframework.stereotype.Component;

@Component
public class FileSystemBlobStore implements BlobStore {

  private static final String ARCHIVE_SUFFIX = ".zip";

  private final Path blobRoot;

  public FileSystemBlobStore(LobbyStorageProperties properties) {
    this.blobRoot = properties.blobRoot().toAbsolutePath().normalize();
  }

  @Override
  public String store(String versionId, byte[] content) throws IOException {
    Files.createDirectories(blobRoot);
    final String blobRef = versionId + ARCHIVE_SUFFIX;
    final Path target = resolve(blobRef);
    final Path temp = Files.createTempFile(blobRoot, versionId, ".tmp");
    // 書き込み途中のファイルを fetch させないため、一時ファイルから差し替える。
    Files.write(temp, content);
    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    return blobRef;
  }

  @Override
  public byte[] fetch(String blobRef) throws IOException {
    final Path path = resolve(blobRef);
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString());
    }
    return Files.readAllBytes(path);
  }

  @Override
  public void unpack(byte[] content, Path targetDir) throws IOException {
    final Path root = targetDir.toAbsolutePath().normalize();
    Files.createDirectories(root);
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(content))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        final Path destination = root.resolve(entry.getName()).normalize();
        if (!destination.startsWith(root)) {
          throw new IOException("archive entry escapes target directory: " + entry.getName());
        }
        if (entry.isDirectory()) {
          Files.createDirectories(destination);
        } else {
          Files.createDirectories(destination.getParent());
          Files.copy(zip, destination, StandardCopyOption.REPLACE_EXISTING);
        }
        zip.closeEntry();
      }
    }
  }

  private Path resolve(String blobRef) throws IOException {
    final Path path = blobRoot.resolve(blobRef).normalize();
    if (!path.startsWith(blobRoot)) {
      throw new IOException("blob reference escapes storage root: " + blobRef);
    }
    return path;
  }
}
