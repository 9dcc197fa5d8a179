package com.codeheadsystems.tollgate.client.session;

import com.codeheadsystems.tollgate.client.exceptions.SessionStorageException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStorage} persisted as a properties file, so a session survives client restarts.
 * <p>
 * Every write replaces the whole file through a temporary sibling and a move, so the three
 * session keys are always written and cleared together. An unreadable file is treated as empty.
 */
public class FileSessionStorage implements SessionStorage {

  private static final Logger log = LoggerFactory.getLogger(FileSessionStorage.class);

  private final Path file;
  private final Properties properties = new Properties();

  /**
   * Opens the storage, loading the file if it exists.
   *
   * @param file the properties file
   */
  public FileSessionStorage(final Path file) {
    this.file = file;
    if (Files.exists(file)) {
      try (InputStream in = Files.newInputStream(file)) {
        properties.load(in);
      } catch (IOException | IllegalArgumentException e) {
        log.warn("Ignoring unreadable session file {}: {}", file, e.getMessage());
        properties.clear();
      }
    }
  }

  @Override
  public synchronized Optional<String> get(final String key) {
    return Optional.ofNullable(properties.getProperty(key));
  }

  @Override
  public synchronized void putAll(final Map<String, String> entries) {
    Properties next = copy();
    next.putAll(entries);
    write(next);
  }

  @Override
  public synchronized void removeAll(final Collection<String> keys) {
    Properties next = copy();
    keys.forEach(next::remove);
    write(next);
  }

  private Properties copy() {
    Properties next = new Properties();
    next.putAll(properties);
    return next;
  }

  private void write(Properties next) {
    Path tmp = null;
    try {
      Path parent = file.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      try (OutputStream out = Files.newOutputStream(tmp)) {
        next.store(out, "tollgate session");
      }
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move unsupported for {}, falling back to replace", file);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      SessionStorageException failure =
          new SessionStorageException("Could not write session file " + file, e);
      deleteQuietly(tmp, failure);
      throw failure;
    }
    properties.clear();
    properties.putAll(next);
  }

  private static void deleteQuietly(Path tmp, SessionStorageException failure) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }
}
