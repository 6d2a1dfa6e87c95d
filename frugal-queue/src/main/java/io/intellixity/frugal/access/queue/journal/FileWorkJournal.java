package io.intellixity.frugal.access.queue.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * JSON-lines journal in a single append-only file. A torn final line (crash mid-write) is skipped
 * on replay; a corrupt line anywhere else fails the replay.
 */
public final class FileWorkJournal implements WorkJournal {
  private static final Logger log = LoggerFactory.getLogger(FileWorkJournal.class);

  private static final ObjectMapper JSON = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private final Path file;
  private final boolean fsync;
  private FileOutputStream out;
  private BufferedWriter writer;

  public FileWorkJournal(Path file, boolean fsync) {
    this.file = Objects.requireNonNull(file, "file");
    this.fsync = fsync;
  }

  public Path file() { return file; }

  @Override
  public synchronized void append(JournalEntry entry) {
    try {
      ensureOpen();
      writer.write(JSON.writeValueAsString(entry));
      writer.newLine();
      writer.flush();
      if (fsync) out.getChannel().force(false);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to append to work journal " + file, e);
    }
  }

  @Override
  public synchronized void replay(Consumer<JournalEntry> sink) {
    if (!Files.exists(file)) return;
    List<String> lines = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!line.isBlank()) lines.add(line);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read work journal " + file, e);
    }
    for (int i = 0; i < lines.size(); i++) {
      JournalEntry entry;
      try {
        entry = JSON.readValue(lines.get(i), JournalEntry.class);
      } catch (JsonProcessingException e) {
        if (i == lines.size() - 1) {
          log.warn("frugal.journal skipping torn last line file={} line={}", file, i + 1);
          return;
        }
        throw new IllegalStateException("Corrupt work journal " + file + " at line " + (i + 1), e);
      }
      sink.accept(entry);
    }
  }

  /** Writes the snapshot to a sibling file and moves it over the journal in one step. */
  @Override
  public synchronized void rewrite(List<JournalEntry> snapshot) {
    Path tmp = file.resolveSibling(file.getFileName() + ".compact");
    close();
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      try (FileOutputStream o = new FileOutputStream(tmp.toFile(), false);
           BufferedWriter w = new BufferedWriter(new OutputStreamWriter(o, StandardCharsets.UTF_8))) {
        for (JournalEntry entry : snapshot) {
          w.write(JSON.writeValueAsString(entry));
          w.newLine();
        }
        w.flush();
        o.getChannel().force(true);
      }
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      UncheckedIOException failure = new UncheckedIOException("Failed to compact work journal " + file, e);
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        failure.addSuppressed(cleanup);
      }
      throw failure;
    }
    log.info("frugal.journal compacted file={} records={}", file, snapshot.size());
  }

  @Override
  public synchronized void close() {
    if (writer == null) return;
    try {
      writer.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close work journal " + file, e);
    } finally {
      writer = null;
      out = null;
    }
  }

  private void ensureOpen() throws IOException {
    if (writer != null) return;
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    dropTornTail();
    out = new FileOutputStream(file.toFile(), true);
    writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
  }

  /** Cuts a partial last line so the next append starts on a line of its own. */
  private void dropTornTail() throws IOException {
    if (!Files.exists(file)) return;
    try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
      long size = ch.size();
      long keep = size;
      ByteBuffer one = ByteBuffer.allocate(1);
      while (keep > 0) {
        one.clear();
        ch.read(one, keep - 1);
        if (one.get(0) == '\n') break;
        keep--;
      }
      if (keep < size) {
        log.warn("frugal.journal truncating torn tail file={} bytes={}", file, size - keep);
        ch.truncate(keep);
      }
    }
  }
}
