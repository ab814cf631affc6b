package apprunner.worker.store;

import apprunner.common.Json;
import apprunner.common.model.ResultRecord;
import apprunner.worker.repository.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Result store keeping one JSON file per ticket: {@code <dir>/<ticket>.json}.
 *
 * Writers serialize on this instance and publish via write-to-temp then atomic
 * rename, so readers never take a lock and never see a partial record.
 */
public class FileResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(FileResultStore.class);

    private static final Pattern TICKET_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;

    public FileResultStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create results directory " + directory, e);
        }
        log.info("Result store at {}", directory.toAbsolutePath());
    }

    public Path directory() {
        return directory;
    }

    @Override
    public synchronized boolean create(ResultRecord record) {
        if (Files.exists(pathFor(record.ticket()))) {
            return false;
        }
        publish(record);
        return true;
    }

    @Override
    public synchronized boolean completeIfRunning(ResultRecord terminal) {
        Optional<ResultRecord> current = read(terminal.ticket());
        if (current.isEmpty() || current.get().isTerminal()) {
            return false;
        }
        publish(terminal);
        return true;
    }

    @Override
    public Optional<ResultRecord> read(String ticket) {
        Path path = pathFor(ticket);
        try {
            byte[] bytes = Files.readAllBytes(path);
            return Optional.of(Json.mapper().readValue(bytes, ResultRecord.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read result for ticket " + ticket, e);
        }
    }

    @Override
    public synchronized boolean delete(String ticket) {
        try {
            return Files.deleteIfExists(pathFor(ticket));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete result for ticket " + ticket, e);
        }
    }

    @Override
    public List<ResultRecord> findAll() {
        List<ResultRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String ticket = name.substring(0, name.length() - SUFFIX.length());
                if (!TICKET_PATTERN.matcher(ticket).matches()) {
                    continue;
                }
                try {
                    read(ticket).ifPresent(records::add);
                } catch (UncheckedIOException e) {
                    log.warn("Skipping unreadable result file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list results in " + directory, e);
        }
        return records;
    }

    private void publish(ResultRecord record) {
        Path target = pathFor(record.ticket());
        Path tmp = directory.resolve("." + record.ticket() + ".tmp");
        try {
            Files.write(tmp, Json.mapper().writeValueAsBytes(record));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, falling back to replace", directory);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote result {} -> {}", record.ticket(), record.status());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write result for ticket " + record.ticket(), e);
        }
    }

    private Path pathFor(String ticket) {
        if (ticket == null || !TICKET_PATTERN.matcher(ticket).matches()) {
            throw new IllegalArgumentException("Invalid ticket: " + ticket);
        }
        return directory.resolve(ticket + SUFFIX);
    }
}
