package com.ailab.core.ledger;

import com.ailab.core.model.Environment;
import com.ailab.core.model.User;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Stores the ledger as a single JSON document.
 *
 * <p>Every save copies the current file to {@code <file>.backup.<yyyyMMdd-HHmmss-SSS>-<seq>},
 * writes the new document to a temp file in the same directory, forces it to disk and
 * atomically moves it over the target. At most {@code maxBackups} backups are kept.
 *
 * <p>On load, a document that cannot be parsed is replaced by the newest backup that can.
 * An individual environment entry that cannot be parsed is moved to the document's
 * {@code quarantine} section verbatim so an operator can inspect it.
 */
public class JsonFileLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLedgerStore.class);

    static final String BACKUP_MARKER = ".backup.";
    static final String UNREADABLE_DOCUMENT_KEY = "_document";
    private static final DateTimeFormatter BACKUP_SUFFIX =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final Path file;
    private final int maxBackups;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JsonFileLedgerStore(Path file, int maxBackups, Clock clock) {
        this(file, maxBackups, defaultMapper(), clock);
    }

    public JsonFileLedgerStore(Path file, int maxBackups, ObjectMapper mapper, Clock clock) {
        this.file = file.toAbsolutePath();
        this.maxBackups = Math.max(1, maxBackups);
        this.mapper = mapper;
        this.clock = clock;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public LedgerDocument load() {
        if (!Files.exists(file)) {
            log.info("No ledger at {}, starting empty", file);
            return LedgerDocument.empty();
        }
        try {
            return parse(Files.readAllBytes(file));
        } catch (IOException e) {
            log.error("Ledger {} is unreadable: {}", file, e.getMessage());
        }

        for (Path backup : backups()) {
            try {
                LedgerDocument document = parse(Files.readAllBytes(backup));
                log.warn("Recovered ledger from backup {}", backup.getFileName());
                return document;
            } catch (IOException e) {
                log.warn("Backup {} is unreadable as well: {}", backup.getFileName(), e.getMessage());
            }
        }

        log.error("No readable ledger or backup at {}; starting empty, runtime state will be re-adopted", file);
        String raw;
        try {
            raw = Files.readString(file);
        } catch (IOException e) {
            raw = "<unreadable: " + e.getMessage() + ">";
        }
        return new LedgerDocument(LedgerDocument.CURRENT_VERSION, Map.of(), List.of(), List.of(), Map.of(),
                Map.of(UNREADABLE_DOCUMENT_KEY, raw));
    }

    private LedgerDocument parse(byte[] content) throws IOException {
        JsonNode root = mapper.readTree(content);
        if (root == null || !root.isObject()) {
            throw new IOException("Ledger root is not a JSON object");
        }

        var environments = new LinkedHashMap<String, Environment>();
        var quarantine = new LinkedHashMap<String, String>();
        JsonNode previouslyQuarantined = root.path("quarantine");
        for (Iterator<Map.Entry<String, JsonNode>> it = previouslyQuarantined.fields(); it.hasNext(); ) {
            var entry = it.next();
            quarantine.put(entry.getKey(), entry.getValue().asText());
        }

        for (Iterator<Map.Entry<String, JsonNode>> it = root.path("environments").fields(); it.hasNext(); ) {
            var entry = it.next();
            try {
                Environment env = mapper.treeToValue(entry.getValue(), Environment.class);
                if (!entry.getKey().equals(env.id())) {
                    throw new IOException("Entry key " + entry.getKey() + " does not match id " + env.id());
                }
                environments.put(env.id(), env);
            } catch (IOException | IllegalArgumentException e) {
                log.error("Quarantining unreadable ledger entry {}: {}", entry.getKey(), e.getMessage());
                quarantine.put(entry.getKey(), entry.getValue().toString());
            }
        }

        var users = new LinkedHashMap<String, User>();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.path("users").fields(); it.hasNext(); ) {
            var entry = it.next();
            try {
                users.put(entry.getKey(), mapper.treeToValue(entry.getValue(), User.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable user record {}: {}", entry.getKey(), e.getMessage());
            }
        }

        return new LedgerDocument(
                root.path("version").asInt(LedgerDocument.CURRENT_VERSION),
                environments,
                intList(root.path("allocatedHostPorts")),
                intList(root.path("allocatedGpuIndices")),
                users,
                quarantine);
    }

    private static List<Integer> intList(JsonNode node) {
        var values = new ArrayList<Integer>();
        if (node.isArray()) {
            node.forEach(n -> values.add(n.asInt()));
        }
        return values;
    }

    @Override
    public synchronized void save(LedgerDocument document) {
        try {
            Files.createDirectories(file.getParent());
            if (Files.exists(file)) {
                Files.copy(file, nextBackupPath());
            }

            ObjectNode root = mapper.valueToTree(document);
            byte[] bytes = mapper.writeValueAsBytes(root);
            Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                    ByteBuffer buffer = ByteBuffer.wrap(bytes);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            pruneBackups();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist ledger to " + file, e);
        }
    }

    /**
     * Several saves can land in the same millisecond, so the timestamp gets a sequence
     * number that keeps names unique and in write order.
     */
    private Path nextBackupPath() {
        String base = file.getFileName() + BACKUP_MARKER + BACKUP_SUFFIX.format(clock.instant());
        for (int seq = 0; ; seq++) {
            Path candidate = file.resolveSibling(base + String.format("-%04d", seq));
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }

    /** Backups, newest first. */
    List<Path> backups() {
        String prefix = file.getFileName() + BACKUP_MARKER;
        try (Stream<Path> siblings = Files.list(file.getParent())) {
            return siblings
                    .filter(p -> p.getFileName().toString().startsWith(prefix))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list ledger backups in {}: {}", file.getParent(), e.getMessage());
            return List.of();
        }
    }

    private void pruneBackups() {
        List<Path> all = backups();
        for (Path stale : all.subList(Math.min(maxBackups, all.size()), all.size())) {
            try {
                Files.deleteIfExists(stale);
            } catch (IOException e) {
                log.warn("Could not delete old ledger backup {}: {}", stale.getFileName(), e.getMessage());
            }
        }
    }

    @Override
    public String describe() {
        return file.toString();
    }

    @Override
    public boolean isWritable() {
        if (Files.exists(file)) {
            return Files.isWritable(file);
        }
        Path dir = file.getParent();
        return !Files.isDirectory(dir) || Files.isWritable(dir);
    }
}
