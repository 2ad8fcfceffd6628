package tech.yump.ledger.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link SegmentStore} writing JSON Lines files named {@code <prefix>-YYYY-MM.jsonl} into one directory.
 */
@Slf4j
public class FileSystemSegmentStore implements SegmentStore {

    static final String EXTENSION = ".jsonl";
    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final Path directory;
    private final String prefix;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Pattern segmentName;

    public FileSystemSegmentStore(Path directory, String prefix, ObjectMapper objectMapper, Clock clock) {
        if (directory == null) {
            throw new IllegalArgumentException("Segment directory cannot be null.");
        }
        if (!StringUtils.hasText(prefix)) {
            throw new IllegalArgumentException("Segment prefix cannot be null or empty.");
        }
        this.directory = directory.toAbsolutePath().normalize();
        this.prefix = prefix;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.segmentName = Pattern.compile(Pattern.quote(prefix) + "-(\\d{4}-\\d{2})" + Pattern.quote(EXTENSION));
        log.debug("Segment store for prefix '{}' at {}", prefix, this.directory);
    }

    @Override
    public Path directory() {
        return directory;
    }

    public String prefix() {
        return prefix;
    }

    @Override
    public Path currentSegmentPath() {
        return segmentPath(YearMonth.now(clock.withZone(ZoneOffset.UTC)));
    }

    public Path segmentPath(YearMonth period) {
        return directory.resolve(prefix + "-" + PERIOD_FORMAT.format(period) + EXTENSION);
    }

    /**
     * Period encoded in the name of one of this store's segments, empty for any other file.
     */
    public Optional<YearMonth> periodOf(Path segment) {
        Matcher matcher = segmentName.matcher(segment.getFileName().toString());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(YearMonth.parse(matcher.group(1), PERIOD_FORMAT));
    }

    @Override
    public void append(Path segment, String line) throws StorageException {
        if (line == null || line.indexOf('\n') >= 0 || line.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("A segment line must be non-null and must not contain line breaks.");
        }
        try {
            SecureFiles.createDirectories(directory);
            // A torn last line from an interrupted write is closed off so it stays a separate, skippable line.
            String prefixBreak = endsUnterminated(segment) ? "\n" : "";
            if (!prefixBreak.isEmpty()) {
                log.warn("Segment {} ends with an unterminated line; closing it before appending", segment);
            }
            SecureFiles.append(segment, prefixBreak + line + "\n");
        } catch (IOException e) {
            log.error("Failed to append to segment {}: {}", segment, e.getMessage(), e);
            throw new StorageException("Failed to append to segment: " + segment, e);
        }
    }

    private static boolean endsUnterminated(Path segment) throws IOException {
        if (!Files.isRegularFile(segment)) {
            return false;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(segment, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return false;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            return channel.read(last) == 1 && last.get(0) != '\n';
        }
    }

    @Override
    public List<Path> listSegments(SegmentOrder order) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> segments = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, prefix + "-*" + EXTENSION)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry) && periodOf(entry).isPresent()) {
                    segments.add(entry);
                }
            }
        } catch (IOException e) {
            log.error("Failed to list segments in {}: {}", directory, e.getMessage(), e);
            throw new StorageException("Failed to list segments in: " + directory, e);
        }
        Comparator<Path> byName = Comparator.comparing(p -> p.getFileName().toString());
        segments.sort(order == SegmentOrder.NEWEST_FIRST ? byName.reversed() : byName);
        return segments;
    }

    @Override
    public SegmentLines readLines(Path segment) {
        String content;
        try {
            content = new String(Files.readAllBytes(segment), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return new SegmentLines(segment, List.of(), 0, null);
        } catch (IOException e) {
            log.warn("Segment {} could not be read: {}", segment, e.getMessage());
            return SegmentLines.unreadable(segment, e.getMessage());
        }

        List<SegmentLine> lines = new ArrayList<>();
        int skipped = 0;
        String[] rawLines = content.split("\n", -1);
        for (int i = 0; i < rawLines.length; i++) {
            String raw = stripCarriageReturn(rawLines[i]);
            if (raw.isBlank()) {
                continue;
            }
            ObjectNode node = parse(raw);
            if (node == null) {
                skipped++;
                log.debug("Skipping unparsable line {} of segment {}", i + 1, segment);
                continue;
            }
            lines.add(new SegmentLine(i + 1, raw, node));
        }
        if (skipped > 0) {
            log.warn("Skipped {} unparsable line(s) in segment {}", skipped, segment);
        }
        return new SegmentLines(segment, lines, skipped, null);
    }

    private ObjectNode parse(String raw) {
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node != null && node.isObject() ? (ObjectNode) node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
