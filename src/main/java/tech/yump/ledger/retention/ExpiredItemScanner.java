package tech.yump.ledger.retention;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the items of a storage location that are older than a cutoff.
 * <p>
 * An item expires when its age instant is strictly before the cutoff. The age instant is the modification
 * time, except for files of dated log or event data types (names containing {@code logs} or {@code events})
 * whose file name carries a period: a {@code YYYY-MM-DD} date counts from the start of that UTC day, and a
 * {@code YYYY-MM} month stamp only expires once the whole month lies before the cutoff.
 */
@Slf4j
public class ExpiredItemScanner {

    private static final Pattern DAY_STAMP = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{2})-(\\d{2})(?!\\d)");
    private static final Pattern MONTH_STAMP = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{2})(?![-\\d])");

    /**
     * Expired items at the location, in file name order. Entries that vanish or cannot be inspected
     * are skipped.
     *
     * @throws IOException if the location is a directory that cannot be listed.
     */
    public List<ExpiredItem> scan(Path location, String dataType, Instant cutoff) throws IOException {
        if (Files.isRegularFile(location, LinkOption.NOFOLLOW_LINKS)) {
            return inspect(location, cutoff, false).map(List::of).orElse(List.of());
        }
        if (!Files.isDirectory(location)) {
            return List.of();
        }

        boolean dated = isDatedDataType(dataType);
        List<ExpiredItem> expired = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(location)) {
            for (Path entry : entries) {
                if (!Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                inspect(entry, cutoff, dated).ifPresent(expired::add);
            }
        }
        expired.sort(Comparator.comparing(item -> item.path().getFileName().toString()));
        return expired;
    }

    static boolean isDatedDataType(String dataType) {
        return dataType != null && (dataType.contains("logs") || dataType.contains("events"));
    }

    static boolean isExpired(Instant age, Instant cutoff) {
        return age.isBefore(cutoff);
    }

    /**
     * Period-based expiry derived from the file name, empty when the name carries no usable date.
     */
    static Optional<Boolean> expiredByName(String fileName, Instant cutoff) {
        Matcher day = DAY_STAMP.matcher(fileName);
        if (day.find()) {
            try {
                LocalDate date = LocalDate.of(Integer.parseInt(day.group(1)), Integer.parseInt(day.group(2)), Integer.parseInt(day.group(3)));
                return Optional.of(isExpired(date.atStartOfDay(ZoneOffset.UTC).toInstant(), cutoff));
            } catch (DateTimeException e) {
                log.debug("Ignoring invalid date in file name '{}'", fileName);
            }
        }
        Matcher month = MONTH_STAMP.matcher(fileName);
        if (month.find()) {
            try {
                YearMonth period = YearMonth.of(Integer.parseInt(month.group(1)), Integer.parseInt(month.group(2)));
                Instant monthEnd = period.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
                return Optional.of(!monthEnd.isAfter(cutoff));
            } catch (DateTimeException e) {
                log.debug("Ignoring invalid month in file name '{}'", fileName);
            }
        }
        return Optional.empty();
    }

    private Optional<ExpiredItem> inspect(Path file, Instant cutoff, boolean dated) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            boolean expired = dated
                    ? expiredByName(file.getFileName().toString(), cutoff)
                            .orElseGet(() -> isExpired(attributes.lastModifiedTime().toInstant(), cutoff))
                    : isExpired(attributes.lastModifiedTime().toInstant(), cutoff);
            return expired ? Optional.of(new ExpiredItem(file, attributes.size())) : Optional.empty();
        } catch (IOException e) {
            log.debug("Skipping {} during retention scan: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
