/**
 * Append-only CSV store of accepted image metadata for one collection
 *
 * @author William Callahan
 *
 * Features:
 * - Assigns monotonically increasing ids (max existing id + 1) at write time
 * - Creates the file with its header row on first save
 * - Seeds resumable deduplication through loadExistingHashes
 * - Computes collection statistics and removes orphaned image files
 * - Exports the full store as CSV, JSON or an XLSX workbook
 */
package com.williamcallahan.boxhunt.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.model.MetadataRecord;
import com.williamcallahan.boxhunt.types.ExportFormat;
import com.williamcallahan.boxhunt.types.StoreStatistics;
import com.williamcallahan.boxhunt.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
public class MetadataStore {

    public static final String METADATA_FILE_NAME = "metadata.csv";
    public static final String IMAGES_DIR_NAME = "images";

    private final Path collectionDir;
    private final Path metadataFile;
    private final Path imagesDir;
    private final HarvestProperties.Images imageRules;
    private final CsvMapper csvMapper;
    private final CsvSchema schema;
    private final ObjectMapper jsonMapper;

    /**
     * @param collectionDir directory holding {@code metadata.csv} and {@code images/}
     * @param imageRules allowed formats used by orphan cleanup
     * @param jsonMapper mapper used for JSON export
     */
    public MetadataStore(Path collectionDir, HarvestProperties.Images imageRules, ObjectMapper jsonMapper) {
        this.collectionDir = collectionDir;
        this.metadataFile = collectionDir.resolve(METADATA_FILE_NAME);
        this.imagesDir = collectionDir.resolve(IMAGES_DIR_NAME);
        this.imageRules = imageRules;
        this.csvMapper = new CsvMapper();
        this.schema = csvMapper.schemaFor(MetadataRecord.class);
        this.jsonMapper = jsonMapper;
    }

    public Path getCollectionDir() {
        return collectionDir;
    }

    public Path getMetadataFile() {
        return metadataFile;
    }

    public Path getImagesDir() {
        return imagesDir;
    }

    /**
     * Appends records, assigning each an id and creation timestamp.
     *
     * @param records records emitted by the image processor; their id is ignored
     * @return the records as written
     * @throws MetadataStoreException if the store cannot be read or appended to
     */
    public synchronized List<MetadataRecord> save(List<MetadataRecord> records) {
        if (ValidationUtils.isNullOrEmpty(records)) {
            return List.of();
        }
        long nextId = loadAll().stream().mapToLong(MetadataRecord::id).max().orElse(0L) + 1;
        String createdAt = LocalDateTime.now().toString();

        List<MetadataRecord> assigned = new ArrayList<>(records.size());
        for (MetadataRecord record : records) {
            assigned.add(record.withIdentity(nextId++, createdAt));
        }

        try {
            Files.createDirectories(collectionDir);
            boolean writeHeader = !Files.exists(metadataFile) || Files.size(metadataFile) == 0;
            CsvSchema writeSchema = writeHeader ? schema.withHeader() : schema.withoutHeader();
            try (Writer writer = Files.newBufferedWriter(metadataFile, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 SequenceWriter sequenceWriter = csvMapper.writer(writeSchema).writeValues(writer)) {
                sequenceWriter.writeAll(assigned);
            }
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to append " + assigned.size() + " record(s) to " + metadataFile, e);
        }
        log.info("Saved {} metadata record(s) to {} (ids {}..{})", assigned.size(), metadataFile,
            assigned.get(0).id(), assigned.get(assigned.size() - 1).id());
        return assigned;
    }

    /**
     * Reads every record; an absent store reads as empty
     *
     * @throws MetadataStoreException if the file exists but cannot be parsed
     */
    public synchronized List<MetadataRecord> loadAll() {
        if (!Files.exists(metadataFile)) {
            return List.of();
        }
        try (MappingIterator<MetadataRecord> iterator = csvMapper.readerFor(MetadataRecord.class)
                .with(schema.withHeader())
                .readValues(metadataFile.toFile())) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to read metadata from " + metadataFile, e);
        }
    }

    /**
     * Every persisted perceptual hash, in file order
     */
    public Set<String> loadExistingHashes() {
        return loadAll().stream()
            .map(MetadataRecord::perceptualHash)
            .filter(ValidationUtils::hasText)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Every persisted source URL, in file order
     */
    public Set<String> loadExistingUrls() {
        return loadAll().stream()
            .map(MetadataRecord::url)
            .filter(ValidationUtils::hasText)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public StoreStatistics statistics() {
        List<MetadataRecord> records = loadAll();
        if (records.isEmpty()) {
            return StoreStatistics.empty();
        }
        long totalSize = records.stream().mapToLong(MetadataRecord::fileSize).sum();
        Map<String, Long> sources = records.stream()
            .collect(Collectors.groupingBy(record -> record.source() == null ? "" : record.source(),
                TreeMap::new, Collectors.counting()));
        Map<String, Long> formats = records.stream()
            .collect(Collectors.groupingBy(record -> extensionOf(record.filename()), TreeMap::new, Collectors.counting()));
        long widthSum = records.stream().mapToLong(MetadataRecord::width).sum();
        long heightSum = records.stream().mapToLong(MetadataRecord::height).sum();
        int count = records.size();
        return new StoreStatistics(count, totalSize, sources, (int) (widthSum / count), (int) (heightSum / count), formats);
    }

    /**
     * Deletes image files that no record references.
     * <p>
     * Only files with an allowed image extension are considered. When the metadata
     * file does not exist nothing is deleted.
     *
     * @return number of files removed
     */
    public synchronized int cleanupOrphans() {
        if (!Files.exists(metadataFile) || !Files.isDirectory(imagesDir)) {
            log.info("Nothing to clean up in {}: no metadata store or images directory", collectionDir);
            return 0;
        }
        Set<String> referenced = loadAll().stream()
            .map(MetadataRecord::filename)
            .filter(ValidationUtils::hasText)
            .collect(Collectors.toCollection(HashSet::new));

        List<Path> orphans;
        try (Stream<Path> files = Files.list(imagesDir)) {
            orphans = files
                .filter(Files::isRegularFile)
                .filter(path -> imageRules.isAllowedFileName(path.getFileName().toString()))
                .filter(path -> !referenced.contains(path.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to list images in " + imagesDir, e);
        }

        int removed = 0;
        for (Path orphan : orphans) {
            try {
                Files.deleteIfExists(orphan);
                removed++;
                log.debug("Removed orphaned file {}", orphan.getFileName());
            } catch (IOException e) {
                log.warn("Could not remove orphaned file {}: {}", orphan, e.getMessage());
            }
        }
        log.info("Removed {} orphaned file(s) from {}", removed, imagesDir);
        return removed;
    }

    /**
     * Writes the whole store to {@code target} in the given format.
     *
     * @return the written path, or empty when the store does not exist yet
     * @throws MetadataStoreException on read or write failure
     */
    public Optional<Path> export(ExportFormat format, Path target) {
        if (!Files.exists(metadataFile)) {
            log.warn("No metadata store at {}; nothing to export", metadataFile);
            return Optional.empty();
        }
        List<MetadataRecord> records = loadAll();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (format == ExportFormat.JSON) {
                jsonMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), records);
            } else if (format == ExportFormat.XLSX) {
                writeWorkbook(records, target);
            } else {
                try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                     SequenceWriter sequenceWriter = csvMapper.writer(schema.withHeader()).writeValues(writer)) {
                    sequenceWriter.writeAll(records);
                }
            }
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to export metadata to " + target, e);
        }
        log.info("Exported {} record(s) as {} to {}", records.size(), format, target);
        return Optional.of(target);
    }

    /**
     * One "metadata" sheet: the CSV column names as header row, then one row per record
     */
    private void writeWorkbook(List<MetadataRecord> records, Path target) throws IOException {
        List<String> columns = new ArrayList<>(schema.size());
        schema.forEach(column -> columns.add(column.getName()));

        try (XSSFWorkbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(target)) {
            Sheet sheet = workbook.createSheet("metadata");
            Row header = sheet.createRow(0);
            for (int i = 0; i < columns.size(); i++) {
                header.createCell(i).setCellValue(columns.get(i));
            }
            int rowIndex = 1;
            for (MetadataRecord record : records) {
                Map<String, Object> values = jsonMapper.convertValue(record, new TypeReference<Map<String, Object>>() {});
                Row row = sheet.createRow(rowIndex++);
                for (int i = 0; i < columns.size(); i++) {
                    Object value = values.get(columns.get(i));
                    if (value instanceof Number number) {
                        row.createCell(i).setCellValue(number.doubleValue());
                    } else {
                        row.createCell(i).setCellValue(value == null ? "" : value.toString());
                    }
                }
            }
            workbook.write(out);
        }
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "unknown";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "unknown";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
