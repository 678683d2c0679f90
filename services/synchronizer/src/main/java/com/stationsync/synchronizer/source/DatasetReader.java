package com.stationsync.synchronizer.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.exception.DatasetFormatException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes CSV result files. The separator is {@code ;} when the header line has more
 * semicolons than commas, otherwise {@code ,}.
 */
@Component
public class DatasetReader {

    private static final TypeReference<Map<String, String>> ROW = new TypeReference<>() {};
    private static final char BOM = '\uFEFF';

    private final CsvMapper csvMapper;
    private final Charset charset;

    @Autowired
    public DatasetReader(SyncProperties properties) {
        this(Charset.forName(properties.getSource().getCharset()));
    }

    DatasetReader(Charset charset) {
        this.charset = charset;
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
    }

    public Dataset read(byte[] content) {
        String text = new String(content, charset);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        if (text.isBlank()) {
            throw new DatasetFormatException("Dataset is empty");
        }

        CsvSchema schema = CsvSchema.emptySchema()
                .withHeader()
                .withColumnSeparator(detectSeparator(text));

        try (MappingIterator<Map<String, String>> iterator = csvMapper.readerFor(ROW).with(schema).readValues(text)) {
            List<Map<String, String>> raw = new ArrayList<>();
            while (iterator.hasNextValue()) {
                raw.add(iterator.nextValue());
            }
            CsvSchema parsed = (CsvSchema) iterator.getParserSchema();
            if (parsed == null || parsed.size() == 0) {
                throw new DatasetFormatException("Dataset has no header row");
            }
            List<String> columns = parsed.getColumnNames().stream().map(String::trim).toList();
            return new Dataset(columns, raw.stream().map(DatasetReader::trimKeys).toList());
        } catch (DatasetFormatException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DatasetFormatException("Malformed CSV: " + e.getMessage(), e);
        }
    }

    static char detectSeparator(String text) {
        int end = text.indexOf('\n');
        String header = end >= 0 ? text.substring(0, end) : text;
        long semicolons = header.chars().filter(c -> c == ';').count();
        long commas = header.chars().filter(c -> c == ',').count();
        return semicolons > commas ? ';' : ',';
    }

    private static Map<String, String> trimKeys(Map<String, String> row) {
        Map<String, String> trimmed = new LinkedHashMap<>();
        row.forEach((key, value) -> trimmed.put(key.trim(), value));
        return trimmed;
    }
}
