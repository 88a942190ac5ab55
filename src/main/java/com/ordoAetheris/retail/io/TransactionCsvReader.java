package com.ordoAetheris.retail.io;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.ordoAetheris.retail.analysis.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParsePosition;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazy reader for the Online Retail CSV export.
 *
 * <p>Rows are parsed one at a time while the returned iterator advances, so the file is
 * never held in memory. The reader can be iterated once. Rows with a non-numeric
 * quantity or unit price, or an invoice date that does not parse or does not exist
 * (2/30/11), are skipped. Blank description and customer id cells become {@code null}.
 *
 * <p>Read errors surface from the iterator as {@link UncheckedIOException}.
 */
public final class TransactionCsvReader implements Iterable<Transaction>, Closeable {
    private static final Logger log = LoggerFactory.getLogger(TransactionCsvReader.class);

    /** Most copies of the data set are Latin-1; descriptions break under UTF-8. */
    public static final Charset DEFAULT_CHARSET = StandardCharsets.ISO_8859_1;

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("M/d/uu H:mm").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu H:mm").withResolverStyle(ResolverStyle.STRICT));

    private static final String INVOICE_NO = "InvoiceNo";
    private static final String STOCK_CODE = "StockCode";
    private static final String DESCRIPTION = "Description";
    private static final String QUANTITY = "Quantity";
    private static final String INVOICE_DATE = "InvoiceDate";
    private static final String UNIT_PRICE = "UnitPrice";
    private static final String CUSTOMER_ID = "CustomerID";
    private static final String COUNTRY = "Country";

    private final CSVReader csvReader;
    private final String sourceIdentifier;
    private final Map<String, Integer> columns = new HashMap<>();
    private boolean iterated;
    private long rowsRead;
    private long rowsSkipped;

    public TransactionCsvReader(Reader reader, String sourceIdentifier) throws IOException {
        // RFC 4180 quoting only: a backslash is ordinary text
        this.csvReader = new CSVReaderBuilder(reader)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build();
        this.sourceIdentifier = sourceIdentifier;
        readHeader();
    }

    public static TransactionCsvReader open(Path path) throws IOException {
        return open(path, DEFAULT_CHARSET);
    }

    public static TransactionCsvReader open(Path path, Charset charset) throws IOException {
        Reader reader = Files.newBufferedReader(path, charset);
        try {
            return new TransactionCsvReader(reader, path.toString());
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    private void readHeader() throws IOException {
        String[] header;
        try {
            header = csvReader.readNext();
        } catch (CsvValidationException e) {
            throw new IOException("Failed to parse CSV header of " + sourceIdentifier, e);
        }
        if (header == null) {
            log.warn("{} is empty", sourceIdentifier);
            return;
        }
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (i == 0 && name.startsWith("\uFEFF")) name = name.substring(1);
            columns.put(name, i);
        }
        for (String required : List.of(INVOICE_NO, STOCK_CODE, QUANTITY, INVOICE_DATE, UNIT_PRICE, COUNTRY)) {
            if (!columns.containsKey(required)) {
                throw new IOException(sourceIdentifier + ": missing column " + required);
            }
        }
    }

    @Override
    public Iterator<Transaction> iterator() {
        if (iterated) throw new IllegalStateException(sourceIdentifier + " can only be iterated once");
        iterated = true;
        return new Iterator<>() {
            private Transaction next;

            @Override
            public boolean hasNext() {
                if (next == null) next = readNextTransaction();
                return next != null;
            }

            @Override
            public Transaction next() {
                if (!hasNext()) throw new NoSuchElementException();
                Transaction result = next;
                next = null;
                return result;
            }
        };
    }

    private Transaction readNextTransaction() {
        if (columns.isEmpty()) return null;
        while (true) {
            String[] row;
            try {
                row = csvReader.readNext();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (CsvValidationException e) {
                throw new UncheckedIOException(
                        new IOException("Malformed CSV at line " + csvReader.getLinesRead() + " of " + sourceIdentifier, e));
            }
            if (row == null) {
                log.debug("{}: {} rows read, {} skipped", sourceIdentifier, rowsRead, rowsSkipped);
                return null;
            }
            rowsRead++;
            Transaction transaction = toTransaction(row);
            if (transaction != null) return transaction;
            rowsSkipped++;
        }
    }

    private Transaction toTransaction(String[] row) {
        String rawQuantity = trimmed(row, QUANTITY);
        String rawUnitPrice = trimmed(row, UNIT_PRICE);
        if (rawQuantity == null || rawUnitPrice == null) {
            log.debug("{}: skipping short row {}", sourceIdentifier, rowsRead);
            return null;
        }
        int quantity;
        double unitPrice;
        try {
            quantity = Integer.parseInt(rawQuantity);
            unitPrice = Double.parseDouble(rawUnitPrice);
        } catch (NumberFormatException e) {
            log.debug("{}: skipping row {} with bad numerics: {}", sourceIdentifier, rowsRead, e.getMessage());
            return null;
        }
        LocalDateTime invoiceDate = parseDate(trimmed(row, INVOICE_DATE));
        if (invoiceDate == null) {
            log.debug("{}: skipping row {} with bad invoice date", sourceIdentifier, rowsRead);
            return null;
        }
        return new Transaction(
                orEmpty(trimmed(row, INVOICE_NO)),
                orEmpty(trimmed(row, STOCK_CODE)),
                optional(trimmed(row, DESCRIPTION)),
                quantity,
                invoiceDate,
                unitPrice,
                optional(trimmed(row, CUSTOMER_ID)),
                orEmpty(trimmed(row, COUNTRY)));
    }

    private LocalDateTime parseDate(String raw) {
        if (raw == null) return null;
        try {
            for (DateTimeFormatter format : DATE_FORMATS) {
                ParsePosition position = new ParsePosition(0);
                if (format.parseUnresolved(raw, position) != null
                        && position.getErrorIndex() < 0
                        && position.getIndex() == raw.length()) {
                    return LocalDateTime.parse(raw, format);
                }
            }
        } catch (DateTimeParseException e) {
            log.debug("{}: invalid invoice date '{}': {}", sourceIdentifier, raw, e.getMessage());
        }
        return null;
    }

    private String trimmed(String[] row, String column) {
        Integer index = columns.get(column);
        if (index == null || index >= row.length || row[index] == null) return null;
        return row[index].trim();
    }

    private static String optional(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    public long rowsRead() {
        return rowsRead;
    }

    public long rowsSkipped() {
        return rowsSkipped;
    }

    @Override
    public void close() throws IOException {
        csvReader.close();
    }
}
