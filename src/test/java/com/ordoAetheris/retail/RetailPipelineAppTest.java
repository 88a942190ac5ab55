package com.ordoAetheris.retail;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class RetailPipelineAppTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    @TempDir
    Path tmp;

    private static String sample() throws Exception {
        Path path = Paths.get(RetailPipelineAppTest.class.getResource("/online_retail_sample.csv").toURI());
        return path.toString();
    }

    @Test
    @DisplayName("prints the full report for a CSV file")
    void printsReport() throws Exception {
        int code = RetailPipelineApp.run(new String[]{"--csv", sample(), "--capacity", "2"}, out, err);

        String report = outBytes.toString(StandardCharsets.UTF_8);
        assertEquals(RetailPipelineApp.EXIT_OK, code, errBytes.toString(StandardCharsets.UTF_8));
        assertTrue(report.startsWith("=== Online Retail Sales Analysis (UCI) ==="));
        // valid rows: 15.30 + 20.34 + 6.78 + 18.00
        assertTrue(report.contains("  $60.42"), report);
        assertTrue(report.contains("2010-12  $42.42"), report);
        assertTrue(report.contains("2011-01  $18.00"), report);
        assertTrue(report.contains("WHITE METAL LANTERN"), report);
        assertTrue(report.contains("Cancellation rate"), report);
        // gross 60.42 + 15.30 = 75.72 -> 20.21%
        assertTrue(report.contains("20.21%"), report);
    }

    @Test
    @DisplayName("default capacity when --capacity is omitted")
    void defaultCapacity() throws Exception {
        assertEquals(RetailPipelineApp.EXIT_OK, RetailPipelineApp.run(new String[]{"--csv", sample()}, out, err));
    }

    @Test
    @DisplayName("bad arguments -> usage and exit code 2")
    void badArguments() throws Exception {
        assertEquals(RetailPipelineApp.EXIT_USAGE, RetailPipelineApp.run(new String[]{}, out, err));
        assertEquals(RetailPipelineApp.EXIT_USAGE,
                RetailPipelineApp.run(new String[]{"--csv", sample(), "--capacity", "0"}, out, err));
        assertEquals(RetailPipelineApp.EXIT_USAGE,
                RetailPipelineApp.run(new String[]{"--csv", sample(), "--capacity", "many"}, out, err));
        assertEquals(RetailPipelineApp.EXIT_USAGE,
                RetailPipelineApp.run(new String[]{"--csv", "/no/such/file.csv"}, out, err));
        assertEquals(RetailPipelineApp.EXIT_USAGE, RetailPipelineApp.run(new String[]{"--verbose"}, out, err));

        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("usage: RetailPipelineApp"));
        assertEquals("", outBytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("malformed CSV -> error on stderr and exit code 1, no partial report")
    void malformedCsv() throws Exception {
        Path csv = tmp.resolve("broken.csv");
        Files.write(csv, ("InvoiceNo,StockCode,Description,Quantity,InvoiceDate,UnitPrice,CustomerID,Country\n"
                + "1,S1,ok,1,1/2/11 9:00,1.5,1,France\n"
                + "2,S2,\"unterminated,1,1/2/11 9:00,1.5,1,France\n").getBytes(StandardCharsets.ISO_8859_1));

        int code = RetailPipelineApp.run(new String[]{"--csv", csv.toString()}, out, err);

        assertEquals(RetailPipelineApp.EXIT_FAILURE, code);
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).startsWith("error: "), errBytes.toString(StandardCharsets.UTF_8));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Malformed CSV"), errBytes.toString(StandardCharsets.UTF_8));
        assertEquals("", outBytes.toString(StandardCharsets.UTF_8));
    }
}
