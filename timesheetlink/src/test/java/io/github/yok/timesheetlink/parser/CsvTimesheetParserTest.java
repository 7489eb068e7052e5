package io.github.yok.timesheetlink.parser;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.timesheetlink.config.ParseOptions;
import io.github.yok.timesheetlink.config.TimesheetProperties;
import io.github.yok.timesheetlink.exception.ParseCancelledException;
import io.github.yok.timesheetlink.exception.TimesheetErrorKind;
import io.github.yok.timesheetlink.exception.TimesheetException;
import io.github.yok.timesheetlink.model.FormatInfo;
import io.github.yok.timesheetlink.model.ParseError;
import io.github.yok.timesheetlink.model.ParseResult;
import io.github.yok.timesheetlink.model.WorkItem;
import io.github.yok.timesheetlink.util.CancellationToken;
import io.github.yok.timesheetlink.validation.WorkItemValidator;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvTimesheetParserTest {

    private static final String HEADER = "Date,Hours,Rate,Description\n";

    private static final String FOUR_ROWS = HEADER
            + "2024-01-15,8.0,100.0,Development work\n"
            + "2024-01-16,-5.0,100.0,Code review\n"
            + "2024-01-17,6.5,100.0,Testing the importer\n"
            + "2024-01-18,4,120,Client workshop\n";

    private final AtomicInteger ids = new AtomicInteger();

    private TimesheetProperties properties;

    private CsvTimesheetParser parser;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-20T00:00:00Z"), ZoneOffset.UTC);
        properties = new TimesheetProperties();
        RowParser rowParser = new RowParser(new DateInterpreter(clock, properties),
                () -> "item-" + ids.incrementAndGet(), clock);
        parser = new CsvTimesheetParser(new FormatDetector(), rowParser,
                new WorkItemValidator(clock, properties), properties);
    }

    private ParseResult parse(String content, ParseOptions options) {
        return parser.parseTimesheet(new StringReader(content), options);
    }

    private TimesheetException parseFailure(String content, ParseOptions options) {
        return assertThrows(TimesheetException.class, () -> parse(content, options));
    }

    private static ParseOptions continueOnError() {
        return ParseOptions.builder().continueOnError(true).build();
    }

    private static void assertCounts(ParseResult result) {
        assertEquals(result.getTotalRows(), result.getSuccessRows() + result.getErrorRows());
        assertEquals(result.getSuccessRows(), result.getWorkItems().size());
        assertEquals(result.getErrorRows(), result.getErrors().size());
        for (ParseError error : result.getErrors()) {
            assertTrue(error.getLine() >= 1);
        }
    }

    // ---------------------------------------------------------------
    // 正常系
    // ---------------------------------------------------------------

    @Test
    void parseTimesheet_正常ケース_既定オプションのカンマ区切り_1件の作業項目が返ること() {
        ParseResult result = parse(HEADER + "2024-01-15,8.0,100.0,Development work", null);

        assertEquals(1, result.getTotalRows());
        assertEquals(1, result.getSuccessRows());
        assertEquals(0, result.getErrorRows());
        WorkItem item = result.getWorkItems().get(0);
        assertEquals(LocalDate.of(2024, 1, 15), item.getDate());
        assertEquals(new BigDecimal("800.00"), item.getTotal());
        assertEquals("Development work", item.getDescription());
        assertEquals("item-1", item.getId());
        assertEquals("standard", result.getFormat());
    }

    @Test
    void parseTimesheet_正常ケース_タブ区切りでtabを指定_同じ値が返りformatがtabであること() {
        ParseResult result = parse("Date\tHours\tRate\tDescription\n"
                + "2024-01-15\t8.0\t100.0\tDevelopment work\n",
                ParseOptions.builder().format("tab").build());

        assertEquals("tab", result.getFormat());
        WorkItem item = result.getWorkItems().get(0);
        assertEquals(LocalDate.of(2024, 1, 15), item.getDate());
        assertEquals(new BigDecimal("8.0"), item.getHours());
        assertEquals(new BigDecimal("100.0"), item.getRate());
        assertEquals(new BigDecimal("800.00"), item.getTotal());
    }

    @Test
    void parseTimesheet_正常ケース_形式未指定のセミコロン区切り_検出された形式で読まれること() {
        ParseResult result = parse("Date;Hours;Rate;Description\n"
                + "15/01/2024;7,5;80;Design review\n", continueOnError());

        assertEquals("semicolon", result.getFormat());
        assertEquals(1, result.getErrorRows());
        assertEquals("hours", result.getErrors().get(0).getColumn());

        ParseResult ok = parse("Date;Hours;Rate;Description\n15/01/2024;7.5;80;Design review\n",
                null);
        assertEquals(new BigDecimal("600.00"), ok.getWorkItems().get(0).getTotal());
    }

    @Test
    void parseTimesheet_正常ケース_別名の見出しと引用符付きの値_正しく読まれること() {
        ParseResult result = parse("Work_Date,Duration,Billing_Rate,Notes,Client\n"
                + "01/15/2024,2.5,\"1,000\",\"Review, planning\",ACME\n"
                + "Jan 16, 2024,1,90,Sprint planning,ACME\n",
                ParseOptions.builder().format("rfc4180").continueOnError(true).build());

        assertEquals("rfc4180", result.getFormat());
        assertEquals(2, result.getTotalRows());
        // "1,000" は数値として解釈できない
        assertEquals(TimesheetErrorKind.INVALID_NUMBER.getSuggestion(),
                result.getErrors().get(0).getSuggestion());
        assertEquals(2, result.getErrors().get(0).getLine());
        // 引用符なしのカンマで列がずれる
        assertEquals(3, result.getErrors().get(1).getLine());
        assertCounts(result);
    }

    @Test
    void parseTimesheet_正常ケース_見出しのみ_0件の結果が返ること() {
        ParseResult result = parse(HEADER, null);

        assertEquals(0, result.getTotalRows());
        assertTrue(result.getWorkItems().isEmpty());
        assertNotNull(result.getHeaderMap());
    }

    @Test
    void parseTimesheet_正常ケース_空行_読み飛ばされ行番号に数えられないこと() {
        ParseResult result = parse(HEADER + "\n\n2024-01-15,8,100,Development work\n"
                + "2024-01-16,xx,100,Code review\n", continueOnError());

        assertEquals(2, result.getTotalRows());
        assertEquals(3, result.getErrors().get(0).getLine());
    }

    @Test
    void parseTimesheet_正常ケース_空欄のみの行でskipEmptyRows_集計から除外されること() {
        String content = HEADER + "2024-01-15,8,100,Development work\n,,,\n";

        ParseResult skipped = parse(content,
                ParseOptions.builder().skipEmptyRows(true).continueOnError(true).build());
        ParseResult counted = parse(content, continueOnError());

        assertEquals(1, skipped.getTotalRows());
        assertEquals(0, skipped.getErrorRows());
        assertEquals(2, counted.getTotalRows());
        assertEquals(TimesheetErrorKind.FIELD_EMPTY.getSuggestion(),
                counted.getErrors().get(0).getSuggestion());
    }

    @Test
    void parseTimesheet_正常ケース_BOM付きのバイト列_先頭列が日付として認識されること() {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = (HEADER + "2024-01-15,8,100,Development work\n")
                .getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, bytes, 0, bom.length);
        System.arraycopy(body, 0, bytes, bom.length, body.length);

        ParseResult result = parser.parseTimesheet(new ByteArrayInputStream(bytes), null,
                CancellationToken.NONE);

        assertEquals(1, result.getSuccessRows());
    }

    @Test
    void parseTimesheet_正常ケース_ファイルから読み込む_UTF8として解析されること(@TempDir Path dir)
            throws Exception {
        Path file = dir.resolve("timesheet.tsv");
        Files.writeString(file, "Date\tHours\tRate\tDescription\n"
                + "2024-01-15\t2\t100\tRéunion client à Paris\n", StandardCharsets.UTF_8);

        ParseResult result;
        try (InputStream in = Files.newInputStream(file)) {
            result = parser.parseTimesheet(in, ParseOptions.builder().format("tsv").build(),
                    CancellationToken.NONE);
        }

        assertEquals("tsv", result.getFormat());
        assertEquals("Réunion client à Paris", result.getWorkItems().get(0).getDescription());
    }

    @Test
    void parseTimesheet_正常ケース_excel形式で引用符が閉じていない_寛容に読まれること() {
        String content = HEADER + "2024-01-15,8,100,\"Development work";

        ParseResult result = parse(content, ParseOptions.builder().format("excel").build());
        assertEquals("Development work", result.getWorkItems().get(0).getDescription());

        TimesheetException ex =
                parseFailure(content, ParseOptions.builder().format("standard").build());
        assertEquals(TimesheetErrorKind.READ_FAILURE, ex.getKind());
        assertTrue(ex.getMessage().startsWith("failed to read CSV data: "));
    }

    @Test
    void parseTimesheet_正常ケース_曖昧な見出しでも形式を指定する_指定形式で読まれること() {
        String content = "Date,Hours,Rate,Description,Client;Project\n"
                + "2024-01-15,8,100,Development work,ACME;Portal\n";

        TimesheetException ex = parseFailure(content, null);
        assertEquals(TimesheetErrorKind.AMBIGUOUS_FORMAT, ex.getKind());
        assertEquals("format detection failed: ambiguous format: multiple delimiter types detected",
                ex.getMessage());

        ParseResult result = parse(content, ParseOptions.builder().format("standard").build());
        assertEquals(1, result.getSuccessRows());
    }

    // ---------------------------------------------------------------
    // 行エラー
    // ---------------------------------------------------------------

    @Test
    void parseTimesheet_正常ケース_負の時間を含む4行で継続_3件成功1件エラーとなること() {
        ParseResult result = parse(FOUR_ROWS, continueOnError());

        assertEquals(4, result.getTotalRows());
        assertEquals(3, result.getSuccessRows());
        assertEquals(1, result.getErrorRows());
        ParseError error = result.getErrors().get(0);
        assertTrue(error.getMessage().contains("hours"));
        assertTrue(error.getMessage().startsWith("validation failed: "));
        assertEquals(3, error.getLine());
        assertEquals("2024-01-16", error.getRow().get(0));
        assertCounts(result);
    }

    @Test
    void parseTimesheet_異常ケース_負の時間を含む4行で継続しない_行番号付きの例外が送出されること() {
        TimesheetException ex = parseFailure(FOUR_ROWS, ParseOptions.builder().build());

        assertEquals(TimesheetErrorKind.VALIDATION_FAILED, ex.getKind());
        assertEquals(3, ex.getLine());
        assertEquals("validation failed at line 3: validation rule 'HoursValidation' failed:"
                + " hours must be positive, got -5.0", ex.getMessage());
    }

    @Test
    void parseTimesheet_異常ケース_解析エラーで継続しない_parsing_failedの例外が送出されること() {
        TimesheetException ex = parseFailure(HEADER + "not-a-date,8,100,Development work\n",
                null);

        assertEquals(TimesheetErrorKind.UNSUPPORTED_DATE_FORMAT, ex.getKind());
        assertEquals("parsing failed at line 2: invalid date 'not-a-date':"
                + " unsupported date format", ex.getMessage());
        assertEquals("date", ex.getField());
    }

    @Test
    void parseTimesheet_正常ケース_指数が極端なゼロの時間で継続_短いメッセージの行エラーとなること() {
        ParseResult result = parse(HEADER + "2024-01-15,0e-999999999,100,Development work\n"
                + "2024-01-16,-0E-500000000,100,Code review\n", continueOnError());

        assertEquals(2, result.getErrorRows());
        assertEquals("validation failed: validation rule 'HoursValidation' failed:"
                + " hours must be positive, got 0", result.getErrors().get(0).getMessage());
        assertEquals("0", result.getErrors().get(1).getValue());
        assertCounts(result);
    }

    @Test
    void parseTimesheet_異常ケース_継続指定でも致命的な種別の行エラー_中断されること() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-20T00:00:00Z"), ZoneOffset.UTC);
        RowParser rowParser = new RowParser(new DateInterpreter(clock, properties), () -> {
            throw new TimesheetException(TimesheetErrorKind.READ_FAILURE,
                    "id source unavailable");
        }, clock);
        CsvTimesheetParser failing = new CsvTimesheetParser(new FormatDetector(), rowParser,
                new WorkItemValidator(clock, properties), properties);

        TimesheetException ex = assertThrows(TimesheetException.class,
                () -> failing.parseTimesheet(new StringReader(FOUR_ROWS), continueOnError()));

        assertEquals(TimesheetErrorKind.READ_FAILURE, ex.getKind());
        assertEquals("parsing failed at line 2: id source unavailable", ex.getMessage());
        assertEquals(2, ex.getLine());
    }

    @Test
    void parseTimesheet_正常ケース_設定で継続を有効化_オプション未指定でも継続されること() {
        properties.setContinueOnError(true);

        ParseResult result = parse(FOUR_ROWS, null);

        assertEquals(1, result.getErrorRows());
    }

    // ---------------------------------------------------------------
    // 構造エラー
    // ---------------------------------------------------------------

    @Test
    void parseTimesheet_異常ケース_Rate列がない_行の解析前に例外が送出されること() {
        TimesheetException ex = parseFailure("Date,Hours,Description\n2024-01-15,8,Dev\n",
                continueOnError());

        assertEquals(TimesheetErrorKind.REQUIRED_FIELD_MISSING, ex.getKind());
        assertEquals("header processing failed: required field not found in header: rate",
                ex.getMessage());
        assertEquals(1, ex.getLine());
        assertEquals(0, ids.get());
    }

    @Test
    void parseTimesheet_異常ケース_空の入力_EMPTY_INPUTが送出されること() {
        assertEquals(TimesheetErrorKind.EMPTY_INPUT, parseFailure("", null).getKind());
        assertEquals(TimesheetErrorKind.EMPTY_INPUT, parseFailure("  \n ", null).getKind());
        assertEquals(TimesheetErrorKind.EMPTY_INPUT,
                parseFailure("", ParseOptions.builder().format("standard").build()).getKind());
    }

    @Test
    void parseTimesheet_異常ケース_未知の形式名_UNSUPPORTED_FORMATが送出されること() {
        TimesheetException ex = parseFailure(HEADER,
                ParseOptions.builder().format("pipe").build());

        assertEquals(TimesheetErrorKind.UNSUPPORTED_FORMAT, ex.getKind());
        assertEquals("unsupported CSV format: pipe", ex.getMessage());
    }

    // ---------------------------------------------------------------
    // 取消
    // ---------------------------------------------------------------

    @Test
    void parseTimesheet_異常ケース_開始前に取消_ParseCancelledExceptionが送出されること() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        ParseCancelledException ex = assertThrows(ParseCancelledException.class,
                () -> parser.parseTimesheet(new StringReader(FOUR_ROWS), null, token));
        assertEquals(TimesheetErrorKind.CANCELLED, ex.getKind());
    }

    @Test
    void parseTimesheet_異常ケース_行の処理中に取消_継続指定でも中断されること() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-20T00:00:00Z"), ZoneOffset.UTC);
        CancellationToken token = CancellationToken.create();
        RowParser rowParser = new RowParser(new DateInterpreter(clock, properties), () -> {
            token.cancel();
            return "item";
        }, clock);
        CsvTimesheetParser cancelling = new CsvTimesheetParser(new FormatDetector(), rowParser,
                new WorkItemValidator(clock, properties), properties);

        assertThrows(ParseCancelledException.class,
                () -> cancelling.parseTimesheet(new StringReader(FOUR_ROWS), continueOnError(),
                        token));
    }

    // ---------------------------------------------------------------
    // 頑健性
    // ---------------------------------------------------------------

    @Test
    void parseTimesheet_正常ケース_ランダムな入力_TimesheetException以外が送出されないこと() {
        Random random = new Random(20240120L);
        String alphabet = "0123456789,,,;\t\n\r\"./-: eE+abcJan";
        for (int i = 0; i < 300; i++) {
            String content;
            if (i % 3 == 0) {
                byte[] bytes = new byte[random.nextInt(200)];
                random.nextBytes(bytes);
                content = new String(bytes, StandardCharsets.ISO_8859_1);
            } else {
                StringBuilder sb = new StringBuilder(HEADER);
                int length = random.nextInt(300);
                for (int j = 0; j < length; j++) {
                    sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
                }
                content = sb.toString();
            }
            ParseOptions options = ParseOptions.builder().continueOnError(i % 2 == 0)
                    .skipEmptyRows(i % 5 == 0).build();
            try {
                ParseResult result = parse(content, options);
                assertCounts(result);
            } catch (TimesheetException e) {
                assertNotNull(e.getKind());
            }
        }
    }

    // ---------------------------------------------------------------
    // 形式の検出と検証
    // ---------------------------------------------------------------

    @Test
    void detectFormat_正常ケース_タブ区切り_tabの形式情報が返ること() {
        FormatInfo info = parser.detectFormat(new StringReader("Date\tHours\tRate\n"));

        assertEquals("tab", info.getName());
        assertEquals('\t', info.getDelimiter());
    }

    @Test
    void detectFormat_正常ケース_バイト列_形式情報が返ること() {
        FormatInfo info = parser.detectFormat(
                new ByteArrayInputStream("Date;Hours;Rate".getBytes(StandardCharsets.UTF_8)),
                CancellationToken.NONE);
        assertEquals("semicolon", info.getName());
    }

    @Test
    void validateFormat_正常ケース_対応する形式_例外が送出されないこと() {
        assertDoesNotThrow(() -> parser.validateFormat(new StringReader(HEADER)));
    }

    @Test
    void validateFormat_異常ケース_区切り文字なし_検出失敗の例外が送出されること() {
        TimesheetException ex = assertThrows(TimesheetException.class,
                () -> parser.validateFormat(new StringReader("Date Hours Rate")));

        assertEquals(TimesheetErrorKind.NO_DELIMITERS, ex.getKind());
        assertEquals("format detection failed: no delimiters found", ex.getMessage());
    }

    @Test
    void validateFormat_異常ケース_取消済み_ParseCancelledExceptionが送出されること() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        assertThrows(ParseCancelledException.class,
                () -> parser.validateFormat(new StringReader(HEADER), token));
    }
}
