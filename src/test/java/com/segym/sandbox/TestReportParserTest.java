package com.segym.sandbox;

import com.segym.core.model.TestOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TestReportParserTest {

    @TempDir
    Path dir;

    private final TestReportParser parser = new TestReportParser();

    private static final String PYTEST_XML = """
            <?xml version="1.0" encoding="utf-8"?>
            <testsuites>
              <testsuite name="pytest" errors="1" failures="1" skipped="1" tests="5">
                <testcase classname="tests.test_calc" name="test_add" time="0.001"/>
                <testcase classname="tests.test_calc" name="test_sub" time="0.001">
                  <failure message="assert -1 == 3">AssertionError</failure>
                </testcase>
                <testcase classname="tests.test_calc" name="test_div" time="0.001">
                  <error message="fixture 'db' not found"/>
                </testcase>
                <testcase classname="tests.test_calc" name="test_pow" time="0.000">
                  <skipped message="not implemented"/>
                </testcase>
                <testcase classname="tests.test_calc" name="test_mul" time="0.001"/>
              </testsuite>
            </testsuites>
            """;

    @Test
    @DisplayName("parses per-test outcomes from a JUnit XML report")
    void parsesJUnitXml() throws IOException {
        Path report = dir.resolve("testresults.xml");
        Files.writeString(report, PYTEST_XML);

        var parsed = parser.parse(report, 1, "output").orElseThrow();

        assertEquals(2, parsed.passed());
        assertEquals(1, parsed.failed());
        assertEquals(1, parsed.errors());
        assertEquals(1, parsed.skipped());
        assertEquals(2, parsed.failingCount());
        assertEquals(1, parsed.exitCode());
        var sub = parsed.testCases().get(1);
        assertEquals("tests.test_calc.test_sub", sub.name());
        assertEquals(TestOutcome.FAILED, sub.outcome());
        assertEquals("assert -1 == 3", sub.message());
    }

    @Test
    @DisplayName("falls back to the pytest summary line when no report file exists")
    void fallsBackToSummaryLine() {
        String output = """
                tests/test_calc.py .F.                                         [100%]
                =========================== short test summary info ===========================
                FAILED tests/test_calc.py::test_sub - assert -1 == 3
                ===================== 1 failed, 2 passed, 1 error in 0.05s =====================
                """;

        var parsed = parser.parse(dir.resolve("missing.xml"), 1, output).orElseThrow();

        assertEquals(2, parsed.passed());
        assertEquals(1, parsed.failed());
        assertEquals(1, parsed.errors());
        assertTrue(parsed.testCases().isEmpty());
    }

    @Test
    @DisplayName("falls back to the summary line when the report is not valid XML")
    void fallsBackOnBrokenXml() throws IOException {
        Path report = dir.resolve("testresults.xml");
        Files.writeString(report, "<testsuite><testcase");

        var parsed = parser.parse(report, 0, "============ 3 passed in 0.10s ============");

        assertTrue(parsed.isPresent());
        assertEquals(3, parsed.get().passed());
    }

    @Test
    @DisplayName("returns empty when neither a report nor a summary line exists")
    void emptyWithoutAnyResults() {
        assertTrue(parser.parse(dir.resolve("missing.xml"), 2, "ImportError: no module named foo").isEmpty());
        assertTrue(parser.parse(null, 2, "").isEmpty());
    }

    @Test
    @DisplayName("refuses XML with a DOCTYPE declaration")
    void refusesDoctype() throws IOException {
        Path report = dir.resolve("testresults.xml");
        Files.writeString(report, """
                <?xml version="1.0"?>
                <!DOCTYPE foo [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <testsuite><testcase classname="a" name="b">&xxe;</testcase></testsuite>
                """);

        assertTrue(parser.parse(report, 0, "").isEmpty());
    }
}
