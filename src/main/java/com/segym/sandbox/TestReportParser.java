package com.segym.sandbox;

import com.segym.core.model.TestCaseResult;
import com.segym.core.model.TestOutcome;
import com.segym.core.model.TestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the output of a test command into a {@link TestReport}.
 *
 * <p>Prefers a JUnit XML report (pytest {@code --junitxml}, Maven Surefire). Without one,
 * falls back to pytest's final summary line in the captured output.
 */
public class TestReportParser {

    private static final Logger log = LoggerFactory.getLogger(TestReportParser.class);

    /** e.g. {@code ===== 2 failed, 10 passed, 1 error in 0.52s =====} */
    static final Pattern SUMMARY_LINE = Pattern.compile("^=+ (.*\\d+ \\w+.*) in [\\d.]+s.* =+$", Pattern.MULTILINE);
    static final Pattern SUMMARY_COUNT = Pattern.compile("(\\d+) (passed|failed|errors?|skipped|xfailed|xpassed|deselected)");

    /**
     * @return the parsed report, or empty when neither a report file nor a summary line exists
     */
    public Optional<TestReport> parse(Path reportFile, int exitCode, String output) {
        if (reportFile != null && Files.isRegularFile(reportFile)) {
            try {
                return Optional.of(parseJUnitXml(reportFile, exitCode, output));
            } catch (Exception e) {
                log.warn("Unreadable test report {}: {}", reportFile.getFileName(), e.getMessage());
            }
        }
        return parseSummary(exitCode, output);
    }

    TestReport parseJUnitXml(Path reportFile, int exitCode, String output) throws Exception {
        var factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        var document = factory.newDocumentBuilder().parse(reportFile.toFile());

        NodeList testcases = document.getElementsByTagName("testcase");
        var cases = new ArrayList<TestCaseResult>(testcases.getLength());
        for (int i = 0; i < testcases.getLength(); i++) {
            var testcase = (Element) testcases.item(i);
            String classname = testcase.getAttribute("classname");
            String name = classname.isEmpty() ? testcase.getAttribute("name") : classname + "." + testcase.getAttribute("name");
            cases.add(toResult(name, testcase));
        }
        return TestReport.fromCases(exitCode, cases, output);
    }

    private static TestCaseResult toResult(String name, Element testcase) {
        for (var outcome : List.of(TestOutcome.FAILED, TestOutcome.ERROR, TestOutcome.SKIPPED)) {
            Element child = firstChild(testcase, outcome == TestOutcome.FAILED ? "failure"
                    : outcome == TestOutcome.ERROR ? "error" : "skipped");
            if (child != null) {
                String message = child.getAttribute("message");
                if (message.isEmpty()) {
                    message = child.getTextContent().strip();
                }
                return new TestCaseResult(name, outcome, message);
            }
        }
        return new TestCaseResult(name, TestOutcome.PASSED, null);
    }

    private static Element firstChild(Element parent, String tag) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e && e.getTagName().equals(tag)) {
                return e;
            }
        }
        return null;
    }

    Optional<TestReport> parseSummary(int exitCode, String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        Matcher line = SUMMARY_LINE.matcher(output);
        String summary = null;
        while (line.find()) {
            summary = line.group(1);
        }
        if (summary == null) {
            return Optional.empty();
        }
        int passed = 0, failed = 0, errors = 0, skipped = 0;
        Matcher count = SUMMARY_COUNT.matcher(summary);
        while (count.find()) {
            int n = Integer.parseInt(count.group(1));
            switch (count.group(2)) {
                case "passed", "xpassed" -> passed += n;
                case "failed" -> failed += n;
                case "error", "errors" -> errors += n;
                case "skipped", "xfailed" -> skipped += n;
                default -> { }
            }
        }
        return Optional.of(new TestReport(exitCode, passed, failed, errors, skipped, List.of(), output));
    }
}
