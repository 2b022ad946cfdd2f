package com.questrail.testtree.report;

import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.BuildError;
import com.questrail.testtree.model.CaseNode;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.SuiteNode;
import com.questrail.testtree.model.TestNode;
import com.questrail.testtree.model.TestTree;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * JUnitXmlReporter
 * =============================================================================
 * Renders a finalized tree as a JUnit-style XML document.
 *
 * <h2>Shape</h2>
 * <pre>
 *   testsuites            totals of the root
 *     testsuite           one per suite, nested like the tree
 *       testcase          one per case that has a result
 *         failure         per Failed: message = expression, text = evaluated
 *         error           per Errored: message = description, text = location
 *         skipped         per Broken: message = reason
 *       system-err        on a suite whose discovery failed
 * </pre>
 *
 * <h2>Counting</h2>
 * <p>{@code tests} is the number of {@code testcase} elements in the subtree.
 * {@code failures}, {@code errors} and {@code skipped} are the aggregate
 * {@code fail}, {@code error} and {@code broken} counts, i.e. they count
 * assertion outcomes, not cases. {@code time} is in seconds.</p>
 *
 * <p>A test case's {@code classname} is its ancestor path joined with
 * {@code '.'}.</p>
 *
 * <p>Every name and message passes through {@link #xmlSafe}, so control
 * characters in assertion output (ANSI colors, NULs) never make the document
 * unparseable.</p>
 */
public final class JUnitXmlReporter
{
    private static final XMLOutputFactory FACTORY = XMLOutputFactory.newFactory();

    public String render(TestTree tree)
    {
        StringWriter out = new StringWriter();
        write(tree, out);
        return out.toString();
    }

    /**
     * Writes the document to {@code file} (UTF-8), creating parent directories.
     */
    public void write(TestTree tree, Path file)
    {
        Objects.requireNonNull(file, "file");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                write(tree, out);
            }
        }
        catch (IOException e) {
            throw new ReportException("cannot write JUnit XML report to " + file, e);
        }
    }

    public void write(TestTree tree, Writer out)
    {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(out, "out");
        ReportNodes.requireFinalized(tree);

        try {
            XMLStreamWriter xml = FACTORY.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            newline(xml, 0);

            SuiteNode root = tree.root();
            xml.writeStartElement("testsuites");
            xml.writeAttribute("name", xmlSafe(root.name()));
            countAttributes(xml, root);
            suite(xml, root, 1);
            newline(xml, 0);
            xml.writeEndElement();
            newline(xml, 0);

            xml.writeEndDocument();
            xml.flush();
            xml.close();
        }
        catch (XMLStreamException e) {
            throw new ReportException("cannot render JUnit XML report", e);
        }
    }

    private static void suite(XMLStreamWriter xml, SuiteNode suite, int depth) throws XMLStreamException
    {
        newline(xml, depth);
        xml.writeStartElement("testsuite");
        xml.writeAttribute("name", xmlSafe(suite.name()));
        countAttributes(xml, suite);

        for (TestNode child : suite.children()) {
            if (!ReportNodes.isReported(child)) {
                continue;
            }
            if (child instanceof SuiteNode) {
                suite(xml, (SuiteNode) child, depth + 1);
            }
            else {
                testcase(xml, (CaseNode) child, depth + 1);
            }
        }

        if (suite.buildError().isPresent()) {
            BuildError error = suite.buildError().get();
            newline(xml, depth + 1);
            xml.writeStartElement("system-err");
            xml.writeCharacters(xmlSafe(error.originatingLocation()
                    .map(loc -> error.description() + " at " + loc)
                    .orElse(error.description())));
            xml.writeEndElement();
        }

        newline(xml, depth);
        xml.writeEndElement();
    }

    private static void testcase(XMLStreamWriter xml, CaseNode c, int depth) throws XMLStreamException
    {
        CaseResult result = c.result().orElseThrow();

        newline(xml, depth);
        xml.writeStartElement("testcase");
        xml.writeAttribute("name", xmlSafe(c.name()));
        xml.writeAttribute("classname", xmlSafe(c.path().join(".")));
        xml.writeAttribute("time", seconds(result.duration()));

        boolean hasChildren = false;
        for (AssertionOutcome o : result.outcomes()) {
            if (o instanceof AssertionOutcome.Passed) {
                continue;
            }
            hasChildren = true;
            newline(xml, depth + 1);
            if (o instanceof AssertionOutcome.Failed) {
                AssertionOutcome.Failed f = (AssertionOutcome.Failed) o;
                xml.writeStartElement("failure");
                xml.writeAttribute("message", xmlSafe(f.expression()));
                xml.writeCharacters(xmlSafe(f.evaluated()));
                xml.writeEndElement();
            }
            else if (o instanceof AssertionOutcome.Errored) {
                AssertionOutcome.Errored e = (AssertionOutcome.Errored) o;
                xml.writeStartElement("error");
                xml.writeAttribute("message", xmlSafe(e.description()));
                xml.writeCharacters(xmlSafe(e.originatingLocation().orElse("")));
                xml.writeEndElement();
            }
            else {
                xml.writeEmptyElement("skipped");
                xml.writeAttribute("message", xmlSafe(((AssertionOutcome.Broken) o).reason()));
            }
        }
        if (hasChildren) {
            newline(xml, depth);
        }
        xml.writeEndElement();
    }

    private static void countAttributes(XMLStreamWriter xml, SuiteNode suite) throws XMLStreamException
    {
        Counts counts = suite.counts();
        xml.writeAttribute("tests", Integer.toString(ReportNodes.reportedCases(suite)));
        xml.writeAttribute("failures", Integer.toString(counts.fail()));
        xml.writeAttribute("errors", Integer.toString(counts.error()));
        xml.writeAttribute("skipped", Integer.toString(counts.broken()));
        xml.writeAttribute("time", seconds(ReportNodes.duration(suite)));
    }

    static String seconds(Duration d)
    {
        return String.format(Locale.ROOT, "%.3f", d.toNanos() / 1_000_000_000.0);
    }

    /**
     * Replaces code points XML 1.0 cannot carry (C0 controls other than tab,
     * newline and carriage return, unpaired surrogates, U+FFFE and U+FFFF) with
     * their escape spelled out as text (ESC becomes backslash, u, 001B). The
     * writer escapes markup characters itself.
     */
    static String xmlSafe(String text)
    {
        StringBuilder out = null;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int width = Character.charCount(cp);
            if (!isXmlChar(cp)) {
                if (out == null) {
                    out = new StringBuilder(text.length() + 8).append(text, 0, i);
                }
                out.append(String.format(Locale.ROOT, "\\u%04X", cp));
            }
            else if (out != null) {
                out.appendCodePoint(cp);
            }
            i += width;
        }
        return out == null ? text : out.toString();
    }

    private static boolean isXmlChar(int cp)
    {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }

    private static void newline(XMLStreamWriter xml, int depth) throws XMLStreamException
    {
        xml.writeCharacters("\n" + "  ".repeat(depth));
    }
}
