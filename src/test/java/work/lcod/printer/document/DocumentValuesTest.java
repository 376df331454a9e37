package work.lcod.printer.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import work.lcod.printer.support.PrinterTestSupport;
import work.lcod.printer.value.Value;

class DocumentValuesTest {
    private final PrinterTestSupport support = new PrinterTestSupport();
    private final DocumentValues documents = new DocumentValues(support.symbols);

    @Test
    void convertsJsonTrees() throws IOException {
        Value value = documents.parse("{\"b\":[1,2.5,null,true],\"a\":\"x\"}", DocumentFormat.JSON);
        assertEquals("{ a = \"x\"; b = [ 1 2.5 null true ]; }", support.render(value));
    }

    @Test
    void integersBeyondLongBecomeFloats() throws IOException {
        Value value = documents.parse("[123456789012345678901234, -7]", DocumentFormat.JSON);
        assertEquals("[ 1.2345678901234568e+23 -7 ]", support.render(value));
    }

    @Test
    void convertsYamlDocuments() throws IOException {
        Value value = documents.parse(String.join("\n",
            "name: hello",
            "version: \"2.12\"",
            "enabled: true",
            "tags: [a, b]",
            ""
        ), DocumentFormat.YAML);
        assertEquals("{ enabled = true; name = \"hello\"; tags = [ \"a\" \"b\" ]; version = \"2.12\"; }",
            support.render(value));
    }

    @Test
    void convertsTomlTables() throws IOException {
        Value value = documents.parse(String.join("\n",
            "title = \"x\"",
            "released = 1979-05-27",
            "[owner]",
            "name = \"Tom\"",
            "ports = [80, 443]",
            "ratio = 0.5",
            ""
        ), DocumentFormat.TOML);
        assertEquals(
            "{ owner = { name = \"Tom\"; ports = [ 80 443 ]; ratio = 0.5; }; released = \"1979-05-27\"; title = \"x\"; }",
            support.render(value)
        );
    }

    @Test
    void rejectsInvalidToml() {
        var ex = assertThrows(IOException.class, () -> documents.parse("[owner\n", DocumentFormat.TOML));
        assertTrue(ex.getMessage().startsWith("Invalid TOML document"));
    }

    @Test
    void readsFixtureFiles() throws IOException {
        Path sample = Paths.get("src", "test", "resources", "documents", "sample.yaml");
        Value value = documents.read(sample, DocumentFormat.detect(sample));
        assertEquals(
            "{ meta = { broken = null; description = \"Prints \\${greeting}\"; }; name = \"hello\"; "
                + "outputs = [ \"out\" \"man\" ]; type = \"package\"; version = \"2.12\"; }",
            support.render(value)
        );
    }

    @Test
    void detectsAndParsesFormats() {
        assertEquals(DocumentFormat.YAML, DocumentFormat.detect(Paths.get("a", "b.yml")));
        assertEquals(DocumentFormat.TOML, DocumentFormat.detect(Paths.get("conf.TOML")));
        assertEquals(DocumentFormat.JSON, DocumentFormat.detect(Paths.get("data.txt")));
        assertEquals(DocumentFormat.JSON, DocumentFormat.from(null));
        assertEquals(DocumentFormat.YAML, DocumentFormat.from("yml"));
        var ex = assertThrows(IllegalArgumentException.class, () -> DocumentFormat.from("xml"));
        assertEquals("Unsupported document format: xml", ex.getMessage());
    }
}
