package work.lcod.printer.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.printer.value.AttrSet;
import work.lcod.printer.value.BoolValue;
import work.lcod.printer.value.FloatValue;
import work.lcod.printer.value.IntValue;
import work.lcod.printer.value.ListValue;
import work.lcod.printer.value.NullValue;
import work.lcod.printer.value.StringValue;
import work.lcod.printer.value.SymbolTable;
import work.lcod.printer.value.Value;

/**
 * Builds value graphs from JSON, YAML and TOML documents.
 *
 * <p>Objects and tables become attribute sets, arrays become lists. Integral numbers that fit a
 * {@code long} become integers, every other number a float. Strings always stay strings; no path
 * values are inferred.
 */
public final class DocumentValues {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final SymbolTable symbols;

    public DocumentValues(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    public Value read(Path path, DocumentFormat format) throws IOException {
        return parse(Files.readString(path), format);
    }

    public Value parse(String text, DocumentFormat format) throws IOException {
        return switch (format) {
            case JSON -> fromJson(JSON_MAPPER.readTree(text));
            case YAML -> fromJson(YAML_MAPPER.readTree(text));
            case TOML -> fromToml(parseToml(text));
        };
    }

    public Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isObject()) {
            var attrs = AttrSet.builder(symbols);
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                attrs.put(entry.getKey(), fromJson(entry.getValue()));
            }
            return attrs.build();
        }
        if (node.isArray()) {
            var items = new ArrayList<Value>(node.size());
            for (var item : node) {
                items.add(fromJson(item));
            }
            return ListValue.of(items);
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return IntValue.of(node.longValue());
        }
        if (node.isNumber()) {
            return FloatValue.of(node.doubleValue());
        }
        if (node.isBoolean()) {
            return BoolValue.of(node.booleanValue());
        }
        return StringValue.of(node.asText());
    }

    public Value fromToml(TomlTable table) {
        var attrs = AttrSet.builder(symbols);
        for (String key : table.keySet()) {
            attrs.put(key, fromTomlValue(table.get(List.of(key))));
        }
        return attrs.build();
    }

    private Value fromTomlValue(Object raw) {
        if (raw instanceof TomlTable table) {
            return fromToml(table);
        }
        if (raw instanceof TomlArray array) {
            var items = new ArrayList<Value>(array.size());
            for (int i = 0; i < array.size(); i++) {
                items.add(fromTomlValue(array.get(i)));
            }
            return ListValue.of(items);
        }
        if (raw instanceof Long number) {
            return IntValue.of(number);
        }
        if (raw instanceof Double number) {
            return FloatValue.of(number);
        }
        if (raw instanceof Boolean bool) {
            return BoolValue.of(bool);
        }
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        // Strings, dates and times.
        return StringValue.of(raw.toString());
    }

    private static TomlParseResult parseToml(String text) throws IOException {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IOException("Invalid TOML document: " + result.errors().get(0).getMessage());
        }
        return result;
    }
}
