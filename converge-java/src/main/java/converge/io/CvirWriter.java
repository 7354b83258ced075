package converge.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import converge.cvir.CvirDocument;
import converge.diag.InternalCompilerError;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serialises CVIR documents. Output is byte-stable: fixed property order,
 * map entries in insertion order, {@code '\n'} line endings on every platform,
 * plain decimal notation, and a trailing newline.
 */
public final class CvirWriter {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private static final ObjectWriter PRETTY;
    private static final ObjectWriter COMPACT = MAPPER.writer();

    static {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter);
        PRETTY = MAPPER.writer(printer);
    }

    private CvirWriter() {}

    public static String toJson(CvirDocument doc, boolean pretty) {
        try {
            return (pretty ? PRETTY : COMPACT).writeValueAsString(doc) + "\n";
        } catch (JsonProcessingException e) {
            // every node in the document is a known record, string or number
            throw new InternalCompilerError("Cannot serialise CVIR document", e);
        }
    }

    public static void write(Path out, CvirDocument doc, boolean pretty) throws IOException {
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            w.write(toJson(doc, pretty));
        }
    }

    /** Shared mapper, for consumers that want to read documents back as trees. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
