package com.openforge.toollog.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.toollog.config.AppConfig;
import com.openforge.toollog.config.ToolLogProperties;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class ResultNormalizerTest {

    private final ObjectMapper mapper = new AppConfig().objectMapper();
    private final ResultNormalizer normalizer = new ResultNormalizer(mapper, ToolLogProperties.defaults());

    @Test
    void plainResultsPassThrough() throws Exception {
        JsonNode result = mapper.readTree("{\"temperature\":21.5}");

        assertThat(normalizer.normalize(result)).isSameAs(result);
        assertThat(normalizer.normalize(null)).isNull();
    }

    @Test
    void nonZipBinaryPassesThrough() {
        ObjectNode pdf = tagged("application/pdf", "JVBERi0xLjQ=");

        assertThat(normalizer.normalize(pdf)).isSameAs(pdf);
    }

    @Test
    void singleJsonFileIsParsed() throws Exception {
        ObjectNode zip = tagged("application/zip", zip(Map.of("result.json", "{\"a\":1}")));

        assertThat(normalizer.normalize(zip)).isEqualTo(mapper.readTree("{\"a\":1}"));
    }

    @Test
    void mimeTypeParametersAreIgnored() throws Exception {
        ObjectNode zip = tagged("Application/Zip; charset=binary", zip(Map.of("out.JSON", "[1,2]")));

        assertThat(normalizer.normalize(zip)).isEqualTo(mapper.readTree("[1,2]"));
    }

    @Test
    void singleOtherFileBecomesOctetStream() throws Exception {
        ObjectNode zip = tagged("application/x-zip-compressed", zip(Map.of("report.csv", "a,b\n1,2\n")));

        JsonNode normalized = normalizer.normalize(zip);

        assertThat(normalized.get("type").asText()).isEqualTo("binary");
        assertThat(normalized.get("mimeType").asText()).isEqualTo("application/octet-stream");
        assertThat(normalized.get("fileName").asText()).isEqualTo("report.csv");
        assertThat(new String(Base64.getDecoder().decode(normalized.get("data").asText()), StandardCharsets.UTF_8))
                .isEqualTo("a,b\n1,2\n");
    }

    @Test
    void invalidJsonFileIsStoredAsBinary() throws Exception {
        ObjectNode zip = tagged("application/zip", zip(Map.of("broken.json", "{not json")));

        JsonNode normalized = normalizer.normalize(zip);

        assertThat(normalized.get("mimeType").asText()).isEqualTo("application/octet-stream");
        assertThat(normalized.get("fileName").asText()).isEqualTo("broken.json");
    }

    @Test
    void multipleFilesKeepTheArchive() throws Exception {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("a.json", "{}");
        files.put("b.json", "{}");
        ObjectNode zip = tagged("application/zip", zip(files));

        assertThat(normalizer.normalize(zip)).isSameAs(zip);
    }

    @Test
    void oversizedFileKeepsTheArchive() throws Exception {
        ResultNormalizer small = new ResultNormalizer(mapper, new ToolLogProperties(
                new ToolLogProperties.DataSource(4, 30),
                new ToolLogProperties.Schema(false),
                new ToolLogProperties.Result(4),
                new ToolLogProperties.Execution(1, 5)));
        ObjectNode zip = tagged("application/zip", zip(Map.of("big.json", "{\"a\":12345}")));

        assertThat(small.normalize(zip)).isSameAs(zip);
    }

    @Test
    void garbageDataKeepsTheOriginal() {
        ObjectNode notBase64 = tagged("application/zip", "%%% not base64 %%%");
        ObjectNode notZip    = tagged("application/zip",
                Base64.getEncoder().encodeToString("plain text".getBytes(StandardCharsets.UTF_8)));

        assertThat(normalizer.normalize(notBase64)).isSameAs(notBase64);
        assertThat(normalizer.normalize(notZip)).isSameAs(notZip);
    }

    @Test
    void recognizesZipMimeTypes() {
        assertThat(ResultNormalizer.isZip(tagged("application/x-zip", "AA=="))).isTrue();
        assertThat(ResultNormalizer.isZip(tagged("multipart/x-zip", "AA=="))).isTrue();
        assertThat(ResultNormalizer.isZip(tagged("application/gzip", "AA=="))).isFalse();
        assertThat(ResultNormalizer.isZip(mapper.createObjectNode().put("mimeType", "application/zip"))).isFalse();
    }

    private ObjectNode tagged(String mimeType, String data) {
        return mapper.createObjectNode()
                .put("type", "binary")
                .put("mimeType", mimeType)
                .put("data", data);
    }

    private static String zip(Map<String, String> files) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream out = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                out.putNextEntry(new ZipEntry(file.getKey()));
                out.write(file.getValue().getBytes(StandardCharsets.UTF_8));
                out.closeEntry();
            }
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }
}
