package com.openforge.toollog.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.toollog.config.ToolLogProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Locale;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Prepares a tool result for storage.
 *
 * Results are stored as JSON. A binary result arrives as a tagged value:
 *
 *   { "type": "binary", "mimeType": "application/zip", "data": "<base64>" }
 *
 * When that value is a zip holding exactly one file, the file is unwrapped:
 * a .json file becomes its parsed content; any other file becomes a new
 * tagged value with mimeType application/octet-stream. Every other input,
 * and every failure along the way, returns the original value untouched.
 * {@link #normalize} never throws.
 */
@Slf4j
@Component
public class ResultNormalizer {

    public static final String BINARY_TYPE   = "binary";
    public static final String OCTET_STREAM  = "application/octet-stream";

    private static final Set<String> ZIP_MIME_TYPES = Set.of(
            "application/zip",
            "application/x-zip",
            "application/x-zip-compressed",
            "multipart/x-zip");

    private final ObjectMapper objectMapper;
    private final long         maxUnzippedBytes;

    public ResultNormalizer(ObjectMapper objectMapper, ToolLogProperties properties) {
        this.objectMapper     = objectMapper;
        this.maxUnzippedBytes = properties.result().maxUnzippedBytes();
    }

    public JsonNode normalize(JsonNode result) {
        if (!isZip(result)) return result;
        try {
            JsonNode unwrapped = unwrap(result);
            return unwrapped != null ? unwrapped : result;
        } catch (IOException | RuntimeException e) {
            log.warn("[Result] Could not unwrap zip result, storing it as is: {}", e.getMessage());
            return result;
        }
    }

    /** True for a tagged binary value whose content type is a zip archive. */
    public static boolean isZip(JsonNode value) {
        if (!isTaggedBinary(value)) return false;
        String mimeType = value.get("mimeType").asText().toLowerCase(Locale.ROOT);
        int params = mimeType.indexOf(';');
        if (params >= 0) mimeType = mimeType.substring(0, params).trim();
        return ZIP_MIME_TYPES.contains(mimeType);
    }

    public static boolean isTaggedBinary(JsonNode value) {
        return value != null
                && value.isObject()
                && BINARY_TYPE.equals(value.path("type").asText(null))
                && value.path("mimeType").isTextual()
                && value.path("data").isTextual();
    }

    // ── Private ───────────────────────────────────────────────────────────────

    /** Returns the unwrapped value, or null when the archive is not a single small file. */
    private JsonNode unwrap(JsonNode tagged) throws IOException {
        byte[] archive = Base64.getMimeDecoder().decode(tagged.get("data").asText());

        String entryName  = null;
        byte[] entryBytes = null;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) continue;
                if (entryName != null) {
                    log.debug("[Result] Zip holds more than one file; keeping archive.");
                    return null;
                }
                entryName  = entry.getName();
                entryBytes = zip.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, maxUnzippedBytes + 1));
                if (entryBytes.length > maxUnzippedBytes) {
                    log.debug("[Result] Zip entry '{}' exceeds {} bytes; keeping archive.", entryName, maxUnzippedBytes);
                    return null;
                }
            }
        }
        if (entryName == null) {
            log.debug("[Result] Zip holds no files; keeping archive.");
            return null;
        }

        if (entryName.toLowerCase(Locale.ROOT).endsWith(".json")) {
            JsonNode parsed = parseJson(entryBytes, entryName);
            if (parsed != null) return parsed;
        }
        return binary(entryName, entryBytes);
    }

    private JsonNode parseJson(byte[] bytes, String entryName) {
        try {
            JsonNode parsed = objectMapper.readTree(bytes);
            if (parsed == null || parsed.isMissingNode()) return null;
            log.debug("[Result] Unwrapped JSON file '{}' from zip result.", entryName);
            return parsed;
        } catch (IOException e) {
            log.debug("[Result] Zip entry '{}' is not valid JSON; storing as binary.", entryName);
            return null;
        }
    }

    private ObjectNode binary(String entryName, byte[] bytes) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", BINARY_TYPE);
        node.put("mimeType", OCTET_STREAM);
        node.put("data", Base64.getEncoder().encodeToString(bytes));
        node.put("fileName", entryName);
        return node;
    }
}
