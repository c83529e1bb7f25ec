package org.iceforge.pivot.web;

import jakarta.validation.Valid;
import org.iceforge.pivot.error.SchemaException;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.service.CubeSchemaLoader;
import org.iceforge.pivot.service.SchemaFormat;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

@RestController
@RequestMapping("/api/schema")
public class SchemaController {

    private final CubeSchemaLoader loader;

    public SchemaController(CubeSchemaLoader loader) {
        this.loader = Objects.requireNonNull(loader);
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<SchemaUploadResponse> upload(@RequestPart("file") FilePart file) {
        SchemaFormat format = SchemaFormat.fromFileName(file.filename())
                .orElseThrow(() -> new SchemaException("Unsupported schema file '" + file.filename()
                        + "'; expected .xml, .yml or .yaml"));
        return DataBufferUtils.join(file.content())
                .map(buffer -> {
                    try {
                        return buffer.toString(StandardCharsets.UTF_8);
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .map(content -> registered(loader.load(content, format)));
    }

    @PostMapping("/upload-text")
    public Mono<SchemaUploadResponse> uploadText(@Valid @RequestBody SchemaTextRequest req) {
        return Mono.fromCallable(() -> {
            List<Cube> cubes = req.getFormat() == null
                    ? loader.load(req.getContent())
                    : loader.load(req.getContent(), format(req.getFormat()));
            return registered(cubes);
        });
    }

    private static SchemaFormat format(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "xml":
                return SchemaFormat.XML;
            case "yml":
            case "yaml":
                return SchemaFormat.YAML;
            default:
                throw new SchemaException("Unsupported schema format '" + value + "'; expected xml or yaml");
        }
    }

    private static SchemaUploadResponse registered(List<Cube> cubes) {
        List<String> names = cubes.stream().map(Cube::name).toList();
        return new SchemaUploadResponse(names, "Registered " + names.size() + " cube(s)");
    }
}
