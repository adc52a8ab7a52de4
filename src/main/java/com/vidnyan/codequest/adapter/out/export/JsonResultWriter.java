package com.vidnyan.codequest.adapter.out.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codequest.domain.analysis.AnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an analysis result as indented JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonResultWriter {

    private final ObjectMapper objectMapper;

    /**
     * @param learnerView strip challenge answers before writing
     */
    public void write(AnalysisResult result, Path file, boolean learnerView) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        AnalysisResult payload = learnerView ? result.learnerView() : result;
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), payload);
        log.info("Wrote analysis result to {}", file);
    }
}
