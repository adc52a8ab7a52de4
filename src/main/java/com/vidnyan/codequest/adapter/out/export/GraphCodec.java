package com.vidnyan.codequest.adapter.out.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codequest.domain.analysis.AnalysisResult;
import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.level.Level;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts domain values to and from plain maps of lists and primitives.
 * Decoding a graph rebuilds it, so its metrics are recomputed rather than read back.
 */
@Component
@RequiredArgsConstructor
public class GraphCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Map<String, Object> toMap(CallGraph graph) {
        return objectMapper.convertValue(graph, MAP_TYPE);
    }

    public Map<String, Object> toMap(Level level) {
        return objectMapper.convertValue(level, MAP_TYPE);
    }

    public Map<String, Object> toMap(AnalysisResult result) {
        return objectMapper.convertValue(result, MAP_TYPE);
    }

    public CallGraph graphFromMap(Map<String, Object> map) {
        return objectMapper.convertValue(map, CallGraph.class);
    }

    public Level levelFromMap(Map<String, Object> map) {
        return objectMapper.convertValue(map, Level.class);
    }

    public AnalysisResult resultFromMap(Map<String, Object> map) {
        return objectMapper.convertValue(map, AnalysisResult.class);
    }
}
