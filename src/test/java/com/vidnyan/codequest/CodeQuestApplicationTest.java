package com.vidnyan.codequest;

import com.vidnyan.codequest.adapter.out.export.GraphCodec;
import com.vidnyan.codequest.application.port.in.AnalyzeProjectUseCase;
import com.vidnyan.codequest.application.port.in.AnalyzeProjectUseCase.AnalysisRequest;
import com.vidnyan.codequest.config.AnalysisProperties;
import com.vidnyan.codequest.domain.analysis.AnalysisResult;
import com.vidnyan.codequest.domain.model.Language;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "codequest.analysis.max-levels=3")
class CodeQuestApplicationTest {

    @Autowired
    private AnalyzeProjectUseCase analyzeProjectUseCase;

    @Autowired
    private AnalysisProperties properties;

    @Autowired
    private GraphCodec graphCodec;

    @TempDir
    Path tempDir;

    @Test
    void contextLoads_ShouldBindProperties() {
        assertEquals(3, properties.getMaxLevels());
        assertEquals(5, properties.getChainDepth());
        assertEquals(Language.PYTHON, properties.getLanguage());
        assertTrue(properties.isEnabled());
    }

    @Test
    void analyze_ShouldRunThroughWiredPipeline() throws IOException {
        Files.writeString(tempDir.resolve("app.py"), """
                import flask

                app = flask.Flask(__name__)


                @app.route("/")
                def index():
                    return render(load())


                def load():
                    return []


                def render(items):
                    return str(items)
                """);

        AnalysisResult result = analyzeProjectUseCase.analyze(AnalysisRequest.forPath(tempDir, Language.PYTHON));

        assertTrue(result.valid());
        assertEquals(1, result.callGraph().getEntryPoints().size());
        assertFalse(result.levels().isEmpty());
        Map<String, Object> encoded = graphCodec.toMap(result);
        assertEquals(result.callGraph().getNodes().keySet(),
                graphCodec.resultFromMap(encoded).callGraph().getNodes().keySet());
    }
}
