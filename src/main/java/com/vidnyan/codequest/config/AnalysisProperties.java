package com.vidnyan.codequest.config;

import com.vidnyan.codequest.domain.level.LevelGenerator;
import com.vidnyan.codequest.domain.model.Language;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the analysis run.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "codequest.analysis")
public class AnalysisProperties {

    /**
     * Language of the analyzed sources.
     */
    private Language language = Language.PYTHON;

    /**
     * Maximum number of levels to generate.
     */
    private int maxLevels = LevelGenerator.DEFAULT_MAX_LEVELS;

    /**
     * Depth bound for candidate call chains.
     */
    private int chainDepth = LevelGenerator.DEFAULT_CHAIN_DEPTH;

    /**
     * JSON file for the analysis result. Blank = no export.
     */
    private String outputFile = "";

    /**
     * Graphviz DOT file for the call graph. Blank = no export.
     */
    private String dotFile = "";

    /**
     * Strip challenge answers from the exported result.
     */
    private boolean learnerView = false;

    private boolean enabled = true;
}
