package com.vidnyan.codequest.domain.level;

import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.model.Language;
import com.vidnyan.codequest.domain.model.Parameter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vidnyan.codequest.domain.GraphFixtures.function;
import static com.vidnyan.codequest.domain.GraphFixtures.graph;
import static com.vidnyan.codequest.domain.GraphFixtures.id;
import static org.junit.jupiter.api.Assertions.*;

class ChallengeSynthesizerTest {

    private final ChallengeSynthesizer synthesizer = new ChallengeSynthesizer();

    @Test
    void selectTypes_SimpleChainShouldOnlyGetMultipleChoice() {
        CallGraph graph = graph().nodes("f", "g").call("f", "g").build();

        List<ChallengeType> types = synthesizer.selectTypes(graph, List.of(id("f"), id("g")), Difficulty.TUTORIAL);

        assertEquals(List.of(ChallengeType.MULTIPLE_CHOICE), types);
    }

    @Test
    void selectTypes_ShouldApplyRulesInOrderAndCapAtFive() {
        // Arrange
        CallGraph graph = graph()
                .node(function("a").complexity(12).decorators(List.of("route")))
                .node(function("b").complexity(12))
                .node(function("c").complexity(12))
                .call("a", "b").call("b", "c")
                .build();
        List<String> chain = List.of(id("a"), id("b"), id("c"));

        // Act
        List<ChallengeType> types = synthesizer.selectTypes(graph, chain, Difficulty.EXPERT);

        // Assert
        assertEquals(List.of(
                ChallengeType.MULTIPLE_CHOICE,
                ChallengeType.CODE_TRACING,
                ChallengeType.FILL_BLANK,
                ChallengeType.CODE_COMPLETION,
                ChallengeType.DEBUGGING), types);
    }

    @Test
    void selectTypes_DecoratedChainShouldGetFillBlank() {
        CallGraph graph = graph()
                .node("f")
                .node(function("g").decorators(List.of("cached")))
                .call("f", "g").build();

        List<ChallengeType> types = synthesizer.selectTypes(graph, List.of(id("f"), id("g")), Difficulty.BASIC);

        assertEquals(List.of(ChallengeType.MULTIPLE_CHOICE, ChallengeType.FILL_BLANK), types);
    }

    @Test
    void multipleChoice_DocumentedEntryShouldAskForPurpose() {
        // Arrange
        CallGraph graph = graph()
                .node(function("load").docstring("Loads the config. Falls back to defaults."))
                .node("parse")
                .call("load", "parse").build();

        // Act
        Challenge challenge = synthesizer.synthesize(
                ChallengeType.MULTIPLE_CHOICE, graph, List.of(id("load"), id("parse")));

        // Assert
        assertEquals("mc_" + id("load"), challenge.id());
        assertEquals(10, challenge.points());
        assertEquals("Loads the config", challenge.answer().get("correct"));
        assertEquals(Set.of("Loads the config", "Parses input", "Validates data", "Formats output"),
                Set.copyOf((List<?>) challenge.question().get("options")));
        assertEquals(List.of("Check the function signature at line 1"), challenge.hints());
    }

    @Test
    void multipleChoice_UndocumentedEntryShouldAskForParameterCount() {
        CallGraph graph = graph()
                .node(function("run").parameters(List.of(Parameter.named("a"), Parameter.named("b"))))
                .node("step")
                .call("run", "step").build();

        Challenge challenge = synthesizer.synthesize(
                ChallengeType.MULTIPLE_CHOICE, graph, List.of(id("run"), id("step")));

        assertEquals("2", challenge.answer().get("correct"));
        assertEquals(Set.of("1", "2", "3", "4"), Set.copyOf((List<?>) challenge.question().get("options")));
    }

    @Test
    void multipleChoice_ZeroParametersShouldNotOfferNegativeCount() {
        CallGraph graph = graph().nodes("run", "step").call("run", "step").build();

        Challenge challenge = synthesizer.synthesize(
                ChallengeType.MULTIPLE_CHOICE, graph, List.of(id("run"), id("step")));

        assertEquals(List.of("0", "1", "2"),
                ((List<?>) challenge.question().get("options")).stream().map(Object::toString).sorted().toList());
    }

    @Test
    void synthesize_ShouldBeDeterministic() {
        CallGraph graph = graph()
                .node(function("load").docstring("Loads the config."))
                .node("parse")
                .call("load", "parse").build();
        List<String> chain = List.of(id("load"), id("parse"));

        Challenge first = synthesizer.synthesize(ChallengeType.MULTIPLE_CHOICE, graph, chain);
        Challenge second = synthesizer.synthesize(ChallengeType.MULTIPLE_CHOICE, graph, chain);

        assertEquals(first, second);
    }

    @Test
    void codeTracing_AnswerShouldBeChainNames() {
        CallGraph graph = graph().nodes("a", "b", "c").call("a", "b").call("b", "c").build();

        Challenge challenge = synthesizer.synthesize(
                ChallengeType.CODE_TRACING, graph, List.of(id("a"), id("b"), id("c")));

        assertEquals("trace_" + id("a"), challenge.id());
        assertEquals(Map.of("chain", List.of("a", "b", "c")), challenge.answer());
        assertEquals(3, challenge.question().get("steps"));
        assertEquals(15, challenge.points());
    }

    @Test
    void fillBlank_ShouldUseFirstDecoratorOrPlaceholder() {
        CallGraph graph = graph()
                .node(function("index").decorators(List.of("app.route('/')", "login_required")))
                .node("render")
                .call("index", "render").build();

        Challenge decorated = synthesizer.synthesize(
                ChallengeType.FILL_BLANK, graph, List.of(id("index"), id("render")));
        Challenge plain = synthesizer.synthesize(
                ChallengeType.FILL_BLANK, graph, List.of(id("render")));

        assertEquals("app.route('/')", decorated.answer().get("fill"));
        assertEquals("@____\ndef index():", decorated.question().get("template"));
        assertEquals("decorator", plain.answer().get("fill"));
        assertEquals(12, decorated.points());
    }

    @Test
    void fillBlank_JavaEntryShouldUseAnnotationTemplate() {
        CallGraph graph = graph()
                .node(function("handle").language(Language.JAVA).decorators(List.of("GetMapping")))
                .build();

        Challenge challenge = synthesizer.synthesize(ChallengeType.FILL_BLANK, graph, List.of(id("handle")));

        assertEquals("@____\nhandle(...)", challenge.question().get("template"));
    }

    @Test
    void codeCompletion_PatternsShouldBeDirectCalleesInChain() {
        CallGraph graph = graph()
                .nodes("main", "a", "b", "c")
                .call("main", "a").call("main", "b").call("a", "c")
                .build();

        Challenge challenge = synthesizer.synthesize(
                ChallengeType.CODE_COMPLETION, graph, List.of(id("main"), id("a"), id("c")));

        assertEquals(Map.of("patterns", List.of("a")), challenge.answer());
        assertEquals("complete_" + id("main"), challenge.id());
        assertEquals(20, challenge.points());
    }

    @Test
    void debugging_PatternShouldBeTerminalName() {
        CallGraph graph = graph().nodes("a", "b", "c").call("a", "b").call("b", "c").build();

        Challenge challenge = synthesizer.synthesize(
                ChallengeType.DEBUGGING, graph, List.of(id("a"), id("b"), id("c")));

        assertEquals(Map.of("patterns", List.of("c")), challenge.answer());
        assertEquals("a → b → c", challenge.question().get("chain"));
    }

    @Test
    void architecture_ShouldPickDecoratorOnlyForDecoratedChains() {
        CallGraph plain = graph().nodes("a", "b").call("a", "b").build();
        CallGraph decorated = graph()
                .node("a")
                .node(function("b").decorators(List.of("cached")))
                .call("a", "b").build();
        List<String> chain = List.of(id("a"), id("b"));

        assertEquals("Facade", synthesizer.synthesize(ChallengeType.ARCHITECTURE, plain, chain).answer().get("pattern"));
        assertEquals("Decorator",
                synthesizer.synthesize(ChallengeType.ARCHITECTURE, decorated, chain).answer().get("pattern"));
    }

    @Test
    void synthesize_UnknownEntryShouldFail() {
        CallGraph graph = graph().node("a").build();

        assertThrows(IllegalArgumentException.class,
                () -> synthesizer.synthesize(ChallengeType.MULTIPLE_CHOICE, graph, List.of(id("ghost"))));
    }

    @Test
    void redacted_ShouldDropAnswerOnly() {
        CallGraph graph = graph().nodes("a", "b").call("a", "b").build();
        Challenge challenge = synthesizer.synthesize(ChallengeType.MULTIPLE_CHOICE, graph, List.of(id("a"), id("b")));

        Challenge redacted = challenge.redacted();

        assertTrue(redacted.answer().isEmpty());
        assertEquals(challenge.question(), redacted.question());
        assertEquals(challenge.points(), redacted.points());
    }

    @Test
    void synthesize_ChallengeShouldBeImmutable() {
        CallGraph graph = graph().nodes("a", "b").call("a", "b").build();
        Challenge challenge = synthesizer.synthesize(ChallengeType.MULTIPLE_CHOICE, graph, List.of(id("a"), id("b")));

        assertThrows(UnsupportedOperationException.class, () -> challenge.question().put("prompt", "changed"));
        assertThrows(UnsupportedOperationException.class,
                () -> ((List<?>) challenge.question().get("options")).clear());
        assertThrows(UnsupportedOperationException.class, () -> challenge.answer().put("correct", "changed"));
    }

    @Test
    void challenge_ShouldCopyPayloadsPassedIn() {
        // Arrange
        List<String> options = new ArrayList<>(List.of("1", "2"));
        Map<String, Object> question = new LinkedHashMap<>();
        question.put("prompt", "How many?");
        question.put("options", options);

        // Act
        Challenge challenge = new Challenge("mc_x", ChallengeType.MULTIPLE_CHOICE, question,
                Map.of("correct", "1"), List.of(), 10);
        question.put("prompt", "changed");
        options.clear();

        // Assert
        assertEquals("How many?", challenge.question().get("prompt"));
        assertEquals(List.of("1", "2"), challenge.question().get("options"));
        assertEquals(List.of("prompt", "options"), List.copyOf(challenge.question().keySet()));
        assertEquals(challenge.question(), challenge.redacted().question());
    }
}
